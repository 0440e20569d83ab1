package io.intellixity.sqlgate.server.web;

import io.intellixity.sqlgate.gateway.GatewayHealth;
import io.intellixity.sqlgate.gateway.QueryGateway;
import io.intellixity.sqlgate.gateway.QueryRequest;
import io.intellixity.sqlgate.gateway.QueryResponse;
import io.intellixity.sqlgate.gateway.TenantContext;
import io.intellixity.sqlgate.gateway.TenantSchema;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api")
public final class QueryController {
  private final QueryGateway gateway;

  public QueryController(QueryGateway gateway) {
    this.gateway = gateway;
  }

  public record RunQueryBody(String intent, String sql, Integer rowLimit, Boolean execute) {}

  public record ExecuteBody(String sql, Integer rowLimit) {}

  @PostMapping(value = "/query", consumes = MediaType.APPLICATION_JSON_VALUE)
  public QueryResponse query(@RequestBody RunQueryBody body) {
    QueryRequest req = new QueryRequest(body.intent(), body.sql(), body.rowLimit(), body.execute());
    return gateway.runQuery(TenantContext.currentOrThrow(), req);
  }

  @PostMapping(value = "/execute", consumes = MediaType.APPLICATION_JSON_VALUE)
  public QueryResponse execute(@RequestBody ExecuteBody body) {
    return gateway.executeStatement(TenantContext.currentOrThrow(), body.sql(), body.rowLimit());
  }

  @GetMapping("/schema")
  public TenantSchema schema() {
    return gateway.describeTenant(TenantContext.currentOrThrow());
  }

  @GetMapping("/health")
  public ResponseEntity<GatewayHealth> health() {
    GatewayHealth h = gateway.health();
    return ResponseEntity.status(h.healthy() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(h);
  }

  @DeleteMapping("/tenants/{key}/cache")
  public Map<String, Object> invalidate(@PathVariable("key") String key) {
    return Map.of("tenantKey", key, "poolRetired", gateway.invalidateTenant(key));
  }
}
