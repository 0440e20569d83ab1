package io.intellixity.sqlgate.gateway;

import io.intellixity.sqlgate.error.GenerationFailedException;
import io.intellixity.sqlgate.error.TenantSuspendedException;
import io.intellixity.sqlgate.guard.GuardVerdict;
import io.intellixity.sqlgate.jdbc.PoolSettings;
import io.intellixity.sqlgate.jdbc.TenantPoolManager;
import io.intellixity.sqlgate.tenant.TenantDescriptor;
import io.intellixity.sqlgate.tenant.TenantDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Entry point for callers: resolves the tenant, runs the correction loop and shapes the response.\n
 *
 * Tenant resolution happens before anything else, so unknown or suspended tenants never reach a pool
 * ({@link io.intellixity.sqlgate.error.TenantNotFoundException} / {@link TenantSuspendedException} are thrown).
 * Failures inside a session are not exceptions: they come back as a response with {@code success=false}.\n
 */
public final class QueryGateway {
  private static final Logger log = LoggerFactory.getLogger(QueryGateway.class);

  private final TenantDirectory directory;
  private final TenantPoolManager pools;
  private final CorrectionLoopController loop;
  private final Clock clock;

  public QueryGateway(TenantDirectory directory, TenantPoolManager pools, CorrectionLoopController loop) {
    this(directory, pools, loop, Clock.systemUTC());
  }

  public QueryGateway(TenantDirectory directory, TenantPoolManager pools, CorrectionLoopController loop, Clock clock) {
    this.directory = Objects.requireNonNull(directory, "directory");
    this.pools = Objects.requireNonNull(pools, "pools");
    this.loop = Objects.requireNonNull(loop, "loop");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /** Natural-language query, optionally seeded with a candidate statement, optionally without executing it. */
  public QueryResponse runQuery(String tenantKey, QueryRequest req) {
    Objects.requireNonNull(req, "req");
    boolean hasIntent = req.intent() != null && !req.intent().isBlank();
    if (!hasIntent && !req.hasSql()) throw new IllegalArgumentException("Either intent or sql is required");
    long start = System.nanoTime();
    TenantDescriptor d = resolveActive(tenantKey);
    int rowLimit = loop.settings().clampRowLimit(req.rowLimit());
    LoopRequest lr = new LoopRequest(d.tenantKey(), req.intent(), d.catalog(), req.hasSql() ? req.sql() : null,
        rowLimit, true);

    if (!req.executes()) {
      try {
        GuardVerdict v = loop.generateOnly(lr);
        return QueryResponse.generated(v, millisSince(start));
      } catch (GenerationFailedException e) {
        log.warn("sqlgate.gateway generation_failed tenant={} error={}", tenantKey, e.getMessage());
        return QueryResponse.generationFailed(e.getMessage(), millisSince(start));
      }
    }
    return QueryResponse.of(loop.run(lr), millisSince(start));
  }

  /** Runs a caller-written statement once through guard and executor; no revision. */
  public QueryResponse executeStatement(String tenantKey, String sql, Integer rowLimit) {
    if (sql == null || sql.isBlank()) throw new IllegalArgumentException("sql is required");
    long start = System.nanoTime();
    TenantDescriptor d = resolveActive(tenantKey);
    int limit = loop.settings().clampRowLimit(rowLimit);
    LoopRequest lr = new LoopRequest(d.tenantKey(), null, d.catalog(), sql, limit, false);
    return QueryResponse.of(loop.run(lr), millisSince(start));
  }

  public TenantSchema describeTenant(String tenantKey) {
    TenantDescriptor d = resolveActive(tenantKey);
    return new TenantSchema(d.tenantKey(), d.catalog(), d.catalog().length(),
        new TenantSchema.DatabaseInfo(d.host(), d.port(), d.database(), d.dbType()));
  }

  public GatewayHealth health() {
    boolean reachable;
    try {
      reachable = directory.ping();
    } catch (RuntimeException e) {
      log.warn("sqlgate.gateway directory_unreachable error={}", e.toString());
      reachable = false;
    }
    PoolSettings ps = pools.settings();
    CorrectionSettings cs = loop.settings();
    Map<String, Object> config = new LinkedHashMap<>();
    config.put("maxResultRows", cs.maxResultRows());
    config.put("maxAttempts", cs.maxAttempts());
    config.put("generationTimeoutMs", cs.generationTimeout().toMillis());
    config.put("queryTimeoutMs", cs.queryTimeout().toMillis());
    config.put("maxConnectionsPerTenant", ps.maxConnections());
    config.put("checkoutTimeoutMs", ps.checkoutTimeout().toMillis());
    config.put("idleTimeoutMs", ps.idleTimeout().toMillis());
    return new GatewayHealth(reachable ? GatewayHealth.HEALTHY : GatewayHealth.DEGRADED, clock.instant(), reachable,
        pools.activePoolCount(), pools.stats(), config);
  }

  /** Forgets cached state for {@code tenantKey}: the directory entry and the tenant's pool. */
  public boolean invalidateTenant(String tenantKey) {
    Objects.requireNonNull(tenantKey, "tenantKey");
    directory.invalidate(tenantKey);
    boolean retired = pools.retire(tenantKey);
    log.info("sqlgate.gateway invalidated tenant={} poolRetired={}", tenantKey, retired);
    return retired;
  }

  private TenantDescriptor resolveActive(String tenantKey) {
    if (tenantKey == null || tenantKey.isBlank()) throw new IllegalArgumentException("tenant key is required");
    TenantDescriptor d = directory.getRequired(tenantKey);
    if (!d.active()) throw new TenantSuspendedException(tenantKey);
    return d;
  }

  private static long millisSince(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000L;
  }
}
