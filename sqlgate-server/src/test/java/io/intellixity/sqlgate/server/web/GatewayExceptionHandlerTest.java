package io.intellixity.sqlgate.server.web;

import io.intellixity.sqlgate.error.CheckoutTimeoutException;
import io.intellixity.sqlgate.error.PoolCreationFailedException;
import io.intellixity.sqlgate.error.TenantNotFoundException;
import io.intellixity.sqlgate.error.TenantSuspendedException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.sql.SQLException;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

final class GatewayExceptionHandlerTest {

  @Test
  void mapsCategoriesToStatuses() {
    assertEquals(HttpStatus.NOT_FOUND, GatewayExceptionHandler.statusOf(new TenantNotFoundException("a")));
    assertEquals(HttpStatus.FORBIDDEN, GatewayExceptionHandler.statusOf(new TenantSuspendedException("a")));
    assertEquals(HttpStatus.BAD_GATEWAY,
        GatewayExceptionHandler.statusOf(new PoolCreationFailedException("a", new SQLException("refused", "08001"))));
    assertEquals(HttpStatus.SERVICE_UNAVAILABLE,
        GatewayExceptionHandler.statusOf(new CheckoutTimeoutException("a", Duration.ofSeconds(10))));
  }

  @Test
  void bodyCarriesWireCategory() {
    ResponseEntity<ApiError> r = new GatewayExceptionHandler().gateway(new TenantNotFoundException("ghost"));

    assertEquals(404, r.getStatusCode().value());
    assertNotNull(r.getBody());
    assertFalse(r.getBody().success());
    assertEquals("tenant-not-found", r.getBody().errorCategory());
  }
}
