package io.intellixity.sqlgate.server.web;

import io.intellixity.sqlgate.error.GatewayException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps request-level failures to HTTP statuses.\n
 *
 * Failures inside a correction session are not exceptions; they are returned by the controller as 200 with
 * {@code success=false}.\n
 */
@RestControllerAdvice
public final class GatewayExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(GatewayExceptionHandler.class);

  @ExceptionHandler(GatewayException.class)
  public ResponseEntity<ApiError> gateway(GatewayException e) {
    HttpStatus status = statusOf(e);
    if (status.is5xxServerError()) {
      log.warn("sqlgate.http failed category={} error={}", e.category().wireName(), e.getMessage());
    }
    return ResponseEntity.status(status).body(ApiError.of(e.category().wireName(), e.getMessage()));
  }

  @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
  public ResponseEntity<ApiError> badRequest(Exception e) {
    return ResponseEntity.badRequest().body(ApiError.of("bad-request", e.getMessage()));
  }

  static HttpStatus statusOf(GatewayException e) {
    switch (e.category()) {
      case TENANT_NOT_FOUND:
        return HttpStatus.NOT_FOUND;
      case TENANT_SUSPENDED:
        return HttpStatus.FORBIDDEN;
      case POOL_CREATION_FAILED:
        return HttpStatus.BAD_GATEWAY;
      case CHECKOUT_TIMEOUT:
        return HttpStatus.SERVICE_UNAVAILABLE;
      case TIMEOUT:
        return HttpStatus.GATEWAY_TIMEOUT;
      case GUARD_REJECTION:
        return HttpStatus.BAD_REQUEST;
      default:
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }
  }
}
