package io.intellixity.sqlgate.error;

import java.time.Duration;

public final class CheckoutTimeoutException extends GatewayException {
  private final String tenantKey;
  private final Duration waited;

  public CheckoutTimeoutException(String tenantKey, Duration waited) {
    super(ErrorCategory.CHECKOUT_TIMEOUT,
        "All connections for tenant " + tenantKey + " stayed busy for " + waited.toMillis() + "ms");
    this.tenantKey = tenantKey;
    this.waited = waited;
  }

  public String tenantKey() {
    return tenantKey;
  }

  public Duration waited() {
    return waited;
  }
}
