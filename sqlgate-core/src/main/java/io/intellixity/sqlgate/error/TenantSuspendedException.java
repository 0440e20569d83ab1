package io.intellixity.sqlgate.error;

public final class TenantSuspendedException extends GatewayException {
  private final String tenantKey;

  public TenantSuspendedException(String tenantKey) {
    super(ErrorCategory.TENANT_SUSPENDED, "Tenant " + tenantKey + " is not active.");
    this.tenantKey = tenantKey;
  }

  public String tenantKey() {
    return tenantKey;
  }
}
