package io.intellixity.sqlgate.error;

public final class TenantNotFoundException extends GatewayException {
  private final String tenantKey;

  public TenantNotFoundException(String tenantKey) {
    super(ErrorCategory.TENANT_NOT_FOUND, "Tenant " + tenantKey + " not found. Please complete onboarding first.");
    this.tenantKey = tenantKey;
  }

  public String tenantKey() {
    return tenantKey;
  }
}
