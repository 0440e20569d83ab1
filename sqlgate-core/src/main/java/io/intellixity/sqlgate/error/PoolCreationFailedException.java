package io.intellixity.sqlgate.error;

/** The tenant's pool could not be created (bad descriptor or unreachable database). Not retried internally. */
public final class PoolCreationFailedException extends GatewayException {
  private final String tenantKey;

  public PoolCreationFailedException(String tenantKey, Throwable cause) {
    super(ErrorCategory.POOL_CREATION_FAILED,
        "Failed to connect to database for tenant " + tenantKey + ": " + rootMessage(cause), cause);
    this.tenantKey = tenantKey;
  }

  public String tenantKey() {
    return tenantKey;
  }

  private static String rootMessage(Throwable t) {
    if (t == null) return "unknown cause";
    Throwable c = t;
    while (c.getCause() != null && c.getCause() != c) c = c.getCause();
    String m = c.getMessage();
    return (m == null || m.isBlank()) ? c.getClass().getSimpleName() : m;
  }
}
