package io.intellixity.sqlgate.tenant;

import java.util.Objects;

/**
 * Read-only connection descriptor and catalog for one tenant.\n
 *
 * The password is never rendered by {@link #toString()}.\n
 */
public record TenantDescriptor(String tenantKey,
                               String dbType,
                               String host,
                               int port,
                               String database,
                               String username,
                               String password,
                               String catalog,
                               TenantStatus status) {

  public static final String DEFAULT_DB_TYPE = "postgres";
  public static final int DEFAULT_PORT = 5432;

  public TenantDescriptor {
    Objects.requireNonNull(tenantKey, "tenantKey");
    if (tenantKey.isBlank()) throw new IllegalArgumentException("tenantKey is blank");
    dbType = (dbType == null || dbType.isBlank()) ? DEFAULT_DB_TYPE : dbType.trim();
    port = (port <= 0) ? DEFAULT_PORT : port;
    catalog = (catalog == null) ? "" : catalog;
    status = (status == null) ? TenantStatus.ACTIVE : status;
  }

  public boolean active() {
    return status == TenantStatus.ACTIVE;
  }

  public TenantDescriptor withStatus(TenantStatus newStatus) {
    return new TenantDescriptor(tenantKey, dbType, host, port, database, username, password, catalog, newStatus);
  }

  @Override
  public String toString() {
    return "TenantDescriptor[tenantKey=" + tenantKey
        + ", dbType=" + dbType
        + ", host=" + host
        + ", port=" + port
        + ", database=" + database
        + ", username=" + username
        + ", catalogLength=" + catalog.length()
        + ", status=" + status + "]";
  }
}
