package io.intellixity.sqlgate.gateway;

/** Catalog and non-secret connection facts of one tenant. */
public record TenantSchema(String tenantKey, String catalog, int catalogLength, DatabaseInfo database) {

  public record DatabaseInfo(String host, int port, String database, String dbType) {}
}
