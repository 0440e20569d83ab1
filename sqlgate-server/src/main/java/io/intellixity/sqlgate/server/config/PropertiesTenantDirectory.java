package io.intellixity.sqlgate.server.config;

import io.intellixity.sqlgate.tenant.TenantDescriptor;
import io.intellixity.sqlgate.tenant.TenantDirectory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/** Tenants declared under {@code sqlgate.tenants.<key>}; used when no admin database is configured. */
public final class PropertiesTenantDirectory implements TenantDirectory {
  private final Map<String, TenantDescriptor> tenants = new ConcurrentHashMap<>();

  public PropertiesTenantDirectory(Map<String, SqlGateProperties.StaticTenant> declared) {
    Objects.requireNonNull(declared, "declared");
    declared.forEach((key, t) -> tenants.put(key, t.toDescriptor(key)));
  }

  @Override
  public TenantDescriptor get(String tenantKey) {
    return tenants.get(tenantKey);
  }

  public int size() {
    return tenants.size();
  }
}
