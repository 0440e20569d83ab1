package io.intellixity.sqlgate.tenant;

import io.intellixity.sqlgate.error.TenantNotFoundException;

import java.util.Objects;

/**
 * Application-provided lookup from an opaque tenant key to that tenant's descriptor.\n
 *
 * Implementations are backed by an external store (the admin database, static configuration, ...).\n
 */
public interface TenantDirectory {

  /** Return the descriptor for {@code tenantKey}, or null if the key is unknown. */
  TenantDescriptor get(String tenantKey);

  /** Return the descriptor for {@code tenantKey}; throws if the key is unknown. */
  default TenantDescriptor getRequired(String tenantKey) {
    Objects.requireNonNull(tenantKey, "tenantKey");
    TenantDescriptor d = get(tenantKey);
    if (d == null) throw new TenantNotFoundException(tenantKey);
    return d;
  }

  /** True if the backing store is reachable. */
  default boolean ping() {
    return true;
  }

  /** Drop any locally cached state for {@code tenantKey}. */
  default void invalidate(String tenantKey) {
  }
}
