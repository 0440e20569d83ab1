package io.intellixity.sqlgate.gateway;

import io.intellixity.sqlgate.gateway.internal.LruTtlCache;
import io.intellixity.sqlgate.tenant.TenantDescriptor;
import io.intellixity.sqlgate.tenant.TenantDirectory;

import java.time.Duration;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Read-mostly cache in front of a slower {@link TenantDirectory}.\n
 *
 * Entries live for a short TTL so edits made by the admin service become visible without a restart;
 * {@link #invalidate} makes them visible immediately. Unknown keys are not cached.\n
 */
public final class CachingTenantDirectory implements TenantDirectory {
  public static final Duration DEFAULT_TTL = Duration.ofSeconds(60);
  public static final int DEFAULT_MAX_ENTRIES = 1000;

  private final TenantDirectory delegate;
  private final LruTtlCache<String, TenantDescriptor> cache;

  public CachingTenantDirectory(TenantDirectory delegate) {
    this(delegate, DEFAULT_MAX_ENTRIES, DEFAULT_TTL, System::currentTimeMillis);
  }

  public CachingTenantDirectory(TenantDirectory delegate, int maxEntries, Duration ttl, LongSupplier nowMillis) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.cache = new LruTtlCache<>(maxEntries, ttl.toMillis(), nowMillis);
  }

  @Override
  public TenantDescriptor get(String tenantKey) {
    Objects.requireNonNull(tenantKey, "tenantKey");
    TenantDescriptor cached = cache.get(tenantKey);
    if (cached != null) return cached;
    TenantDescriptor loaded = delegate.get(tenantKey);
    if (loaded != null) cache.put(tenantKey, loaded);
    return loaded;
  }

  @Override
  public boolean ping() {
    return delegate.ping();
  }

  @Override
  public void invalidate(String tenantKey) {
    cache.invalidate(tenantKey);
    delegate.invalidate(tenantKey);
  }

  public int cachedCount() {
    return cache.size();
  }
}
