package io.intellixity.sqlgate.jdbc;

import java.time.Duration;

/**
 * Per-tenant pool limits.\n
 *
 * @param minIdle          connections the underlying data source keeps warm
 * @param maxConnections   concurrent checkouts allowed per tenant
 * @param checkoutTimeout  how long a checkout waits for a free connection
 * @param idleTimeout      a pool with no checkouts for this long is torn down
 * @param evictionInterval how often idle pools are swept; zero disables the background sweep
 */
public record PoolSettings(int minIdle,
                           int maxConnections,
                           Duration checkoutTimeout,
                           Duration idleTimeout,
                           Duration evictionInterval) {

  public static final int DEFAULT_MIN_IDLE = 1;
  public static final int DEFAULT_MAX_CONNECTIONS = 5;
  public static final Duration DEFAULT_CHECKOUT_TIMEOUT = Duration.ofSeconds(10);
  public static final Duration DEFAULT_IDLE_TIMEOUT = Duration.ofMinutes(10);
  public static final Duration DEFAULT_EVICTION_INTERVAL = Duration.ofSeconds(30);

  public PoolSettings {
    if (maxConnections <= 0) throw new IllegalArgumentException("maxConnections must be > 0");
    if (minIdle < 0) throw new IllegalArgumentException("minIdle must be >= 0");
    if (minIdle > maxConnections) minIdle = maxConnections;
    checkoutTimeout = positive(checkoutTimeout, DEFAULT_CHECKOUT_TIMEOUT);
    idleTimeout = positive(idleTimeout, DEFAULT_IDLE_TIMEOUT);
    evictionInterval = evictionInterval == null ? DEFAULT_EVICTION_INTERVAL : evictionInterval;
    if (evictionInterval.isNegative()) throw new IllegalArgumentException("evictionInterval must be >= 0");
  }

  public static PoolSettings defaults() {
    return new PoolSettings(DEFAULT_MIN_IDLE, DEFAULT_MAX_CONNECTIONS, DEFAULT_CHECKOUT_TIMEOUT,
        DEFAULT_IDLE_TIMEOUT, DEFAULT_EVICTION_INTERVAL);
  }

  private static Duration positive(Duration d, Duration fallback) {
    return (d == null || d.isZero() || d.isNegative()) ? fallback : d;
  }
}
