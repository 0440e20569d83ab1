package io.intellixity.sqlgate.jdbc;

import java.time.Duration;

/**
 * @param queryTimeout     wall-clock bound used when the caller passes none
 * @param cancelGrace      how long to wait for a cancelled statement to unwind before releasing its connection
 * @param transportRetries extra tries after a {@code CONNECTION_ERROR}
 */
public record ExecutorSettings(Duration queryTimeout, Duration cancelGrace, int transportRetries) {

  public static final Duration DEFAULT_QUERY_TIMEOUT = Duration.ofSeconds(30);
  public static final Duration DEFAULT_CANCEL_GRACE = Duration.ofSeconds(5);
  public static final int DEFAULT_TRANSPORT_RETRIES = 1;

  public ExecutorSettings {
    if (queryTimeout == null || queryTimeout.isZero() || queryTimeout.isNegative()) queryTimeout = DEFAULT_QUERY_TIMEOUT;
    if (cancelGrace == null || cancelGrace.isNegative()) cancelGrace = DEFAULT_CANCEL_GRACE;
    if (transportRetries < 0) throw new IllegalArgumentException("transportRetries must be >= 0");
  }

  public static ExecutorSettings defaults() {
    return new ExecutorSettings(DEFAULT_QUERY_TIMEOUT, DEFAULT_CANCEL_GRACE, DEFAULT_TRANSPORT_RETRIES);
  }
}
