package io.intellixity.sqlgate.gateway;

import java.time.Duration;

/**
 * @param maxAttempts       attempts per session, the first one included
 * @param generationTimeout bound on one call to the statement generator
 * @param maxResultRows     ceiling for the per-request row limit
 * @param queryTimeout      wall-clock bound handed to the executor for every attempt
 */
public record CorrectionSettings(int maxAttempts, Duration generationTimeout, int maxResultRows, Duration queryTimeout) {

  public static final int DEFAULT_MAX_ATTEMPTS = 5;
  public static final Duration DEFAULT_GENERATION_TIMEOUT = Duration.ofSeconds(15);
  public static final int DEFAULT_MAX_RESULT_ROWS = 1000;
  public static final Duration DEFAULT_QUERY_TIMEOUT = Duration.ofSeconds(30);

  public CorrectionSettings {
    if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
    if (maxResultRows < 1) throw new IllegalArgumentException("maxResultRows must be >= 1");
    generationTimeout = positive(generationTimeout, DEFAULT_GENERATION_TIMEOUT);
    queryTimeout = positive(queryTimeout, DEFAULT_QUERY_TIMEOUT);
  }

  public static CorrectionSettings defaults() {
    return new CorrectionSettings(DEFAULT_MAX_ATTEMPTS, DEFAULT_GENERATION_TIMEOUT, DEFAULT_MAX_RESULT_ROWS,
        DEFAULT_QUERY_TIMEOUT);
  }

  /** Effective row limit for a request: missing or non-positive means the maximum, larger values are clamped. */
  public int clampRowLimit(Integer requested) {
    if (requested == null || requested <= 0) return maxResultRows;
    return Math.min(requested, maxResultRows);
  }

  private static Duration positive(Duration d, Duration fallback) {
    return (d == null || d.isZero() || d.isNegative()) ? fallback : d;
  }
}
