package io.intellixity.sqlgate.session;

import io.intellixity.sqlgate.error.ErrorCategory;
import io.intellixity.sqlgate.exec.QueryResult;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * One try inside a correction session. Immutable once created.\n
 *
 * Exactly one of {@code result} / {@code errorCategory} is set.\n
 */
public record QueryAttempt(String tenantKey,
                           int number,
                           String statement,
                           Instant startedAt,
                           Instant finishedAt,
                           QueryResult result,
                           ErrorCategory errorCategory,
                           String message) {

  public QueryAttempt {
    Objects.requireNonNull(tenantKey, "tenantKey");
    Objects.requireNonNull(startedAt, "startedAt");
    Objects.requireNonNull(finishedAt, "finishedAt");
    if (number < 1) throw new IllegalArgumentException("attempt number must be >= 1");
    if ((result == null) == (errorCategory == null)) {
      throw new IllegalArgumentException("Exactly one of result/errorCategory must be set");
    }
  }

  public static QueryAttempt succeeded(String tenantKey, int number, String statement,
                                       Instant startedAt, Instant finishedAt, QueryResult result) {
    return new QueryAttempt(tenantKey, number, statement, startedAt, finishedAt,
        Objects.requireNonNull(result, "result"), null, null);
  }

  public static QueryAttempt failed(String tenantKey, int number, String statement,
                                    Instant startedAt, Instant finishedAt,
                                    ErrorCategory category, String message) {
    return new QueryAttempt(tenantKey, number, statement, startedAt, finishedAt,
        null, Objects.requireNonNull(category, "category"), message);
  }

  public boolean isSuccess() {
    return result != null;
  }

  /** True if this attempt reached the executor. */
  public boolean executed() {
    return errorCategory != ErrorCategory.GUARD_REJECTION && errorCategory != ErrorCategory.GENERATION_FAILED;
  }

  public Duration elapsed() {
    return Duration.between(startedAt, finishedAt);
  }
}
