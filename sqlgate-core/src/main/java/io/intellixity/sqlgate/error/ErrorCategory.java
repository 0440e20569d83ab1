package io.intellixity.sqlgate.error;

import java.util.Locale;

/**
 * Classification of every way a gateway request can fail.\n
 *
 * Only {@link #SYNTAX_OR_SEMANTIC_ERROR} is correctable by revising the statement; everything else ends the
 * correction loop.\n
 */
public enum ErrorCategory {
  /** Statement rejected by the read-only guard; never executed. */
  GUARD_REJECTION(false),
  /** Network or authentication failure talking to the tenant database. */
  CONNECTION_ERROR(true),
  /** Execution exceeded the wall clock. */
  TIMEOUT(false),
  /** The database rejected the statement text itself. */
  SYNTAX_OR_SEMANTIC_ERROR(false),
  RETRY_BUDGET_EXHAUSTED(false),
  POOL_CREATION_FAILED(false),
  /** All connections of the tenant pool stayed busy past the checkout bound. */
  CHECKOUT_TIMEOUT(true),
  TENANT_NOT_FOUND(false),
  TENANT_SUSPENDED(false),
  /** The statement-generation collaborator failed or timed out. */
  GENERATION_FAILED(true),
  /** The caller abandoned the request. */
  CANCELLED(false);

  private final boolean retryable;

  ErrorCategory(boolean retryable) {
    this.retryable = retryable;
  }

  public boolean correctable() {
    return this == SYNTAX_OR_SEMANTIC_ERROR;
  }

  /** True if re-issuing the whole request later may succeed without changing it. */
  public boolean retryable() {
    return retryable;
  }

  public String wireName() {
    return name().toLowerCase(Locale.ROOT).replace('_', '-');
  }
}
