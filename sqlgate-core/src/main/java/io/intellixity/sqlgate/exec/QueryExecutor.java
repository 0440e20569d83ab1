package io.intellixity.sqlgate.exec;

import java.time.Duration;

/**
 * Runs an already-guarded statement against a tenant's pool.\n
 *
 * Implementations never throw for database failures: every failure is classified into an
 * {@link ExecutionError}. An interrupted caller yields {@link io.intellixity.sqlgate.error.ErrorCategory#CANCELLED}
 * with the thread's interrupt flag restored, and the in-flight statement is cancelled.\n
 */
public interface QueryExecutor {
  ExecutionOutcome execute(String tenantKey, String statement, Duration timeout, int rowCap);
}
