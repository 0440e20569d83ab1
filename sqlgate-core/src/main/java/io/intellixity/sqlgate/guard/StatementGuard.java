package io.intellixity.sqlgate.guard;

/**
 * Pre-execution lexical policy check for read-only, single-statement SQL.\n
 *
 * Implementations never throw for malformed input; rejections carry a human-readable reason.\n
 */
public interface StatementGuard {

  /** Validate using the configured default row limit. */
  GuardVerdict validate(String statement);

  /** Validate, appending {@code rowLimit} when the statement has no row-limiting clause. */
  GuardVerdict validate(String statement, int rowLimit);
}
