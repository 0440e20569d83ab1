package io.intellixity.sqlgate.gateway;

import java.util.Objects;

/**
 * Input of one correction loop run.\n
 *
 * @param initialStatement first candidate; null means ask the generator
 * @param rowLimit         already clamped row limit, used both for limit injection and as the executor row cap
 * @param revise           false runs the candidate once and reports correctable errors as-is
 */
public record LoopRequest(String tenantKey,
                          String intent,
                          String catalog,
                          String initialStatement,
                          int rowLimit,
                          boolean revise) {

  public LoopRequest {
    Objects.requireNonNull(tenantKey, "tenantKey");
    if (rowLimit < 1) throw new IllegalArgumentException("rowLimit must be >= 1");
    catalog = catalog == null ? "" : catalog;
    if (initialStatement == null && (intent == null || intent.isBlank())) {
      throw new IllegalArgumentException("Either an intent or an initial statement is required");
    }
  }
}
