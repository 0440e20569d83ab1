package io.intellixity.sqlgate.gateway;

/**
 * @param intent   natural-language question
 * @param sql      optional first candidate statement; revisions still come from the generator
 * @param rowLimit requested row limit, clamped to the configured maximum
 * @param execute  false returns the validated statement without running it; null means true
 */
public record QueryRequest(String intent, String sql, Integer rowLimit, Boolean execute) {

  public static QueryRequest of(String intent) {
    return new QueryRequest(intent, null, null, null);
  }

  public boolean executes() {
    return execute == null || execute;
  }

  boolean hasSql() {
    return sql != null && !sql.isBlank();
  }
}
