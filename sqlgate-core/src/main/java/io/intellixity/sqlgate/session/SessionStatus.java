package io.intellixity.sqlgate.session;

public enum SessionStatus {
  SUCCEEDED("succeeded"),
  EXHAUSTED("exhausted"),
  REJECTED_BY_GUARD("rejected-by-guard"),
  /** Terminal non-correctable failure (connection, timeout, pool, generation, cancellation). */
  FAILED("failed");

  private final String wireName;

  SessionStatus(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }
}
