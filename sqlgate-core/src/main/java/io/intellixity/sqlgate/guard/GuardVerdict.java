package io.intellixity.sqlgate.guard;

import java.util.Objects;

/**
 * Outcome of {@link StatementGuard#validate}.\n
 *
 * For accepted statements {@code statement} is the text to execute, which may differ from the input: the trailing
 * terminator is dropped and a row limit may be appended ({@code injectedLimit} is then non-null).\n
 */
public record GuardVerdict(boolean accepted, String statement, String reason, Integer injectedLimit) {

  public static GuardVerdict accepted(String statement, Integer injectedLimit) {
    return new GuardVerdict(true, Objects.requireNonNull(statement, "statement"), null, injectedLimit);
  }

  public static GuardVerdict rejected(String statement, String reason) {
    return new GuardVerdict(false, statement, Objects.requireNonNull(reason, "reason"), null);
  }

  public boolean limitInjected() {
    return injectedLimit != null;
  }
}
