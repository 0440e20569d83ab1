package io.intellixity.sqlgate.spi;

/**
 * Black-box natural-language-to-SQL collaborator.\n
 *
 * Its output is untrusted and is always re-validated by the statement guard. Implementations should respond to
 * thread interruption; the correction loop interrupts a generation call that exceeds its timeout or whose caller
 * went away.\n
 */
@FunctionalInterface
public interface StatementGenerator {
  /**
   * @return the candidate statement
   * @throws io.intellixity.sqlgate.error.GenerationFailedException if no statement could be produced
   */
  String generate(GenerationRequest request);
}
