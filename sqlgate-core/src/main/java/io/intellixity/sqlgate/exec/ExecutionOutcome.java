package io.intellixity.sqlgate.exec;

import java.time.Duration;
import java.util.Objects;

/** Either a {@link QueryResult} or an {@link ExecutionError}, never both. */
public record ExecutionOutcome(QueryResult result, ExecutionError error, Duration elapsed) {

  public ExecutionOutcome {
    if ((result == null) == (error == null)) {
      throw new IllegalArgumentException("Exactly one of result/error must be set");
    }
    elapsed = elapsed == null ? Duration.ZERO : elapsed;
  }

  public static ExecutionOutcome success(QueryResult result) {
    Objects.requireNonNull(result, "result");
    return new ExecutionOutcome(result, null, result.elapsed());
  }

  public static ExecutionOutcome failure(ExecutionError error, Duration elapsed) {
    return new ExecutionOutcome(null, Objects.requireNonNull(error, "error"), elapsed);
  }

  public boolean isSuccess() {
    return result != null;
  }
}
