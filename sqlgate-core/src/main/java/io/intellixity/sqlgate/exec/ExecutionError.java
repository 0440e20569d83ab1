package io.intellixity.sqlgate.exec;

import io.intellixity.sqlgate.error.ErrorCategory;

import java.util.Objects;

/** Classified failure of one execution; {@code sqlState} is null when the failure did not come from the driver. */
public record ExecutionError(ErrorCategory category, String message, String sqlState) {
  public ExecutionError {
    Objects.requireNonNull(category, "category");
    message = (message == null || message.isBlank()) ? category.wireName() : message;
  }

  public ExecutionError(ErrorCategory category, String message) {
    this(category, message, null);
  }
}
