package io.intellixity.sqlgate.error;

import java.util.Objects;

/** Base of all categorized gateway failures. */
public class GatewayException extends RuntimeException {
  private final ErrorCategory category;

  public GatewayException(ErrorCategory category, String message) {
    super(message);
    this.category = Objects.requireNonNull(category, "category");
  }

  public GatewayException(ErrorCategory category, String message, Throwable cause) {
    super(message, cause);
    this.category = Objects.requireNonNull(category, "category");
  }

  public ErrorCategory category() {
    return category;
  }
}
