package io.intellixity.sqlgate.error;

/** Raised by {@link io.intellixity.sqlgate.spi.StatementGenerator} implementations when no statement could be produced. */
public final class GenerationFailedException extends GatewayException {
  public GenerationFailedException(String message) {
    super(ErrorCategory.GENERATION_FAILED, message);
  }

  public GenerationFailedException(String message, Throwable cause) {
    super(ErrorCategory.GENERATION_FAILED, message, cause);
  }
}
