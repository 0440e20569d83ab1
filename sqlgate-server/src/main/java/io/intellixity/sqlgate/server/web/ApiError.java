package io.intellixity.sqlgate.server.web;

/** Error body for requests that never reached a correction session. */
public record ApiError(boolean success, String errorCategory, String message) {

  static ApiError of(String errorCategory, String message) {
    return new ApiError(false, errorCategory, message);
  }
}
