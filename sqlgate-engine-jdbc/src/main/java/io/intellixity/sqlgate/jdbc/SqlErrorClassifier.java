package io.intellixity.sqlgate.jdbc;

import io.intellixity.sqlgate.error.ErrorCategory;
import io.intellixity.sqlgate.exec.ExecutionError;

import java.sql.SQLException;

/** Maps a driver exception onto the gateway's error taxonomy. */
@FunctionalInterface
public interface SqlErrorClassifier {
  ExecutionError classify(SQLException e);

  /** True if the same statement may succeed when re-issued on a fresh connection. */
  default boolean isTransient(ExecutionError error) {
    return error.category() == ErrorCategory.CONNECTION_ERROR;
  }
}
