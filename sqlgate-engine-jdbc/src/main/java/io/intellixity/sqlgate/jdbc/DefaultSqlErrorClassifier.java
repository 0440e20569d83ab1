package io.intellixity.sqlgate.jdbc;

import io.intellixity.sqlgate.error.ErrorCategory;
import io.intellixity.sqlgate.exec.ExecutionError;

import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;

/**
 * SQLState based classification, portable across drivers.\n
 *
 * - class 08 (connection exception), 28 (invalid authorization), 53 (insufficient resources) and
 *   57P01..57P03 (server shutdown) map to {@link ErrorCategory#CONNECTION_ERROR}\n
 * - 57014 (query canceled) maps to {@link ErrorCategory#TIMEOUT}\n
 * - everything else is a problem with the statement text: {@link ErrorCategory#SYNTAX_OR_SEMANTIC_ERROR}\n
 *
 * Class 40 (transaction rollback: serialization failure, deadlock) keeps its category but is transient, so the
 * executor re-issues it once like a dropped connection.\n
 */
public class DefaultSqlErrorClassifier implements SqlErrorClassifier {

  @Override
  public ExecutionError classify(SQLException e) {
    String state = sqlState(e);
    return new ExecutionError(categorize(e, state), message(e), state);
  }

  @Override
  public boolean isTransient(ExecutionError error) {
    if (error.category() == ErrorCategory.CONNECTION_ERROR) return true;
    String state = error.sqlState();
    return state != null && state.startsWith("40");
  }

  protected ErrorCategory categorize(SQLException e, String state) {
    if (e instanceof SQLTimeoutException) return ErrorCategory.TIMEOUT;
    if (e instanceof SQLTransientConnectionException
        || e instanceof SQLNonTransientConnectionException
        || e instanceof SQLRecoverableException) {
      return ErrorCategory.CONNECTION_ERROR;
    }
    if (state == null) return ErrorCategory.SYNTAX_OR_SEMANTIC_ERROR;
    if ("57014".equals(state)) return ErrorCategory.TIMEOUT;
    if (state.startsWith("08") || state.startsWith("28") || state.startsWith("53") || state.startsWith("57P0")) {
      return ErrorCategory.CONNECTION_ERROR;
    }
    return ErrorCategory.SYNTAX_OR_SEMANTIC_ERROR;
  }

  protected String message(SQLException e) {
    String m = e.getMessage();
    return (m == null || m.isBlank()) ? e.getClass().getSimpleName() : m.trim();
  }

  // first SQLState along the cause chain; drivers often wrap the interesting one
  static String sqlState(SQLException e) {
    Throwable t = e;
    while (t != null) {
      if (t instanceof SQLException se && se.getSQLState() != null) return se.getSQLState();
      t = t.getCause();
    }
    return null;
  }
}
