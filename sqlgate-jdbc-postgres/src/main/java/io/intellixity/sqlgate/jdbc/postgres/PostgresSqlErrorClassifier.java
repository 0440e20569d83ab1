package io.intellixity.sqlgate.jdbc.postgres;

import io.intellixity.sqlgate.error.ErrorCategory;
import io.intellixity.sqlgate.jdbc.DefaultSqlErrorClassifier;
import org.postgresql.util.PSQLException;
import org.postgresql.util.PSQLState;
import org.postgresql.util.ServerErrorMessage;

import java.sql.SQLException;

/**
 * PostgreSQL refinement of the SQLState classification.\n
 *
 * Serialization failures and deadlocks are reported as statement errors and retried as transient by the base class.
 * Server hints are appended to the message so a revision can use them.\n
 */
public final class PostgresSqlErrorClassifier extends DefaultSqlErrorClassifier {

  @Override
  protected ErrorCategory categorize(SQLException e, String state) {
    if (is(state, PSQLState.QUERY_CANCELED)) return ErrorCategory.TIMEOUT;
    if (is(state, PSQLState.CONNECTION_FAILURE)
        || is(state, PSQLState.CONNECTION_UNABLE_TO_CONNECT)
        || is(state, PSQLState.CONNECTION_DOES_NOT_EXIST)
        || is(state, PSQLState.INVALID_PASSWORD)) {
      return ErrorCategory.CONNECTION_ERROR;
    }
    return super.categorize(e, state);
  }

  @Override
  protected String message(SQLException e) {
    String base = super.message(e);
    if (!(e instanceof PSQLException pe)) return base;
    ServerErrorMessage sem = pe.getServerErrorMessage();
    if (sem == null || sem.getHint() == null || sem.getHint().isBlank()) return base;
    return base + " Hint: " + sem.getHint();
  }

  private static boolean is(String state, PSQLState expected) {
    return expected.getState().equals(state);
  }
}
