package io.intellixity.sqlgate.jdbc;

import io.intellixity.sqlgate.error.ErrorCategory;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;

import static org.junit.jupiter.api.Assertions.*;

final class DefaultSqlErrorClassifierTest {
  private final DefaultSqlErrorClassifier c = new DefaultSqlErrorClassifier();

  private ErrorCategory category(String state) {
    return c.classify(new SQLException("boom", state)).category();
  }

  @Test
  void connectionClasses() {
    assertEquals(ErrorCategory.CONNECTION_ERROR, category("08006"));
    assertEquals(ErrorCategory.CONNECTION_ERROR, category("28P01"));
    assertEquals(ErrorCategory.CONNECTION_ERROR, category("53300"));
    assertEquals(ErrorCategory.CONNECTION_ERROR, category("57P01"));
    assertEquals(ErrorCategory.CONNECTION_ERROR,
        c.classify(new SQLTransientConnectionException("pool exhausted")).category());
  }

  @Test
  void cancelAndTimeout() {
    assertEquals(ErrorCategory.TIMEOUT, category("57014"));
    assertEquals(ErrorCategory.TIMEOUT, c.classify(new SQLTimeoutException("slow")).category());
  }

  @Test
  void statementProblems_areCorrectable() {
    assertEquals(ErrorCategory.SYNTAX_OR_SEMANTIC_ERROR, category("42703"));
    assertEquals(ErrorCategory.SYNTAX_OR_SEMANTIC_ERROR, category("42601"));
    assertEquals(ErrorCategory.SYNTAX_OR_SEMANTIC_ERROR, category("22012"));
    assertEquals(ErrorCategory.SYNTAX_OR_SEMANTIC_ERROR, category(null));
  }

  @Test
  void sqlStateIsTakenFromCauseChain() {
    SQLException inner = new SQLException("connection reset", "08006");
    SQLException outer = new SQLException("wrapped", null, inner);
    assertEquals(ErrorCategory.CONNECTION_ERROR, c.classify(outer).category());
    assertEquals("08006", c.classify(outer).sqlState());
  }
}
