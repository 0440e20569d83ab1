package io.intellixity.sqlgate.jdbc.postgres;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.sqlgate.session.CorrectionSession;
import io.intellixity.sqlgate.spi.AuditSink;
import org.postgresql.util.PGobject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Appends one row per finished session to the admin audit table
 * ({@code user_email, action = 'query', details}).\n
 *
 * Writes are synchronous and fail loudly; wrap in an asynchronous dispatcher on the request path.\n
 */
public final class JdbcAuditSink implements AuditSink {
  private static final Logger log = LoggerFactory.getLogger(JdbcAuditSink.class);

  public static final String DEFAULT_TABLE = "onboarding_audit_log";
  public static final String ACTION = "query";

  /** How the {@code details} column is bound. */
  public enum DetailsBinding { JSONB, TEXT }

  private final DataSource admin;
  private final ObjectMapper mapper;
  private final DetailsBinding binding;
  private final String insertSql;

  public JdbcAuditSink(DataSource admin, ObjectMapper mapper) {
    this(admin, mapper, DEFAULT_TABLE, DetailsBinding.JSONB);
  }

  public JdbcAuditSink(DataSource admin, ObjectMapper mapper, String table, DetailsBinding binding) {
    this.admin = Objects.requireNonNull(admin, "admin");
    this.mapper = Objects.requireNonNull(mapper, "mapper");
    this.binding = Objects.requireNonNull(binding, "binding");
    this.insertSql = "INSERT INTO " + SqlNames.requireTableName(table) + " (user_email, action, details) VALUES (?, ?, ?)";
  }

  @Override
  public void record(CorrectionSession session) {
    String json;
    try {
      json = mapper.writeValueAsString(session);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Could not serialize session " + session.sessionId(), e);
    }
    try (Connection c = admin.getConnection(); PreparedStatement ps = c.prepareStatement(insertSql)) {
      ps.setString(1, session.tenantKey());
      ps.setString(2, ACTION);
      if (binding == DetailsBinding.JSONB) {
        PGobject obj = new PGobject();
        obj.setType("jsonb");
        obj.setValue(json);
        ps.setObject(3, obj);
      } else {
        ps.setString(3, json);
      }
      ps.executeUpdate();
      log.debug("sqlgate.audit written session={} tenant={} status={}", session.sessionId(), session.tenantKey(),
          session.status() == null ? null : session.status().wireName());
    } catch (SQLException e) {
      throw new IllegalStateException("Audit write failed for session " + session.sessionId(), e);
    }
  }
}
