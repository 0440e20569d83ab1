package io.intellixity.sqlgate.jdbc.postgres;

import io.intellixity.sqlgate.tenant.TenantDescriptor;
import io.intellixity.sqlgate.tenant.TenantDirectory;
import io.intellixity.sqlgate.tenant.TenantStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Objects;

/**
 * Tenant directory over the admin database's onboarding table.\n
 *
 * One row per tenant keyed by {@code user_email}; suspended rows are returned with their status so callers can
 * tell "suspended" from "unknown".\n
 */
public final class JdbcTenantDirectory implements TenantDirectory {
  private static final Logger log = LoggerFactory.getLogger(JdbcTenantDirectory.class);

  public static final String DEFAULT_TABLE = "db_connection_infos";

  private final DataSource admin;
  private final String table;
  private final String selectSql;

  public JdbcTenantDirectory(DataSource admin) {
    this(admin, DEFAULT_TABLE);
  }

  public JdbcTenantDirectory(DataSource admin, String table) {
    this.admin = Objects.requireNonNull(admin, "admin");
    this.table = SqlNames.requireTableName(table);
    this.selectSql = "SELECT user_email, db_type, host, port, db_user, db_password, db_name, catalog_markdown, status"
        + " FROM " + this.table + " WHERE user_email = ?";
  }

  @Override
  public TenantDescriptor get(String tenantKey) {
    Objects.requireNonNull(tenantKey, "tenantKey");
    try (Connection c = admin.getConnection(); PreparedStatement ps = c.prepareStatement(selectSql)) {
      ps.setString(1, tenantKey);
      try (ResultSet rs = ps.executeQuery()) {
        if (!rs.next()) return null;
        return new TenantDescriptor(
            rs.getString("user_email"),
            rs.getString("db_type"),
            rs.getString("host"),
            rs.getInt("port"),
            rs.getString("db_name"),
            rs.getString("db_user"),
            rs.getString("db_password"),
            rs.getString("catalog_markdown"),
            TenantStatus.parse(rs.getString("status")));
      }
    } catch (SQLException e) {
      throw new IllegalStateException("Tenant lookup failed for " + tenantKey + " in " + table, e);
    }
  }

  @Override
  public boolean ping() {
    try (Connection c = admin.getConnection(); Statement s = c.createStatement(); ResultSet rs = s.executeQuery("SELECT 1")) {
      return rs.next();
    } catch (SQLException e) {
      log.warn("sqlgate.directory ping_failed table={} error={}", table, e.toString());
      return false;
    }
  }

  public String table() {
    return table;
  }
}
