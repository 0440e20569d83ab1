package io.intellixity.sqlgate.jdbc.postgres;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.pool.HikariPool;
import io.intellixity.sqlgate.jdbc.DataSourceFactory;
import io.intellixity.sqlgate.jdbc.PoolSettings;
import io.intellixity.sqlgate.tenant.TenantDescriptor;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.util.Locale;
import java.util.Set;

/**
 * HikariCP pool per tenant, opened read-only against the tenant's PostgreSQL database.\n
 *
 * The pool is validated on creation (one connection is opened), so bad credentials or an unreachable host fail the
 * pool creation instead of the first query.\n
 */
public final class PostgresDataSourceFactory implements DataSourceFactory {
  private static final Set<String> SUPPORTED_TYPES = Set.of("postgres", "postgresql");

  private final String applicationName;

  public PostgresDataSourceFactory() {
    this("sqlgate");
  }

  public PostgresDataSourceFactory(String applicationName) {
    this.applicationName = applicationName;
  }

  @Override
  public DataSource create(TenantDescriptor d, PoolSettings settings) throws SQLException {
    if (!SUPPORTED_TYPES.contains(d.dbType().toLowerCase(Locale.ROOT))) {
      throw new SQLException("Unsupported database type '" + d.dbType() + "' for tenant " + d.tenantKey(), "0A000");
    }
    HikariConfig hc = new HikariConfig();
    hc.setPoolName("sqlgate-" + d.tenantKey());
    hc.setJdbcUrl(jdbcUrl(d));
    hc.setUsername(d.username());
    hc.setPassword(d.password());
    hc.setMaximumPoolSize(settings.maxConnections());
    hc.setMinimumIdle(settings.minIdle());
    hc.setReadOnly(true);
    hc.setAutoCommit(true);
    hc.setConnectionTimeout(Math.max(250, settings.checkoutTimeout().toMillis()));
    hc.setIdleTimeout(settings.idleTimeout().toMillis());
    hc.setInitializationFailTimeout(1);
    if (applicationName != null) hc.addDataSourceProperty("ApplicationName", applicationName);
    try {
      return new HikariDataSource(hc);
    } catch (HikariPool.PoolInitializationException e) {
      if (e.getCause() instanceof SQLException se) throw se;
      throw new SQLException("Could not open pool for tenant " + d.tenantKey() + ": " + e.getMessage(), "08001", e);
    }
  }

  static String jdbcUrl(TenantDescriptor d) {
    if (d.host() == null || d.host().isBlank()) throw new IllegalArgumentException("Tenant " + d.tenantKey() + " has no host");
    if (d.database() == null || d.database().isBlank()) {
      throw new IllegalArgumentException("Tenant " + d.tenantKey() + " has no database name");
    }
    return "jdbc:postgresql://" + d.host().trim() + ":" + d.port() + "/" + d.database().trim();
  }
}
