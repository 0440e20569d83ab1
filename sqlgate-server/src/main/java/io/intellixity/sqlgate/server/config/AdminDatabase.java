package io.intellixity.sqlgate.server.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import javax.sql.DataSource;
import java.util.Optional;

/** Pool for the admin database, present only when {@code sqlgate.admin.jdbc-url} is set. */
public final class AdminDatabase implements AutoCloseable {
  private final HikariDataSource dataSource;

  private AdminDatabase(HikariDataSource dataSource) {
    this.dataSource = dataSource;
  }

  public static AdminDatabase open(SqlGateProperties.Admin admin) {
    if (!admin.configured()) return new AdminDatabase(null);
    HikariConfig hc = new HikariConfig();
    hc.setPoolName("sqlgate-admin");
    hc.setJdbcUrl(admin.getJdbcUrl());
    if (hasText(admin.getUsername())) hc.setUsername(admin.getUsername());
    if (hasText(admin.getPassword())) hc.setPassword(admin.getPassword());
    hc.setMaximumPoolSize(5);
    // admin store may be down at startup; health reports it
    hc.setInitializationFailTimeout(-1);
    return new AdminDatabase(new HikariDataSource(hc));
  }

  private static boolean hasText(String s) {
    return s != null && !s.isBlank();
  }

  public Optional<DataSource> dataSource() {
    return Optional.ofNullable(dataSource);
  }

  @Override
  public void close() {
    if (dataSource != null) dataSource.close();
  }
}
