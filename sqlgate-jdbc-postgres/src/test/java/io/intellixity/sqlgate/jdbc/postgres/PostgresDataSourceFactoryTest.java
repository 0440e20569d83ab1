package io.intellixity.sqlgate.jdbc.postgres;

import io.intellixity.sqlgate.jdbc.PoolSettings;
import io.intellixity.sqlgate.tenant.TenantDescriptor;
import io.intellixity.sqlgate.tenant.TenantStatus;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.*;

final class PostgresDataSourceFactoryTest {

  private static TenantDescriptor tenant(String type, String host, int port) {
    return new TenantDescriptor("acme@example.com", type, host, port, "acme", "reader", "pw", "", TenantStatus.ACTIVE);
  }

  @Test
  void buildsJdbcUrlFromDescriptor() {
    assertEquals("jdbc:postgresql://db.internal:6543/acme",
        PostgresDataSourceFactory.jdbcUrl(tenant("postgres", " db.internal ", 6543)));
    assertEquals("jdbc:postgresql://db.internal:5432/acme",
        PostgresDataSourceFactory.jdbcUrl(tenant("postgres", "db.internal", 0)));
  }

  @Test
  void missingHost_isRejected() {
    assertThrows(IllegalArgumentException.class, () -> PostgresDataSourceFactory.jdbcUrl(tenant("postgres", " ", 5432)));
  }

  @Test
  void unsupportedType_isRejectedBeforeConnecting() {
    SQLException e = assertThrows(SQLException.class,
        () -> new PostgresDataSourceFactory().create(tenant("mysql", "db", 3306), PoolSettings.defaults()));
    assertEquals("0A000", e.getSQLState());
  }
}
