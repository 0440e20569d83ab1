package io.intellixity.sqlgate.jdbc;

import io.intellixity.sqlgate.tenant.TenantDescriptor;

import javax.sql.DataSource;
import java.sql.SQLException;

/**
 * Builds the physical data source behind one tenant pool.\n
 *
 * If the returned data source is {@link AutoCloseable} it is closed when the pool is torn down.\n
 */
@FunctionalInterface
public interface DataSourceFactory {
  DataSource create(TenantDescriptor descriptor, PoolSettings settings) throws SQLException;
}
