package io.intellixity.sqlgate.jdbc;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A connection checked out of a {@link TenantPool}. Closing it returns the slot to the pool; closing twice is a no-op.
 */
public final class PooledConnection implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(PooledConnection.class);

  private final TenantPool pool;
  private final Connection connection;
  private final AtomicBoolean released = new AtomicBoolean();

  PooledConnection(TenantPool pool, Connection connection) {
    this.pool = pool;
    this.connection = connection;
  }

  public Connection connection() {
    if (released.get()) throw new IllegalStateException("Connection for tenant " + pool.tenantKey() + " was released");
    return connection;
  }

  public String tenantKey() {
    return pool.tenantKey();
  }

  @Override
  public void close() {
    if (!released.compareAndSet(false, true)) return;
    try {
      connection.close();
    } catch (SQLException e) {
      log.warn("sqlgate.pool release_failed tenant={} error={}", pool.tenantKey(), e.toString());
    } finally {
      pool.release();
    }
  }
}
