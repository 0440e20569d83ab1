package io.intellixity.sqlgate.jdbc;

import io.intellixity.sqlgate.error.CheckoutTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Bounded set of connections to one tenant database.\n
 *
 * {@code inUse} counts checkouts in progress including callers still waiting for a permit, so a pool with
 * waiters is never considered idle. Once closed a pool accepts no new reservations; the data source itself is
 * closed when the last outstanding connection comes back.\n
 */
final class TenantPool {
  private static final Logger log = LoggerFactory.getLogger(TenantPool.class);

  private final String tenantKey;
  private final DataSource dataSource;
  private final int maxConnections;
  private final Semaphore permits;
  private final LongSupplier nowMillis;
  private final long createdAt;
  private final AtomicLong checkouts = new AtomicLong();

  // guarded by this
  private int inUse;
  private long lastActivity;
  private boolean closed;
  private boolean dataSourceClosed;

  TenantPool(String tenantKey, DataSource dataSource, int maxConnections, LongSupplier nowMillis) {
    this.tenantKey = tenantKey;
    this.dataSource = dataSource;
    this.maxConnections = maxConnections;
    this.permits = new Semaphore(maxConnections, true);
    this.nowMillis = nowMillis;
    this.createdAt = nowMillis.getAsLong();
    this.lastActivity = createdAt;
  }

  String tenantKey() {
    return tenantKey;
  }

  /** Registers an upcoming checkout; false if the pool has been closed meanwhile. */
  synchronized boolean reserve() {
    if (closed) return false;
    inUse++;
    lastActivity = nowMillis.getAsLong();
    return true;
  }

  /** Waits for a permit and opens a connection. The caller must already hold a reservation. */
  PooledConnection checkout(Duration timeout) throws SQLException, InterruptedException {
    boolean permitted;
    try {
      permitted = permits.tryAcquire(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      unreserve();
      throw e;
    }
    if (!permitted) {
      unreserve();
      log.warn("sqlgate.pool checkout_timeout tenant={} waitedMs={} max={}", tenantKey, timeout.toMillis(), maxConnections);
      throw new CheckoutTimeoutException(tenantKey, timeout);
    }
    Connection c;
    try {
      c = dataSource.getConnection();
    } catch (SQLException | RuntimeException e) {
      permits.release();
      unreserve();
      throw e;
    }
    checkouts.incrementAndGet();
    return new PooledConnection(this, c);
  }

  void release() {
    permits.release();
    unreserve();
  }

  /** Closes the pool if nothing is checked out and it has been quiet for at least {@code idleMillis}. */
  synchronized boolean closeIfIdle(long now, long idleMillis) {
    if (closed || inUse > 0 || now - lastActivity < idleMillis) return false;
    closed = true;
    closeDataSource();
    return true;
  }

  /** Stops new checkouts; the data source closes once outstanding connections are returned. */
  synchronized void retire() {
    closed = true;
    if (inUse == 0) closeDataSource();
  }

  synchronized boolean closed() {
    return closed;
  }

  synchronized PoolStats stats() {
    return new PoolStats(tenantKey, maxConnections, inUse, checkouts.get(),
        Instant.ofEpochMilli(createdAt), Instant.ofEpochMilli(lastActivity));
  }

  private synchronized void unreserve() {
    inUse--;
    lastActivity = nowMillis.getAsLong();
    if (closed && inUse == 0) closeDataSource();
  }

  private void closeDataSource() {
    if (dataSourceClosed) return;
    dataSourceClosed = true;
    if (!(dataSource instanceof AutoCloseable closeable)) return;
    try {
      closeable.close();
    } catch (Exception e) {
      log.warn("sqlgate.pool close_failed tenant={} error={}", tenantKey, e.toString());
    }
  }
}
