package io.intellixity.sqlgate.jdbc;

import io.intellixity.sqlgate.error.GatewayException;
import io.intellixity.sqlgate.error.PoolCreationFailedException;
import io.intellixity.sqlgate.error.TenantSuspendedException;
import io.intellixity.sqlgate.tenant.TenantDescriptor;
import io.intellixity.sqlgate.tenant.TenantDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Owns the registry of per-tenant connection pools.\n
 *
 * - Pools are created lazily on first {@link #acquire}; concurrent first acquires for one key share a single
 *   creation, different keys never wait on each other.\n
 * - A failed creation is surfaced to every waiter and forgotten, so the next acquire tries again.\n
 * - Pools without checkouts for {@link PoolSettings#idleTimeout()} are closed by {@link #evictIdle()} and rebuilt
 *   on the next acquire.\n
 */
public final class TenantPoolManager implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(TenantPoolManager.class);

  private final TenantDirectory directory;
  private final DataSourceFactory dataSourceFactory;
  private final PoolSettings settings;
  private final LongSupplier nowMillis;
  private final ConcurrentHashMap<String, Future<TenantPool>> pools = new ConcurrentHashMap<>();
  private final ScheduledExecutorService evictor;
  private volatile boolean shutdown;

  public TenantPoolManager(TenantDirectory directory, DataSourceFactory dataSourceFactory, PoolSettings settings) {
    this(directory, dataSourceFactory, settings, System::currentTimeMillis);
  }

  public TenantPoolManager(TenantDirectory directory,
                           DataSourceFactory dataSourceFactory,
                           PoolSettings settings,
                           LongSupplier nowMillis) {
    this.directory = Objects.requireNonNull(directory, "directory");
    this.dataSourceFactory = Objects.requireNonNull(dataSourceFactory, "dataSourceFactory");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.nowMillis = Objects.requireNonNull(nowMillis, "nowMillis");
    long every = settings.evictionInterval().toMillis();
    if (every > 0) {
      this.evictor = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sqlgate-pool-evictor");
        t.setDaemon(true);
        return t;
      });
      this.evictor.scheduleWithFixedDelay(this::sweep, every, every, TimeUnit.MILLISECONDS);
    } else {
      this.evictor = null;
    }
  }

  /**
   * Checks out a connection for {@code tenantKey}, creating the tenant's pool if needed.\n
   *
   * @throws io.intellixity.sqlgate.error.TenantNotFoundException   unknown key (pool creation only)
   * @throws TenantSuspendedException                               tenant not active (pool creation only)
   * @throws PoolCreationFailedException                            the data source could not be built
   * @throws io.intellixity.sqlgate.error.CheckoutTimeoutException  all connections stayed busy
   * @throws SQLException                                           the data source failed to open a connection
   * @throws InterruptedException                                   the caller was interrupted while waiting
   */
  public PooledConnection acquire(String tenantKey) throws SQLException, InterruptedException {
    Objects.requireNonNull(tenantKey, "tenantKey");
    while (true) {
      if (shutdown) throw new IllegalStateException("Pool manager is shut down");
      Future<TenantPool> slot = slotFor(tenantKey);
      TenantPool pool = await(tenantKey, slot);
      if (!pool.reserve()) {
        // evicted or retired between lookup and reservation
        pools.remove(tenantKey, slot);
        continue;
      }
      return pool.checkout(settings.checkoutTimeout());
    }
  }

  /**
   * Closes every idle pool past the idle threshold.\n
   *
   * @return number of pools closed
   */
  public int evictIdle() {
    long now = nowMillis.getAsLong();
    long idleMillis = settings.idleTimeout().toMillis();
    int evicted = 0;
    for (Map.Entry<String, Future<TenantPool>> e : pools.entrySet()) {
      TenantPool pool = completed(e.getValue());
      if (pool == null) continue;
      if (pool.closeIfIdle(now, idleMillis)) {
        pools.remove(e.getKey(), e.getValue());
        evicted++;
        log.info("sqlgate.pool evicted tenant={} idleTimeoutMs={}", e.getKey(), idleMillis);
      }
    }
    return evicted;
  }

  /**
   * Drops the pool for {@code tenantKey}; connections in use are closed as they come back.\n
   *
   * A pool still being created is awaited and retired, so it never outlives its registry slot.\n
   */
  public boolean retire(String tenantKey) {
    Future<TenantPool> slot = pools.get(tenantKey);
    if (slot == null) return false;
    TenantPool pool = settled(slot);
    // retire before unmapping so a concurrent acquire of this slot fails its reservation
    if (pool != null) pool.retire();
    pools.remove(tenantKey, slot);
    if (pool == null) return false;
    log.info("sqlgate.pool retired tenant={}", tenantKey);
    return true;
  }

  public int activePoolCount() {
    int n = 0;
    for (Future<TenantPool> f : pools.values()) {
      if (completed(f) != null) n++;
    }
    return n;
  }

  public List<PoolStats> stats() {
    List<PoolStats> out = new ArrayList<>();
    for (Future<TenantPool> f : pools.values()) {
      TenantPool p = completed(f);
      if (p != null) out.add(p.stats());
    }
    out.sort(Comparator.comparing(PoolStats::tenantKey));
    return out;
  }

  public PoolSettings settings() {
    return settings;
  }

  /** Drains all pools. Further {@link #acquire} calls fail with {@link IllegalStateException}. */
  public void shutdown() {
    if (shutdown) return;
    shutdown = true;
    if (evictor != null) evictor.shutdownNow();
    for (String key : new ArrayList<>(pools.keySet())) retire(key);
    log.info("sqlgate.pool shutdown");
  }

  @Override
  public void close() {
    shutdown();
  }

  private Future<TenantPool> slotFor(String tenantKey) {
    Future<TenantPool> slot = pools.get(tenantKey);
    if (slot != null) return slot;
    FutureTask<TenantPool> task = new FutureTask<>(() -> create(tenantKey));
    slot = pools.putIfAbsent(tenantKey, task);
    if (slot == null) {
      slot = task;
      task.run();
      if (shutdown || pools.get(tenantKey) != task) {
        // unmapped while creating; waiters on this slot fail their reservation and start over
        TenantPool orphan = completed(task);
        if (orphan != null) orphan.retire();
      }
    }
    return slot;
  }

  private TenantPool await(String tenantKey, Future<TenantPool> slot) throws InterruptedException {
    try {
      return slot.get();
    } catch (ExecutionException e) {
      pools.remove(tenantKey, slot);
      Throwable cause = e.getCause();
      if (cause instanceof GatewayException ge) throw ge;
      throw new PoolCreationFailedException(tenantKey, cause);
    }
  }

  private TenantPool create(String tenantKey) throws SQLException {
    TenantDescriptor d = directory.getRequired(tenantKey);
    if (!d.active()) throw new TenantSuspendedException(tenantKey);
    DataSource ds = dataSourceFactory.create(d, settings);
    if (ds == null) throw new IllegalStateException("DataSourceFactory returned null for tenant " + tenantKey);
    log.info("sqlgate.pool created tenant={} host={} db={} max={}", tenantKey, d.host(), d.database(),
        settings.maxConnections());
    return new TenantPool(tenantKey, ds, settings.maxConnections(), nowMillis);
  }

  // null while still being created or if creation failed; the creating caller reports the failure
  private static TenantPool completed(Future<TenantPool> f) {
    if (!f.isDone() || f.isCancelled()) return null;
    try {
      return f.get();
    } catch (ExecutionException e) {
      return null;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return null;
    }
  }

  // waits for an in-flight creation; null if it failed or the wait was interrupted
  private static TenantPool settled(Future<TenantPool> f) {
    try {
      return f.get();
    } catch (ExecutionException e) {
      return null;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return null;
    }
  }

  private void sweep() {
    try {
      evictIdle();
    } catch (RuntimeException e) {
      log.warn("sqlgate.pool eviction_failed error={}", e.toString());
    }
  }
}
