package io.intellixity.sqlgate.jdbc;

import io.intellixity.sqlgate.error.CheckoutTimeoutException;
import io.intellixity.sqlgate.error.PoolCreationFailedException;
import io.intellixity.sqlgate.error.TenantNotFoundException;
import io.intellixity.sqlgate.error.TenantSuspendedException;
import io.intellixity.sqlgate.tenant.TenantDescriptor;
import io.intellixity.sqlgate.tenant.TenantStatus;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.LockSupport;

import static io.intellixity.sqlgate.jdbc.TestDataSources.*;
import static org.junit.jupiter.api.Assertions.*;

final class TenantPoolManagerTest {

  private static PoolSettings settings(int max, Duration checkout) {
    return new PoolSettings(0, max, checkout, Duration.ofMinutes(10), Duration.ZERO);
  }

  @Test
  void concurrentFirstAcquires_createExactlyOnePool() throws Exception {
    AtomicInteger created = new AtomicInteger();
    String url = h2Url("pool_once");
    DataSourceFactory factory = (d, s) -> {
      created.incrementAndGet();
      LockSupport.parkNanos(TimeUnit.MILLISECONDS.toNanos(50));
      return new H2DataSource(url);
    };
    int n = 16;
    try (TenantPoolManager m = new TenantPoolManager(directory("acme"), factory, settings(n, Duration.ofSeconds(5)))) {
      ExecutorService ex = Executors.newFixedThreadPool(n);
      CountDownLatch go = new CountDownLatch(1);
      List<Future<?>> fs = new ArrayList<>();
      for (int i = 0; i < n; i++) {
        fs.add(ex.submit(() -> {
          go.await();
          try (PooledConnection c = m.acquire("acme")) {
            assertFalse(c.connection().isClosed());
          }
          return null;
        }));
      }
      go.countDown();
      for (Future<?> f : fs) f.get(10, TimeUnit.SECONDS);
      ex.shutdown();

      assertEquals(1, created.get());
      assertEquals(1, m.activePoolCount());
      assertEquals(n, m.stats().get(0).totalCheckouts());
      assertEquals(0, m.stats().get(0).inUse());
    }
  }

  @Test
  void differentTenants_getSeparatePools() throws Exception {
    List<String> created = new CopyOnWriteArrayList<>();
    DataSourceFactory factory = (d, s) -> {
      created.add(d.tenantKey());
      return new H2DataSource(h2Url("pool_" + d.tenantKey()));
    };
    try (TenantPoolManager m = new TenantPoolManager(directory("acme", "globex"), factory, settings(2, Duration.ofSeconds(1)))) {
      m.acquire("acme").close();
      m.acquire("globex").close();
      m.acquire("acme").close();
      assertEquals(List.of("acme", "globex"), created);
      assertEquals(2, m.activePoolCount());
    }
  }

  @Test
  void checkoutBeyondMax_timesOutAndRecovers() throws Exception {
    DataSourceFactory factory = (d, s) -> new H2DataSource(h2Url("pool_max"));
    try (TenantPoolManager m = new TenantPoolManager(directory("acme"), factory, settings(1, Duration.ofMillis(100)))) {
      PooledConnection held = m.acquire("acme");
      CheckoutTimeoutException e = assertThrows(CheckoutTimeoutException.class, () -> m.acquire("acme"));
      assertEquals("acme", e.tenantKey());
      held.close();
      held.close();
      try (PooledConnection again = m.acquire("acme")) {
        assertNotNull(again.connection());
      }
    }
  }

  @Test
  void idlePool_isEvictedAndRecreated() throws Exception {
    AtomicLong clock = new AtomicLong(1_000_000);
    List<H2DataSource> sources = new CopyOnWriteArrayList<>();
    DataSourceFactory factory = (d, s) -> {
      H2DataSource ds = new H2DataSource(h2Url("pool_idle"));
      sources.add(ds);
      return ds;
    };
    try (TenantPoolManager m = new TenantPoolManager(directory("acme"), factory, settings(2, Duration.ofSeconds(1)), clock::get)) {
      m.acquire("acme").close();
      clock.addAndGet(Duration.ofMinutes(9).toMillis());
      assertEquals(0, m.evictIdle());

      clock.addAndGet(Duration.ofMinutes(1).toMillis());
      assertEquals(1, m.evictIdle());
      assertEquals(0, m.activePoolCount());
      assertTrue(sources.get(0).closed);

      m.acquire("acme").close();
      assertEquals(2, sources.size());
      assertFalse(sources.get(1).closed);
    }
  }

  @Test
  void poolWithCheckout_isNeverEvicted() throws Exception {
    AtomicLong clock = new AtomicLong(0);
    DataSourceFactory factory = (d, s) -> new H2DataSource(h2Url("pool_busy"));
    try (TenantPoolManager m = new TenantPoolManager(directory("acme"), factory, settings(2, Duration.ofSeconds(1)), clock::get)) {
      try (PooledConnection c = m.acquire("acme")) {
        clock.addAndGet(Duration.ofHours(1).toMillis());
        assertEquals(0, m.evictIdle());
        assertFalse(c.connection().isClosed());
      }
    }
  }

  @Test
  void unknownAndSuspendedTenants_areRejectedWithoutAPool() {
    AtomicInteger created = new AtomicInteger();
    DataSourceFactory factory = (d, s) -> {
      created.incrementAndGet();
      return new H2DataSource(h2Url("pool_never"));
    };
    TenantDescriptor suspended = new TenantDescriptor("initech", "h2", "localhost", 0, "initech", "sa", "", "",
        TenantStatus.SUSPENDED);
    try (TenantPoolManager m = new TenantPoolManager(k -> "initech".equals(k) ? suspended : null, factory,
        settings(1, Duration.ofSeconds(1)))) {
      assertThrows(TenantNotFoundException.class, () -> m.acquire("nobody"));
      assertThrows(TenantSuspendedException.class, () -> m.acquire("initech"));
      assertEquals(0, created.get());
      assertEquals(0, m.activePoolCount());
    }
  }

  @Test
  void failedCreation_isSurfacedAndRetriedOnNextAcquire() throws Exception {
    AtomicInteger calls = new AtomicInteger();
    DataSourceFactory factory = (d, s) -> {
      if (calls.incrementAndGet() == 1) throw new SQLException("password authentication failed", "28P01");
      return new H2DataSource(h2Url("pool_retry"));
    };
    try (TenantPoolManager m = new TenantPoolManager(directory("acme"), factory, settings(1, Duration.ofSeconds(1)))) {
      PoolCreationFailedException e = assertThrows(PoolCreationFailedException.class, () -> m.acquire("acme"));
      assertTrue(e.getMessage().contains("password authentication failed"));
      assertEquals(0, m.activePoolCount());

      m.acquire("acme").close();
      assertEquals(2, calls.get());
    }
  }

  @Test
  void retire_closesDataSourceOnceConnectionsReturn() throws Exception {
    H2DataSource ds = new H2DataSource(h2Url("pool_retire"));
    try (TenantPoolManager m = new TenantPoolManager(directory("acme"), (d, s) -> ds, settings(2, Duration.ofSeconds(1)))) {
      PooledConnection c = m.acquire("acme");
      assertTrue(m.retire("acme"));
      assertFalse(ds.closed);
      c.close();
      assertTrue(ds.closed);
      assertFalse(m.retire("acme"));
    }
  }

  @Test
  void retireDuringCreation_closesThatPoolAndLeavesOneLive() throws Exception {
    CountDownLatch entered = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    List<H2DataSource> sources = new CopyOnWriteArrayList<>();
    DataSourceFactory factory = (d, s) -> {
      H2DataSource ds = new H2DataSource(h2Url("pool_retire_race"));
      sources.add(ds);
      if (sources.size() == 1) {
        entered.countDown();
        try {
          release.await();
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          throw new SQLException("interrupted while creating", "08001");
        }
      }
      return ds;
    };
    TenantPoolManager m = new TenantPoolManager(directory("acme"), factory, settings(2, Duration.ofSeconds(5)));
    ExecutorService ex = Executors.newFixedThreadPool(3);
    try {
      Future<?> first = ex.submit(() -> {
        m.acquire("acme").close();
        return null;
      });
      assertTrue(entered.await(5, TimeUnit.SECONDS));
      Future<Boolean> retired = ex.submit(() -> m.retire("acme"));
      Future<?> second = ex.submit(() -> {
        m.acquire("acme").close();
        return null;
      });
      LockSupport.parkNanos(TimeUnit.MILLISECONDS.toNanos(100));
      release.countDown();

      first.get(10, TimeUnit.SECONDS);
      second.get(10, TimeUnit.SECONDS);
      assertTrue(retired.get(10, TimeUnit.SECONDS));
      assertTrue(sources.get(0).closed);
      assertTrue(m.activePoolCount() <= 1);
      assertTrue(sources.size() <= 2);

      m.shutdown();
      for (H2DataSource ds : sources) assertTrue(ds.closed);
    } finally {
      ex.shutdownNow();
      m.shutdown();
    }
  }

  @Test
  void shutdown_drainsPoolsAndRejectsFurtherAcquires() throws Exception {
    H2DataSource ds = new H2DataSource(h2Url("pool_shutdown"));
    TenantPoolManager m = new TenantPoolManager(directory("acme"), (d, s) -> ds, settings(2, Duration.ofSeconds(1)));
    m.acquire("acme").close();
    m.shutdown();
    assertTrue(ds.closed);
    assertEquals(0, m.activePoolCount());
    assertThrows(IllegalStateException.class, () -> m.acquire("acme"));
  }
}
