package io.intellixity.sqlgate.jdbc;

import io.intellixity.sqlgate.error.ErrorCategory;
import io.intellixity.sqlgate.error.GatewayException;
import io.intellixity.sqlgate.exec.ExecutionError;
import io.intellixity.sqlgate.exec.ExecutionOutcome;
import io.intellixity.sqlgate.exec.QueryExecutor;
import io.intellixity.sqlgate.exec.QueryResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link QueryExecutor} over a {@link TenantPoolManager}.\n
 *
 * The calling thread checks out the connection and waits for the statement, which runs on a worker thread.
 * When the wall clock runs out, or the caller is interrupted, the statement is cancelled through
 * {@link Statement#cancel()} and the connection goes back to the pool once the worker has unwound (bounded by
 * {@link ExecutorSettings#cancelGrace()}). {@link Statement#setQueryTimeout} is set as a driver-side backstop.\n
 */
public final class JdbcQueryExecutor implements QueryExecutor, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(JdbcQueryExecutor.class);

  private final TenantPoolManager pools;
  private final SqlErrorClassifier classifier;
  private final ExecutorSettings settings;
  private final ExecutorService workers;
  private final boolean ownsWorkers;

  public JdbcQueryExecutor(TenantPoolManager pools, SqlErrorClassifier classifier, ExecutorSettings settings) {
    this(pools, classifier, settings, newWorkerPool(), true);
  }

  public JdbcQueryExecutor(TenantPoolManager pools,
                           SqlErrorClassifier classifier,
                           ExecutorSettings settings,
                           ExecutorService workers) {
    this(pools, classifier, settings, workers, false);
  }

  private JdbcQueryExecutor(TenantPoolManager pools,
                            SqlErrorClassifier classifier,
                            ExecutorSettings settings,
                            ExecutorService workers,
                            boolean ownsWorkers) {
    this.pools = Objects.requireNonNull(pools, "pools");
    this.classifier = Objects.requireNonNull(classifier, "classifier");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.workers = Objects.requireNonNull(workers, "workers");
    this.ownsWorkers = ownsWorkers;
  }

  @Override
  public ExecutionOutcome execute(String tenantKey, String statement, Duration timeout, int rowCap) {
    Objects.requireNonNull(tenantKey, "tenantKey");
    Objects.requireNonNull(statement, "statement");
    if (rowCap <= 0) throw new IllegalArgumentException("rowCap must be > 0");
    Duration t = (timeout == null || timeout.isZero() || timeout.isNegative()) ? settings.queryTimeout() : timeout;

    ExecutionOutcome out = executeOnce(tenantKey, statement, t, rowCap);
    for (int retry = 1; retry <= settings.transportRetries() && retryable(out); retry++) {
      log.info("sqlgate.jdbc transport_retry tenant={} retry={} error={}", tenantKey, retry, out.error().message());
      out = executeOnce(tenantKey, statement, t, rowCap);
    }
    return out;
  }

  public ExecutorSettings settings() {
    return settings;
  }

  @Override
  public void close() {
    if (ownsWorkers) workers.shutdownNow();
  }

  private boolean retryable(ExecutionOutcome out) {
    return !out.isSuccess()
        && classifier.isTransient(out.error())
        && !Thread.currentThread().isInterrupted();
  }

  private ExecutionOutcome executeOnce(String tenantKey, String statement, Duration timeout, int rowCap) {
    long start = System.nanoTime();
    PooledConnection handle;
    try {
      handle = pools.acquire(tenantKey);
    } catch (GatewayException e) {
      return ExecutionOutcome.failure(new ExecutionError(e.category(), e.getMessage()), since(start));
    } catch (SQLException e) {
      return ExecutionOutcome.failure(classifier.classify(e), since(start));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return ExecutionOutcome.failure(
          new ExecutionError(ErrorCategory.CANCELLED, "Request cancelled while waiting for a connection"), since(start));
    }

    try (handle; Statement stmt = handle.connection().createStatement()) {
      stmt.setQueryTimeout(backstopSeconds(timeout));
      stmt.setMaxRows(rowCap == Integer.MAX_VALUE ? 0 : rowCap + 1);
      debugSql("SELECT", tenantKey, statement, timeout, rowCap);

      CountDownLatch unwound = new CountDownLatch(1);
      Future<QueryResult> f = workers.submit(() -> {
        try {
          return read(stmt, statement, rowCap, start);
        } finally {
          unwound.countDown();
        }
      });

      try {
        QueryResult r = f.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        debugDone("SELECT", tenantKey, r, System.nanoTime() - start);
        return ExecutionOutcome.success(r);
      } catch (TimeoutException e) {
        abort(tenantKey, stmt, f, unwound);
        log.warn("sqlgate.jdbc timeout tenant={} timeoutMs={}", tenantKey, timeout.toMillis());
        return ExecutionOutcome.failure(new ExecutionError(ErrorCategory.TIMEOUT,
            "Query exceeded the " + timeout.toMillis() + " ms time limit and was cancelled", "57014"), since(start));
      } catch (InterruptedException e) {
        abort(tenantKey, stmt, f, unwound);
        Thread.currentThread().interrupt();
        log.info("sqlgate.jdbc cancelled tenant={}", tenantKey);
        return ExecutionOutcome.failure(
            new ExecutionError(ErrorCategory.CANCELLED, "Query cancelled by caller"), since(start));
      } catch (ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof SQLException se) {
          ExecutionError err = classifier.classify(se);
          debugFailed("SELECT", tenantKey, err, System.nanoTime() - start);
          return ExecutionOutcome.failure(err, since(start));
        }
        // driver bug or unchecked failure inside the driver; still a failed attempt, never an escape
        log.warn("sqlgate.jdbc driver_failure tenant={} error={}", tenantKey, String.valueOf(cause));
        ExecutionError err = new ExecutionError(ErrorCategory.SYNTAX_OR_SEMANTIC_ERROR,
            "Query failed: " + (cause == null ? "unknown driver failure" : cause.toString()));
        return ExecutionOutcome.failure(err, since(start));
      }
    } catch (RejectedExecutionException e) {
      log.warn("sqlgate.jdbc rejected tenant={} error={}", tenantKey, e.toString());
      return ExecutionOutcome.failure(
          new ExecutionError(ErrorCategory.CONNECTION_ERROR, "Query worker unavailable: " + e.getMessage()), since(start));
    } catch (SQLException e) {
      return ExecutionOutcome.failure(classifier.classify(e), since(start));
    }
  }

  private static QueryResult read(Statement stmt, String sql, int rowCap, long start) throws SQLException {
    if (!stmt.execute(sql)) {
      return new QueryResult(List.of(), List.of(), false, since(start));
    }
    try (ResultSet rs = stmt.getResultSet()) {
      List<String> columns = JdbcValues.columnLabels(rs.getMetaData());
      List<Map<String, Object>> rows = new ArrayList<>();
      boolean truncated = false;
      while (rs.next()) {
        if (rows.size() >= rowCap) {
          truncated = true;
          break;
        }
        if (Thread.currentThread().isInterrupted()) throw new SQLException("Result read interrupted", "57014");
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < columns.size(); i++) {
          row.put(columns.get(i), JdbcValues.normalize(rs.getObject(i + 1)));
        }
        rows.add(row);
      }
      return new QueryResult(columns, rows, truncated, since(start));
    }
  }

  private void abort(String tenantKey, Statement stmt, Future<?> f, CountDownLatch unwound) {
    try {
      stmt.cancel();
    } catch (SQLException e) {
      log.warn("sqlgate.jdbc cancel_failed tenant={} error={}", tenantKey, e.toString());
    }
    f.cancel(true);
    boolean interrupted = Thread.interrupted();
    try {
      if (!unwound.await(settings.cancelGrace().toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("sqlgate.jdbc cancel_pending tenant={} graceMs={}", tenantKey, settings.cancelGrace().toMillis());
      }
    } catch (InterruptedException e) {
      interrupted = true;
    } finally {
      if (interrupted) Thread.currentThread().interrupt();
    }
  }

  private static int backstopSeconds(Duration timeout) {
    long s = timeout.toSeconds() + 1;
    return (int) Math.min(Integer.MAX_VALUE, Math.max(1, s));
  }

  private static Duration since(long startNanos) {
    return Duration.ofNanos(System.nanoTime() - startNanos);
  }

  private static ExecutorService newWorkerPool() {
    AtomicInteger n = new AtomicInteger();
    return Executors.newCachedThreadPool(r -> {
      Thread t = new Thread(r, "sqlgate-exec-" + n.incrementAndGet());
      t.setDaemon(true);
      return t;
    });
  }

  private void debugSql(String op, String tenantKey, String sql, Duration timeout, int rowCap) {
    if (!log.isDebugEnabled()) return;
    log.debug("sqlgate.jdbc op={} tenant={} timeoutMs={} rowCap={} sql={}", op, tenantKey, timeout.toMillis(), rowCap, sql);
  }

  private void debugDone(String op, String tenantKey, QueryResult r, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("sqlgate.jdbc_done op={} tenant={} durationMs={} rows={} truncated={}",
        op, tenantKey, durationNanos / 1_000_000.0, r.rowCount(), r.truncated());
  }

  private void debugFailed(String op, String tenantKey, ExecutionError err, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("sqlgate.jdbc_failed op={} tenant={} durationMs={} category={} sqlState={}",
        op, tenantKey, durationNanos / 1_000_000.0, err.category(), err.sqlState());
  }
}
