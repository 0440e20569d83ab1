package io.intellixity.sqlgate.jdbc;

import io.intellixity.sqlgate.error.ErrorCategory;
import io.intellixity.sqlgate.exec.ExecutionOutcome;
import io.intellixity.sqlgate.exec.QueryResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static io.intellixity.sqlgate.jdbc.TestDataSources.*;
import static org.junit.jupiter.api.Assertions.*;

final class JdbcQueryExecutorTest {
  private static final String URL = h2Url("exec_acme");
  private static final PoolSettings POOL = new PoolSettings(0, 2, Duration.ofSeconds(2), Duration.ofMinutes(10), Duration.ZERO);

  private TenantPoolManager pools;
  private JdbcQueryExecutor executor;

  @BeforeAll
  static void schema() throws Exception {
    exec(URL,
        "DROP TABLE IF EXISTS users",
        "CREATE TABLE users (id INT PRIMARY KEY, name VARCHAR(50), created_at TIMESTAMP, balance DECIMAL(10,2))",
        "INSERT INTO users VALUES (1, 'ada', TIMESTAMP '2024-01-02 03:04:05', 10.50)",
        "INSERT INTO users VALUES (2, 'grace', TIMESTAMP '2024-02-03 04:05:06', 0.00)",
        "INSERT INTO users VALUES (3, 'linus', NULL, 7.25)",
        "INSERT INTO users VALUES (4, 'barbara', NULL, 1.00)",
        "INSERT INTO users VALUES (5, 'ken', NULL, 2.00)");
  }

  @AfterEach
  void tearDown() {
    if (executor != null) executor.close();
    if (pools != null) pools.shutdown();
  }

  private void open(DataSourceFactory factory, ExecutorSettings settings) {
    pools = new TenantPoolManager(directory("acme"), factory, POOL);
    executor = new JdbcQueryExecutor(pools, new DefaultSqlErrorClassifier(), settings);
  }

  private void openH2() {
    open((d, s) -> new H2DataSource(URL), ExecutorSettings.defaults());
  }

  @Test
  void select_returnsNormalizedRowsInColumnOrder() {
    openH2();
    ExecutionOutcome out = executor.execute("acme", "SELECT id, name, created_at, balance FROM users WHERE id = 1",
        Duration.ofSeconds(5), 100);

    assertTrue(out.isSuccess(), () -> String.valueOf(out.error()));
    QueryResult r = out.result();
    assertEquals(List.of("ID", "NAME", "CREATED_AT", "BALANCE"), r.columns());
    assertEquals(1, r.rowCount());
    Map<String, Object> row = r.rows().get(0);
    assertEquals(1, row.get("ID"));
    assertEquals("ada", row.get("NAME"));
    assertEquals("2024-01-02T03:04:05", row.get("CREATED_AT"));
    assertEquals(0, new java.math.BigDecimal("10.50").compareTo((java.math.BigDecimal) row.get("BALANCE")));
    assertFalse(r.truncated());
    assertEquals(0, pools.stats().get(0).inUse());
  }

  @Test
  void rowsBeyondCap_areTruncated() {
    openH2();
    ExecutionOutcome out = executor.execute("acme", "SELECT id FROM users ORDER BY id", null, 3);
    assertTrue(out.isSuccess());
    assertEquals(3, out.result().rowCount());
    assertTrue(out.result().truncated());
  }

  @Test
  void identicalQuery_returnsIdenticalRows() {
    openH2();
    String sql = "SELECT id, name FROM users ORDER BY id";
    QueryResult a = executor.execute("acme", sql, null, 100).result();
    QueryResult b = executor.execute("acme", sql, null, 100).result();
    assertEquals(a.columns(), b.columns());
    assertEquals(a.rows(), b.rows());
  }

  @Test
  void unknownColumn_isSyntaxOrSemanticAndReleasesConnection() {
    openH2();
    ExecutionOutcome out = executor.execute("acme", "SELECT nme FROM users", null, 100);
    assertFalse(out.isSuccess());
    assertEquals(ErrorCategory.SYNTAX_OR_SEMANTIC_ERROR, out.error().category());
    assertTrue(out.error().message().toUpperCase().contains("NME"));
    assertEquals(0, pools.stats().get(0).inUse());
  }

  @Test
  void duplicateColumnLabels_areMadeUnique() {
    openH2();
    ExecutionOutcome out = executor.execute("acme", "SELECT id, id FROM users WHERE id = 2", null, 10);
    assertEquals(List.of("ID", "ID_2"), out.result().columns());
  }

  @Test
  void unknownTenant_isReportedNotThrown() {
    openH2();
    ExecutionOutcome out = executor.execute("nobody", "SELECT 1", null, 10);
    assertEquals(ErrorCategory.TENANT_NOT_FOUND, out.error().category());
  }

  @Test
  void slowStatement_isCancelledAtTheDeadline() {
    BlockingDataSource ds = new BlockingDataSource();
    open((d, s) -> ds, new ExecutorSettings(Duration.ofSeconds(30), Duration.ofSeconds(2), 1));

    long start = System.nanoTime();
    ExecutionOutcome out = executor.execute("acme", "SELECT pg_sleep(60)", Duration.ofMillis(200), 10);

    assertEquals(ErrorCategory.TIMEOUT, out.error().category());
    assertEquals(1, ds.cancels.get());
    assertEquals(1, ds.connectionsClosed.get());
    assertEquals(0, pools.stats().get(0).inUse());
    assertTrue(System.nanoTime() - start < TimeUnit.SECONDS.toNanos(5));
  }

  @Test
  void interruptedCaller_cancelsStatement() throws Exception {
    BlockingDataSource ds = new BlockingDataSource();
    open((d, s) -> ds, ExecutorSettings.defaults());

    AtomicReference<ExecutionOutcome> result = new AtomicReference<>();
    AtomicReference<Boolean> flag = new AtomicReference<>();
    Thread caller = new Thread(() -> {
      result.set(executor.execute("acme", "SELECT pg_sleep(60)", Duration.ofSeconds(30), 10));
      flag.set(Thread.currentThread().isInterrupted());
    });
    caller.start();
    assertTrue(ds.executing.await(5, TimeUnit.SECONDS));
    caller.interrupt();
    caller.join(5_000);

    assertEquals(ErrorCategory.CANCELLED, result.get().error().category());
    assertTrue(flag.get());
    assertEquals(1, ds.cancels.get());
    assertEquals(0, pools.stats().get(0).inUse());
  }

  @Test
  void connectionError_isRetriedOnceAtTransportLevel() {
    FlakyDataSource flaky = new FlakyDataSource(new H2DataSource(URL), 1);
    open((d, s) -> flaky, ExecutorSettings.defaults());

    ExecutionOutcome out = executor.execute("acme", "SELECT COUNT(*) AS n FROM users", null, 10);
    assertTrue(out.isSuccess());
    assertEquals(2, flaky.attempts.get());
  }

  @Test
  void connectionError_withoutRetries_isSurfaced() {
    FlakyDataSource flaky = new FlakyDataSource(new H2DataSource(URL), 5);
    open((d, s) -> flaky, new ExecutorSettings(null, null, 0));

    ExecutionOutcome out = executor.execute("acme", "SELECT 1", null, 10);
    assertEquals(ErrorCategory.CONNECTION_ERROR, out.error().category());
    assertEquals("08001", out.error().sqlState());
    assertEquals(1, flaky.attempts.get());
    assertEquals(0, pools.stats().get(0).inUse());
  }

  @Test
  void uncheckedDriverFailure_isReportedNotThrown() {
    FailingDataSource ds = new FailingDataSource(new IllegalStateException("protocol desync"));
    open((d, s) -> ds, ExecutorSettings.defaults());

    ExecutionOutcome out = executor.execute("acme", "SELECT 1", null, 10);
    assertFalse(out.isSuccess());
    assertEquals(ErrorCategory.SYNTAX_OR_SEMANTIC_ERROR, out.error().category());
    assertTrue(out.error().message().contains("protocol desync"));
    assertEquals(1, ds.executions.get());
    assertEquals(0, pools.stats().get(0).inUse());
  }

  @Test
  void serializationFailure_isRetriedOnceButNotReportedAsConnectionError() {
    FailingDataSource ds = new FailingDataSource(new SQLException("could not serialize access", "40001"));
    open((d, s) -> ds, ExecutorSettings.defaults());

    ExecutionOutcome out = executor.execute("acme", "SELECT 1", null, 10);
    assertEquals(ErrorCategory.SYNTAX_OR_SEMANTIC_ERROR, out.error().category());
    assertEquals("40001", out.error().sqlState());
    assertEquals(2, ds.executions.get());
  }

  @Test
  void shutDownWorkers_areReportedNotThrown() {
    ExecutorService workers = Executors.newSingleThreadExecutor();
    workers.shutdown();
    pools = new TenantPoolManager(directory("acme"), (d, s) -> new H2DataSource(URL), POOL);
    executor = new JdbcQueryExecutor(pools, new DefaultSqlErrorClassifier(), new ExecutorSettings(null, null, 0), workers);

    ExecutionOutcome out = executor.execute("acme", "SELECT 1", null, 10);
    assertEquals(ErrorCategory.CONNECTION_ERROR, out.error().category());
    assertEquals(0, pools.stats().get(0).inUse());
  }
}
