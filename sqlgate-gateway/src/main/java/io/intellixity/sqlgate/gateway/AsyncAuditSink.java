package io.intellixity.sqlgate.gateway;

import io.intellixity.sqlgate.session.CorrectionSession;
import io.intellixity.sqlgate.spi.AuditSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Hands sessions to a delegate sink on a background worker.\n
 *
 * {@link #record} never blocks and never throws: when the bounded queue is full the session is dropped and
 * counted, and delegate failures are logged.\n
 */
public final class AsyncAuditSink implements AuditSink, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(AsyncAuditSink.class);

  public static final int DEFAULT_QUEUE_CAPACITY = 1000;

  private final AuditSink delegate;
  private final ThreadPoolExecutor worker;
  private final AtomicLong dropped = new AtomicLong();
  private final AtomicLong failed = new AtomicLong();

  public AsyncAuditSink(AuditSink delegate) {
    this(delegate, DEFAULT_QUEUE_CAPACITY);
  }

  public AsyncAuditSink(AuditSink delegate, int queueCapacity) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    AtomicInteger n = new AtomicInteger();
    this.worker = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
        new LinkedBlockingQueue<>(Math.max(1, queueCapacity)),
        r -> {
          Thread t = new Thread(r, "sqlgate-audit-" + n.incrementAndGet());
          t.setDaemon(true);
          return t;
        },
        new ThreadPoolExecutor.AbortPolicy());
  }

  @Override
  public void record(CorrectionSession session) {
    if (session == null) return;
    try {
      worker.execute(() -> write(session));
    } catch (RejectedExecutionException e) {
      dropped.incrementAndGet();
      log.warn("sqlgate.audit dropped session={} tenant={} reason={}", session.sessionId(), session.tenantKey(),
          worker.isShutdown() ? "shutdown" : "queue full");
    }
  }

  public long droppedCount() {
    return dropped.get();
  }

  public long failedCount() {
    return failed.get();
  }

  /** Stops accepting sessions and waits up to {@code timeout} for queued ones to be written. */
  public boolean drain(Duration timeout) throws InterruptedException {
    worker.shutdown();
    return worker.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  @Override
  public void close() {
    try {
      if (!drain(Duration.ofSeconds(5))) {
        log.warn("sqlgate.audit close_timeout pending={}", worker.getQueue().size());
        worker.shutdownNow();
      }
    } catch (InterruptedException e) {
      worker.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private void write(CorrectionSession session) {
    try {
      delegate.record(session);
    } catch (RuntimeException e) {
      failed.incrementAndGet();
      log.warn("sqlgate.audit write_failed sink={} session={} tenant={} error={}",
          delegate.getClass().getSimpleName(), session.sessionId(), session.tenantKey(), e.toString());
    }
  }
}
