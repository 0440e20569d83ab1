package io.intellixity.sqlgate.gateway;

import io.intellixity.sqlgate.session.CorrectionSession;
import io.intellixity.sqlgate.session.SessionStatus;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

final class AsyncAuditSinkTest {

  private static CorrectionSession finished(String intent) {
    CorrectionSession s = new CorrectionSession("acme", intent, 5, Instant.parse("2024-01-01T00:00:00Z"));
    s.complete(SessionStatus.SUCCEEDED, null, null, Instant.parse("2024-01-01T00:00:01Z"));
    return s;
  }

  @Test
  void deliversSessionsInOrder() throws Exception {
    List<String> seen = new CopyOnWriteArrayList<>();
    AsyncAuditSink sink = new AsyncAuditSink(s -> seen.add(s.intent()));

    sink.record(finished("a"));
    sink.record(finished("b"));

    assertTrue(sink.drain(Duration.ofSeconds(5)));
    assertEquals(List.of("a", "b"), seen);
    assertEquals(0, sink.droppedCount());
  }

  @Test
  void delegateFailuresAreCountedNotThrown() throws Exception {
    AsyncAuditSink sink = new AsyncAuditSink(s -> { throw new IllegalStateException("insert failed"); });

    assertDoesNotThrow(() -> sink.record(finished("a")));

    assertTrue(sink.drain(Duration.ofSeconds(5)));
    assertEquals(1, sink.failedCount());
  }

  @Test
  void fullQueueDropsInsteadOfBlocking() throws Exception {
    CountDownLatch release = new CountDownLatch(1);
    List<String> seen = new CopyOnWriteArrayList<>();
    AsyncAuditSink sink = new AsyncAuditSink(s -> {
      try {
        release.await(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      seen.add(s.intent());
    }, 1);

    sink.record(finished("running"));
    sink.record(finished("queued"));
    sink.record(finished("dropped"));
    assertEquals(1, sink.droppedCount());

    release.countDown();
    assertTrue(sink.drain(Duration.ofSeconds(5)));
    assertEquals(List.of("running", "queued"), seen);
  }

  @Test
  void recordAfterCloseIsDropped() {
    AsyncAuditSink sink = new AsyncAuditSink(s -> {});
    sink.close();

    sink.record(finished("late"));

    assertEquals(1, sink.droppedCount());
  }
}
