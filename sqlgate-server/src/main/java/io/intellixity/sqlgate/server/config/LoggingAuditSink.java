package io.intellixity.sqlgate.server.config;

import io.intellixity.sqlgate.session.CorrectionSession;
import io.intellixity.sqlgate.spi.AuditSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Audit sink for deployments without an admin database: one log line per session. */
final class LoggingAuditSink implements AuditSink {
  private static final Logger log = LoggerFactory.getLogger(LoggingAuditSink.class);

  @Override
  public void record(CorrectionSession session) {
    log.info("sqlgate.audit session={} tenant={} status={} attempts={} elapsedMs={}",
        session.sessionId(), session.tenantKey(), session.status() == null ? null : session.status().wireName(),
        session.attemptCount(), session.elapsed().toMillis());
  }
}
