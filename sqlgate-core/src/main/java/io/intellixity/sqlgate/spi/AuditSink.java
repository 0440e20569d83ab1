package io.intellixity.sqlgate.spi;

import io.intellixity.sqlgate.session.CorrectionSession;

/** Append-only destination for completed correction sessions. */
@FunctionalInterface
public interface AuditSink {
  void record(CorrectionSession session);
}
