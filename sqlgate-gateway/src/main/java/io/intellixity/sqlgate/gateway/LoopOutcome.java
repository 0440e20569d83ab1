package io.intellixity.sqlgate.gateway;

import io.intellixity.sqlgate.session.CorrectionSession;

/** A finished session plus whether the guard appended a row limit to the last executed statement. */
public record LoopOutcome(CorrectionSession session, boolean limitApplied) {
}
