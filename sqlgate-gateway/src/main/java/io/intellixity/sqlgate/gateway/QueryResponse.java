package io.intellixity.sqlgate.gateway;

import io.intellixity.sqlgate.error.ErrorCategory;
import io.intellixity.sqlgate.exec.QueryResult;
import io.intellixity.sqlgate.guard.GuardVerdict;
import io.intellixity.sqlgate.session.CorrectionSession;
import io.intellixity.sqlgate.session.QueryAttempt;
import io.intellixity.sqlgate.session.SessionStatus;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a query request.\n
 *
 * Always carries the last attempted statement and the success flag; either the rows or a terminal error category
 * with its message. {@code history} lists every attempt in order.\n
 */
public record QueryResponse(String sql,
                            boolean success,
                            String status,
                            List<String> columns,
                            List<Map<String, Object>> rows,
                            int rowCount,
                            boolean truncated,
                            boolean limitApplied,
                            int attempts,
                            List<AttemptSummary> history,
                            long elapsedMillis,
                            String errorCategory,
                            String message) {

  public static final String STATUS_GENERATED = "generated";

  static QueryResponse of(LoopOutcome outcome, long elapsedMillis) {
    CorrectionSession s = outcome.session();
    List<AttemptSummary> history = new ArrayList<>();
    for (QueryAttempt a : s.attempts()) history.add(AttemptSummary.of(a));
    QueryAttempt last = s.lastAttempt();
    String sql = last == null ? null : last.statement();

    if (s.status() == SessionStatus.SUCCEEDED) {
      QueryResult r = last.result();
      return new QueryResponse(sql, true, s.status().wireName(), r.columns(), r.rows(), r.rowCount(), r.truncated(),
          outcome.limitApplied(), history.size(), history, elapsedMillis, null, null);
    }
    return new QueryResponse(sql, false, s.status().wireName(), List.of(), List.of(), 0, false, false,
        history.size(), history, elapsedMillis, s.errorCategory().wireName(), s.message());
  }

  static QueryResponse generated(GuardVerdict v, long elapsedMillis) {
    if (v.accepted()) {
      return new QueryResponse(v.statement(), true, STATUS_GENERATED, List.of(), List.of(), 0, false,
          v.limitInjected(), 0, List.of(), elapsedMillis, null, null);
    }
    return new QueryResponse(v.statement(), false, SessionStatus.REJECTED_BY_GUARD.wireName(), List.of(), List.of(), 0,
        false, false, 0, List.of(), elapsedMillis, ErrorCategory.GUARD_REJECTION.wireName(), v.reason());
  }

  static QueryResponse generationFailed(String message, long elapsedMillis) {
    return new QueryResponse(null, false, SessionStatus.FAILED.wireName(), List.of(), List.of(), 0, false, false, 0,
        List.of(), elapsedMillis, ErrorCategory.GENERATION_FAILED.wireName(), message);
  }
}
