package io.intellixity.sqlgate.gateway;

import io.intellixity.sqlgate.session.QueryAttempt;

/** Response view of one attempt; rows are left out. */
public record AttemptSummary(int number,
                             String sql,
                             boolean success,
                             Integer rowCount,
                             String errorCategory,
                             String message,
                             long elapsedMillis) {

  static AttemptSummary of(QueryAttempt a) {
    return new AttemptSummary(a.number(), a.statement(), a.isSuccess(),
        a.isSuccess() ? a.result().rowCount() : null,
        a.isSuccess() ? null : a.errorCategory().wireName(),
        a.message(),
        a.elapsed().toMillis());
  }
}
