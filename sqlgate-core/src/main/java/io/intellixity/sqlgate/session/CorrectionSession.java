package io.intellixity.sqlgate.session;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.intellixity.sqlgate.error.ErrorCategory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Ordered record of the attempts made for one request.\n
 *
 * Attempts are appended by a single task only; once {@link #complete} has been called the session is frozen.
 * The session never holds more than {@code maxAttempts} attempts and attempt numbers are strictly increasing.\n
 */
@JsonSerialize(using = CorrectionSessionJsonSerializer.class)
public final class CorrectionSession {
  private final String sessionId;
  private final String tenantKey;
  private final String intent;
  private final int maxAttempts;
  private final Instant startedAt;

  private final List<QueryAttempt> attempts = new ArrayList<>();
  private volatile SessionStatus status;
  private volatile ErrorCategory errorCategory;
  private volatile String message;
  private volatile Instant finishedAt;

  public CorrectionSession(String tenantKey, String intent, int maxAttempts, Instant startedAt) {
    this(UUID.randomUUID().toString(), tenantKey, intent, maxAttempts, startedAt);
  }

  public CorrectionSession(String sessionId, String tenantKey, String intent, int maxAttempts, Instant startedAt) {
    this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
    this.tenantKey = Objects.requireNonNull(tenantKey, "tenantKey");
    this.intent = intent;
    if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
    this.maxAttempts = maxAttempts;
    this.startedAt = Objects.requireNonNull(startedAt, "startedAt");
  }

  public synchronized void append(QueryAttempt attempt) {
    Objects.requireNonNull(attempt, "attempt");
    if (status != null) throw new IllegalStateException("Session " + sessionId + " is already " + status.wireName());
    if (!tenantKey.equals(attempt.tenantKey())) {
      throw new IllegalArgumentException("Attempt tenant " + attempt.tenantKey() + " does not match session tenant " + tenantKey);
    }
    if (attempts.size() >= maxAttempts) {
      throw new IllegalStateException("Session " + sessionId + " already holds " + maxAttempts + " attempts");
    }
    int last = attempts.isEmpty() ? 0 : attempts.get(attempts.size() - 1).number();
    if (attempt.number() <= last) {
      throw new IllegalArgumentException("Attempt number " + attempt.number() + " does not follow " + last);
    }
    attempts.add(attempt);
  }

  public synchronized void complete(SessionStatus finalStatus, ErrorCategory category, String finalMessage, Instant at) {
    Objects.requireNonNull(finalStatus, "finalStatus");
    if (status != null) throw new IllegalStateException("Session " + sessionId + " is already " + status.wireName());
    if (finalStatus == SessionStatus.SUCCEEDED && category != null) {
      throw new IllegalArgumentException("A succeeded session carries no error category");
    }
    if (finalStatus != SessionStatus.SUCCEEDED && category == null) {
      throw new IllegalArgumentException("A " + finalStatus.wireName() + " session needs an error category");
    }
    this.errorCategory = category;
    this.message = finalMessage;
    this.finishedAt = Objects.requireNonNull(at, "at");
    this.status = finalStatus;
  }

  public String sessionId() { return sessionId; }
  public String tenantKey() { return tenantKey; }
  public String intent() { return intent; }
  public int maxAttempts() { return maxAttempts; }
  public Instant startedAt() { return startedAt; }
  public Instant finishedAt() { return finishedAt; }
  public SessionStatus status() { return status; }
  public ErrorCategory errorCategory() { return errorCategory; }
  public String message() { return message; }

  public boolean completed() {
    return status != null;
  }

  public synchronized List<QueryAttempt> attempts() {
    return Collections.unmodifiableList(new ArrayList<>(attempts));
  }

  public synchronized int attemptCount() {
    return attempts.size();
  }

  /** The terminal attempt, or null if the session ended before any attempt was recorded. */
  public synchronized QueryAttempt lastAttempt() {
    return attempts.isEmpty() ? null : attempts.get(attempts.size() - 1);
  }

  public Duration elapsed() {
    Instant end = finishedAt;
    return Duration.between(startedAt, end == null ? Instant.now() : end);
  }
}
