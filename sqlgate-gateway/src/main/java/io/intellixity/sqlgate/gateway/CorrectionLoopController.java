package io.intellixity.sqlgate.gateway;

import io.intellixity.sqlgate.error.ErrorCategory;
import io.intellixity.sqlgate.error.GenerationFailedException;
import io.intellixity.sqlgate.exec.ExecutionError;
import io.intellixity.sqlgate.exec.ExecutionOutcome;
import io.intellixity.sqlgate.exec.QueryExecutor;
import io.intellixity.sqlgate.guard.GuardVerdict;
import io.intellixity.sqlgate.guard.StatementGuard;
import io.intellixity.sqlgate.session.CorrectionSession;
import io.intellixity.sqlgate.session.QueryAttempt;
import io.intellixity.sqlgate.session.SessionStatus;
import io.intellixity.sqlgate.spi.AuditSink;
import io.intellixity.sqlgate.spi.GenerationRequest;
import io.intellixity.sqlgate.spi.StatementGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives one request through guard, execution and revision.\n
 *
 * Per attempt: obtain a candidate (caller supplied or generated), validate it, execute it. Only
 * {@link ErrorCategory#SYNTAX_OR_SEMANTIC_ERROR} leads to another attempt, with the failing statement and the error
 * text handed to the generator. A guard rejection, any other execution error, a generation failure or the attempt
 * budget running out end the session. Every attempt is recorded; the finished session goes to the audit sink.\n
 *
 * Attempts of one session run strictly one after another on the calling thread. Generation runs on a worker with
 * its own timeout; interrupting the caller cancels generation and the in-flight statement alike.\n
 */
public final class CorrectionLoopController implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CorrectionLoopController.class);

  private final StatementGuard guard;
  private final QueryExecutor executor;
  private final StatementGenerator generator;
  private final AuditSink audit;
  private final CorrectionSettings settings;
  private final ExecutorService generationWorkers;
  private final Clock clock;

  public CorrectionLoopController(StatementGuard guard,
                                  QueryExecutor executor,
                                  StatementGenerator generator,
                                  AuditSink audit,
                                  CorrectionSettings settings) {
    this(guard, executor, generator, audit, settings, Clock.systemUTC());
  }

  public CorrectionLoopController(StatementGuard guard,
                                  QueryExecutor executor,
                                  StatementGenerator generator,
                                  AuditSink audit,
                                  CorrectionSettings settings,
                                  Clock clock) {
    this.guard = Objects.requireNonNull(guard, "guard");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.generator = Objects.requireNonNull(generator, "generator");
    this.audit = Objects.requireNonNull(audit, "audit");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.clock = Objects.requireNonNull(clock, "clock");
    AtomicInteger n = new AtomicInteger();
    this.generationWorkers = Executors.newCachedThreadPool(r -> {
      Thread t = new Thread(r, "sqlgate-gen-" + n.incrementAndGet());
      t.setDaemon(true);
      return t;
    });
  }

  public CorrectionSettings settings() {
    return settings;
  }

  public LoopOutcome run(LoopRequest req) {
    Objects.requireNonNull(req, "req");
    int maxAttempts = req.revise() ? settings.maxAttempts() : 1;
    CorrectionSession session = new CorrectionSession(req.tenantKey(), req.intent(), maxAttempts, clock.instant());
    boolean limitApplied = false;
    try {
      String candidate = req.initialStatement();
      String priorStatement = null;
      String priorError = null;
      for (int attempt = 1; ; attempt++) {
        Instant started = clock.instant();

        if (candidate == null) {
          try {
            candidate = generate(req, priorStatement, priorError);
          } catch (GenerationFailedException e) {
            session.append(QueryAttempt.failed(req.tenantKey(), attempt, priorStatement, started, clock.instant(),
                ErrorCategory.GENERATION_FAILED, e.getMessage()));
            finish(session, SessionStatus.FAILED, ErrorCategory.GENERATION_FAILED, e.getMessage());
            break;
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            session.append(QueryAttempt.failed(req.tenantKey(), attempt, priorStatement, started, clock.instant(),
                ErrorCategory.CANCELLED, "Request cancelled during statement generation"));
            finish(session, SessionStatus.FAILED, ErrorCategory.CANCELLED, "Request cancelled during statement generation");
            break;
          }
        }

        GuardVerdict verdict = guard.validate(candidate, req.rowLimit());
        if (!verdict.accepted()) {
          session.append(QueryAttempt.failed(req.tenantKey(), attempt, candidate, started, clock.instant(),
              ErrorCategory.GUARD_REJECTION, verdict.reason()));
          log.info("sqlgate.loop guard_rejected tenant={} session={} attempt={} reason={}",
              req.tenantKey(), session.sessionId(), attempt, verdict.reason());
          finish(session, SessionStatus.REJECTED_BY_GUARD, ErrorCategory.GUARD_REJECTION, verdict.reason());
          break;
        }
        limitApplied = verdict.limitInjected();

        ExecutionOutcome out = executor.execute(req.tenantKey(), verdict.statement(), settings.queryTimeout(),
            req.rowLimit());
        if (out.isSuccess()) {
          session.append(QueryAttempt.succeeded(req.tenantKey(), attempt, verdict.statement(), started, clock.instant(),
              out.result()));
          log.info("sqlgate.loop attempt tenant={} session={} attempt={} outcome=success rows={}",
              req.tenantKey(), session.sessionId(), attempt, out.result().rowCount());
          finish(session, SessionStatus.SUCCEEDED, null, null);
          break;
        }

        ExecutionError err = out.error();
        session.append(QueryAttempt.failed(req.tenantKey(), attempt, verdict.statement(), started, clock.instant(),
            err.category(), err.message()));
        log.info("sqlgate.loop attempt tenant={} session={} attempt={} outcome={} sqlState={}",
            req.tenantKey(), session.sessionId(), attempt, err.category().wireName(), err.sqlState());

        if (!err.category().correctable() || !req.revise()) {
          finish(session, SessionStatus.FAILED, err.category(), err.message());
          break;
        }
        if (attempt >= maxAttempts) {
          finish(session, SessionStatus.EXHAUSTED, ErrorCategory.RETRY_BUDGET_EXHAUSTED,
              "Query failed after " + attempt + " attempts. Last error: " + err.message());
          break;
        }

        priorStatement = verdict.statement();
        priorError = err.message();
        candidate = null;
      }
    } finally {
      if (session.completed()) flush(session);
    }
    return new LoopOutcome(session, limitApplied);
  }

  /**
   * Generates one statement and validates it without executing anything.\n
   *
   * @throws GenerationFailedException if the generator fails, times out or the caller is interrupted
   */
  public GuardVerdict generateOnly(LoopRequest req) {
    String candidate = req.initialStatement();
    if (candidate == null) {
      try {
        candidate = generate(req, null, null);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new GenerationFailedException("Request cancelled during statement generation", e);
      }
    }
    return guard.validate(candidate, req.rowLimit());
  }

  @Override
  public void close() {
    generationWorkers.shutdownNow();
  }

  private String generate(LoopRequest req, String priorStatement, String priorError) throws InterruptedException {
    GenerationRequest gr = priorStatement == null
        ? GenerationRequest.initial(req.tenantKey(), req.intent(), req.catalog())
        : GenerationRequest.revision(req.tenantKey(), req.intent(), req.catalog(), priorStatement, priorError);
    Future<String> f = generationWorkers.submit(() -> generator.generate(gr));
    String out;
    try {
      out = f.get(settings.generationTimeout().toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      f.cancel(true);
      throw new GenerationFailedException(
          "Statement generation timed out after " + settings.generationTimeout().toMillis() + " ms");
    } catch (InterruptedException e) {
      f.cancel(true);
      throw e;
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof GenerationFailedException gfe) throw gfe;
      throw new GenerationFailedException("Statement generation failed: " + cause, cause);
    }
    if (out == null || out.isBlank()) throw new GenerationFailedException("Statement generator returned no statement");
    return out;
  }

  private void finish(CorrectionSession session, SessionStatus status, ErrorCategory category, String message) {
    session.complete(status, category, message, clock.instant());
    log.info("sqlgate.loop done tenant={} session={} status={} attempts={}",
        session.tenantKey(), session.sessionId(), status.wireName(), session.attemptCount());
  }

  private void flush(CorrectionSession session) {
    try {
      audit.record(session);
    } catch (RuntimeException e) {
      log.warn("sqlgate.audit failed session={} tenant={} error={}", session.sessionId(), session.tenantKey(), e.toString());
    }
  }
}
