package com.dealsync.fix.orchestrator;

import com.dealsync.fix.handler.FixHandler;
import com.dealsync.fix.handler.FixHandlerContext;
import com.dealsync.fix.handler.FixHandlerRegistry;
import com.dealsync.fix.handler.FixHandlerResult;
import com.dealsync.fix.issue.PipelinePlacementPayload;
import com.dealsync.fix.issue.TitleFormatPayload;
import com.dealsync.fix.issue.ValidationIssue;
import com.dealsync.fix.session.FixResult;
import com.dealsync.fix.session.FixResultStatus;
import com.dealsync.fix.session.FixSession;
import com.dealsync.fix.session.FixSessionException;
import com.dealsync.fix.session.FixSessionStatus;
import com.dealsync.fix.session.FixStep;
import com.dealsync.fix.session.FixSummary;
import com.dealsync.fix.session.RollbackReport;
import com.dealsync.integration.pipedrive.PipedriveCredentials;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one fix session through analyze, validate, apply and summary steps.
 *
 * <p>An orchestrator owns at most one session. Fixes are applied sequentially in batches, each
 * issue with linear retry backoff, behind a consecutive-failure circuit breaker. {@link
 * #cancelSession()} may be called from any thread; the apply step honours it at the next batch
 * boundary and records every issue it did not reach as skipped.
 */
public class FixOrchestrator {
  private static final Logger log = LoggerFactory.getLogger(FixOrchestrator.class);
  private static final String RESULT_COUNTER = "fix.orchestrator.result";

  static final String NO_HANDLER = "No handler available";
  static final String DRY_RUN = "Dry run: fix not applied";
  static final String CIRCUIT_OPEN = "Circuit breaker open";
  static final String CANCELLED = "Session cancelled";

  private final FixHandlerRegistry registry;
  private final FixOrchestrationConfig config;
  private final Clock clock;
  private final Sleeper sleeper;
  private final MeterRegistry meterRegistry;

  private volatile FixSessionState state;
  private volatile FixProgressListener progressListener = FixProgressListener.NO_OP;

  public FixOrchestrator(
      FixHandlerRegistry registry, FixOrchestrationConfig config, MeterRegistry meterRegistry) {
    this(
        registry,
        config,
        Clock.systemUTC(),
        duration -> Thread.sleep(duration.toMillis()),
        meterRegistry);
  }

  public FixOrchestrator(
      FixHandlerRegistry registry,
      FixOrchestrationConfig config,
      Clock clock,
      Sleeper sleeper,
      MeterRegistry meterRegistry) {
    this.registry = Objects.requireNonNull(registry, "registry must not be null");
    this.config = Objects.requireNonNull(config, "config must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry must not be null");
  }

  public void setProgressListener(FixProgressListener listener) {
    this.progressListener = listener == null ? FixProgressListener.NO_OP : listener;
  }

  public synchronized FixSession initializeSession(
      String tenantId, String tenantName, List<ValidationIssue> issues) {
    if (state != null) {
      throw new FixSessionException(
          "Fix session already initialized sessionId=" + state.session().id());
    }
    List<ValidationIssue> candidates = new ArrayList<>();
    for (ValidationIssue issue : Objects.requireNonNull(issues, "issues must not be null")) {
      if (!config.manualResolutionCodes().contains(issue.code())) {
        candidates.add(issue);
      }
    }
    FixSession session = FixSession.create(tenantId, tenantName, candidates, clock.instant());
    state =
        new FixSessionState(
            session,
            new CircuitBreaker(
                config.circuitBreakerThreshold(),
                config.circuitBreakerReset(),
                clock,
                meterRegistry));
    log.info(
        "Initialized fix session sessionId={} tenantId={} issues={} manualResolution={}",
        session.id(),
        tenantId,
        candidates.size(),
        issues.size() - candidates.size());
    return session;
  }

  /**
   * Runs the full workflow against the record store. Returns the terminal session, which is
   * {@code COMPLETED} or, when cancelled during the run, {@code CANCELLED}.
   *
   * @throws FixSessionException when no session is initialized or it is no longer pending
   * @throws FixWorkflowException when a step fails; the session is left {@code FAILED}
   */
  public FixSession executeFixWorkflow(PipedriveCredentials credentials) {
    FixSessionState current = requireState();
    Instant startedAt = clock.instant();
    FixSession running = current.update(s -> s.transitionTo(FixSessionStatus.RUNNING, startedAt));
    FixHandlerContext context = new FixHandlerContext(credentials, running.tenantId(), config);
    log.info(
        "Fix workflow started sessionId={} tenantId={} issues={} dryRun={}",
        running.id(),
        running.tenantId(),
        running.issues().size(),
        config.dryRun());

    try {
      List<ValidationIssue> fixable =
          runStep(
              FixWorkflowStep.ANALYZE_ISSUES,
              progress -> analyzeIssues(current, progress),
              issues -> issues.size() + " fixable issue(s)");
      List<ValidationIssue> validated =
          runStep(
              FixWorkflowStep.VALIDATE_FIXES,
              progress -> validateFixes(fixable, context, progress),
              issues -> issues.size() + " issue(s) passed validation");
      runStep(
          FixWorkflowStep.APPLY_FIXES,
          progress -> applyFixes(current, validated, context, progress),
          batches -> batches + " batch(es) executed");
      FixSummary summary =
          runStep(
              FixWorkflowStep.GENERATE_SUMMARY,
              progress -> generateSummary(current, validated.size(), progress),
              generated ->
                  generated.fixedCount()
                      + " fixed, "
                      + generated.skippedCount()
                      + " skipped, "
                      + generated.failedCount()
                      + " failed");

      Instant finishedAt = clock.instant();
      FixSession finished =
          current.update(
              s ->
                  (s.isCancelled() ? s : s.transitionTo(FixSessionStatus.COMPLETED, finishedAt))
                      .withSummary(summary));
      log.info(
          "Fix workflow finished sessionId={} status={} fixed={} skipped={} failed={}",
          finished.id(),
          finished.status(),
          summary.fixedCount(),
          summary.skippedCount(),
          summary.failedCount());
      return finished;
    } catch (FixWorkflowException ex) {
      Instant failedAt = clock.instant();
      String error = describe(ex.getCause());
      FixSession failed =
          current.update(
              s ->
                  (s.status().isTerminal() ? s : s.transitionTo(FixSessionStatus.FAILED, failedAt))
                      .withError(error));
      log.error(
          "Fix workflow failed sessionId={} status={} error={}",
          failed.id(),
          failed.status(),
          error,
          ex);
      throw ex;
    }
  }

  /**
   * Reverses every fixed result of the session. Individual failures are logged and counted, never
   * rethrown.
   */
  public RollbackReport rollbackSession(PipedriveCredentials credentials) {
    FixSession session = requireState().session();
    if (session.status() == FixSessionStatus.RUNNING) {
      throw new FixSessionException("Cannot roll back a running session sessionId=" + session.id());
    }
    FixHandlerContext context = new FixHandlerContext(credentials, session.tenantId(), config);
    List<FixResult> fixed =
        session.fixResults().stream()
            .filter(result -> result.status() == FixResultStatus.FIXED)
            .toList();
    if (fixed.isEmpty()) {
      log.info("Nothing to roll back sessionId={}", session.id());
      return RollbackReport.empty();
    }

    int succeeded = 0;
    for (FixResult result : fixed) {
      Optional<ValidationIssue> issue =
          session.issues().stream()
              .filter(
                  candidate ->
                      candidate.code() == result.issueCode()
                          && Objects.equals(candidate.recordId(), result.recordId()))
              .findFirst();
      Optional<FixHandler> handler = registry.resolve(result.issueCode());
      if (issue.isEmpty() || handler.isEmpty()) {
        log.warn(
            "Rollback skipped sessionId={} recordId={} code={} reason=issue or handler not found",
            session.id(),
            result.recordId(),
            result.issueCode());
        continue;
      }
      try {
        if (handler.get().rollback(issue.get(), result.rollbackData(), context)) {
          succeeded++;
        } else {
          log.warn(
              "Rollback rejected sessionId={} recordId={} code={}",
              session.id(),
              result.recordId(),
              result.issueCode());
        }
      } catch (RuntimeException ex) {
        log.error(
            "Rollback failed sessionId={} recordId={} code={}",
            session.id(),
            result.recordId(),
            result.issueCode(),
            ex);
      }
    }
    RollbackReport report = new RollbackReport(fixed.size(), succeeded);
    log.info(
        "Rollback finished sessionId={} attempted={} succeeded={}",
        session.id(),
        report.attempted(),
        report.succeeded());
    return report;
  }

  /** Returns {@code true} when this call moved the session to {@code CANCELLED}. */
  public boolean cancelSession() {
    FixSessionState current = state;
    if (current == null) {
      return false;
    }
    AtomicBoolean cancelled = new AtomicBoolean();
    Instant now = clock.instant();
    FixSession session =
        current.update(
            s -> {
              if (s.status().isTerminal()) {
                return s;
              }
              cancelled.set(true);
              return s.transitionTo(FixSessionStatus.CANCELLED, now);
            });
    if (cancelled.get()) {
      log.info("Fix session cancelled sessionId={}", session.id());
    }
    return cancelled.get();
  }

  public Optional<FixSession> getSession() {
    FixSessionState current = state;
    return current == null ? Optional.empty() : Optional.of(current.session());
  }

  private List<ValidationIssue> analyzeIssues(FixSessionState current, StepProgress progress) {
    List<ValidationIssue> issues = current.session().issues();
    List<ValidationIssue> fixable = new ArrayList<>();
    List<FixResult> unhandled = new ArrayList<>();
    progress.begin(issues.size());
    for (ValidationIssue issue : issues) {
      if (registry.resolve(issue.code()).filter(handler -> handler.canHandle(issue)).isPresent()) {
        fixable.add(issue);
      } else {
        unhandled.add(skipped(issue, NO_HANDLER));
      }
      progress.advance();
    }
    record(current, unhandled);
    return fixable;
  }

  private List<ValidationIssue> validateFixes(
      List<ValidationIssue> fixable, FixHandlerContext context, StepProgress progress) {
    List<ValidationIssue> validated = new ArrayList<>();
    progress.begin(fixable.size());
    for (ValidationIssue issue : fixable) {
      FixHandler handler = handlerFor(issue);
      try {
        if (handler.validate(issue, context)) {
          validated.add(issue);
        } else {
          log.debug(
              "Fix rejected by validation recordId={} code={} handlerId={}",
              issue.recordId(),
              issue.code(),
              handler.handlerId());
        }
      } catch (RuntimeException ex) {
        log.warn(
            "Fix validation errored recordId={} code={} handlerId={}",
            issue.recordId(),
            issue.code(),
            handler.handlerId(),
            ex);
      }
      progress.advance();
    }
    return validated;
  }

  private int applyFixes(
      FixSessionState current,
      List<ValidationIssue> validated,
      FixHandlerContext context,
      StepProgress progress) {
    int index = 0;
    int batches = 0;
    progress.begin(validated.size());
    while (index < validated.size()) {
      String haltReason = haltReason(current);
      if (haltReason != null) {
        List<ValidationIssue> remaining = validated.subList(index, validated.size());
        log.warn(
            "Stopping fix application reason={} remaining={}", haltReason, remaining.size());
        List<FixResult> skipped = new ArrayList<>();
        for (ValidationIssue issue : remaining) {
          skipped.add(skipped(issue, haltReason));
          progress.advance();
        }
        record(current, skipped);
        break;
      }

      int batchEnd = Math.min(index + config.batchSize(), validated.size());
      List<FixResult> batchResults = new ArrayList<>();
      while (index < batchEnd && !current.circuitBreaker().isOpen()) {
        batchResults.add(applyWithRetry(current, validated.get(index), context));
        progress.advance();
        index++;
      }
      batches++;
      current.recordBatch();
      record(current, batchResults);
      log.debug("Fix batch executed batch={} results={}", batches, batchResults.size());

      if (index == batchEnd && index < validated.size()) {
        sleep(config.interBatchDelay());
      }
    }
    return batches;
  }

  private FixResult applyWithRetry(
      FixSessionState current, ValidationIssue issue, FixHandlerContext context) {
    if (config.dryRun()) {
      return skipped(issue, DRY_RUN);
    }
    FixHandler handler = handlerFor(issue);
    String lastError = "Fix failed";
    for (int attempt = 1; attempt <= config.retryAttempts(); attempt++) {
      try {
        FixHandlerResult result = handler.applyFix(issue, context);
        if (result.success()) {
          current.circuitBreaker().recordSuccess();
          return FixResult.fixed(
              issue.code(),
              issue.recordId(),
              result.originalValue(),
              result.newValue(),
              result.rollbackData(),
              clock.instant());
        }
        lastError = result.error() == null ? "Fix failed" : result.error();
      } catch (RuntimeException ex) {
        lastError = describe(ex);
        log.warn(
            "Fix attempt errored recordId={} code={} attempt={}",
            issue.recordId(),
            issue.code(),
            attempt,
            ex);
      }
      if (attempt < config.retryAttempts()) {
        log.debug(
            "Retrying fix recordId={} attempt={} error={}", issue.recordId(), attempt, lastError);
        sleep(config.retryDelayForAttempt(attempt));
      }
    }
    current.circuitBreaker().recordFailure();
    log.warn(
        "Fix failed after retries recordId={} code={} attempts={} error={}",
        issue.recordId(),
        issue.code(),
        config.retryAttempts(),
        lastError);
    return FixResult.failed(
        issue.code(), issue.recordId(), originalValue(issue), lastError, clock.instant());
  }

  private FixSummary generateSummary(
      FixSessionState current, int fixableIssues, StepProgress progress) {
    FixSession session = current.session();
    List<FixResult> results = session.fixResults();
    int fixed = count(results, FixResultStatus.FIXED);
    int skipped = count(results, FixResultStatus.SKIPPED);
    int failed = count(results, FixResultStatus.FAILED);
    progress.begin(1);
    progress.advance();

    List<String> recommendations = new ArrayList<>();
    if (fixed > 0) {
      recommendations.add("Successfully fixed " + fixed + " deal title(s)");
    }
    if (failed > 0) {
      recommendations.add(failed + " fix(es) failed - manual review required");
    }
    if (skipped > 0) {
      recommendations.add(skipped + " issue(s) were skipped - see individual results for reasons");
    }
    int timesOpened = current.circuitBreaker().timesOpened();
    if (timesOpened > 0) {
      recommendations.add(
          "Circuit breaker opened "
              + timesOpened
              + " time(s) - check record store availability before retrying");
    }
    return new FixSummary(
        session.issues().size(),
        fixableIssues,
        fixed,
        skipped,
        failed,
        current.batchesExecuted(),
        Duration.between(session.startTime(), clock.instant()),
        results,
        recommendations);
  }

  private <T> T runStep(
      FixWorkflowStep step, StepBody<T> body, Function<T, String> describer) {
    FixStep running = step.pending().running(clock.instant());
    try {
      FixProgressListener listener = progressListener;
      listener.onStep(running);
      StepProgress progress = new StepProgress(running, listener);
      T outcome = body.run(progress);
      progress.finish();
      listener.onStep(running.completed(clock.instant(), describer.apply(outcome)));
      return outcome;
    } catch (RuntimeException ex) {
      FixWorkflowException failure =
          new FixWorkflowException("Fix workflow failed at step " + step.id(), ex);
      try {
        progressListener.onStep(running.failed(clock.instant(), describe(ex)));
      } catch (RuntimeException listenerFailure) {
        failure.addSuppressed(listenerFailure);
      }
      throw failure;
    }
  }

  private String haltReason(FixSessionState current) {
    if (current.isCancelled()) {
      return CANCELLED;
    }
    if (current.circuitBreaker().isOpen()) {
      return CIRCUIT_OPEN;
    }
    return null;
  }

  private void record(FixSessionState current, List<FixResult> results) {
    if (results.isEmpty()) {
      return;
    }
    current.update(s -> s.withAppendedResults(results));
    for (FixResult result : results) {
      meterRegistry
          .counter(RESULT_COUNTER, "status", result.status().name().toLowerCase(Locale.ROOT))
          .increment();
    }
  }

  private FixResult skipped(ValidationIssue issue, String reason) {
    return FixResult.skipped(
        issue.code(), issue.recordId(), originalValue(issue), reason, clock.instant());
  }

  private FixHandler handlerFor(ValidationIssue issue) {
    return registry
        .resolve(issue.code())
        .orElseThrow(() -> new IllegalStateException("No handler for code " + issue.code()));
  }

  private void sleep(Duration duration) {
    if (duration.isZero() || duration.isNegative()) {
      return;
    }
    try {
      sleeper.sleep(duration);
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while pausing fix workflow", interrupted);
    }
  }

  private FixSessionState requireState() {
    FixSessionState current = state;
    if (current == null) {
      throw new FixSessionException("No fix session initialized");
    }
    return current;
  }

  private static String originalValue(ValidationIssue issue) {
    if (issue.payload() instanceof TitleFormatPayload title) {
      return title.dealTitle();
    }
    if (issue.payload() instanceof PipelinePlacementPayload placement) {
      return placement.dealTitle();
    }
    return null;
  }

  private static int count(List<FixResult> results, FixResultStatus status) {
    return (int) results.stream().filter(result -> result.status() == status).count();
  }

  private static String describe(Throwable ex) {
    if (ex == null) {
      return "Unknown error";
    }
    return ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
  }

  @FunctionalInterface
  private interface StepBody<T> {
    T run(StepProgress progress);
  }

  @FunctionalInterface
  public interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;
  }
}
