package com.dealsync.worker.fix;

import com.dealsync.fix.handler.FixHandlerRegistry;
import com.dealsync.fix.issue.JacksonValidationIssueReader;
import com.dealsync.fix.issue.ValidationIssue;
import com.dealsync.fix.orchestrator.FixOrchestrationConfig;
import com.dealsync.fix.orchestrator.FixOrchestrator;
import com.dealsync.fix.orchestrator.FixProgressListener;
import com.dealsync.fix.session.FixSession;
import com.dealsync.fix.session.FixSessionException;
import com.dealsync.fix.session.RollbackReport;
import com.dealsync.integration.pipedrive.PipedriveCredentials;
import com.dealsync.integration.pipedrive.RequestPacer;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs fix sessions from rule engine output. Each session gets its own orchestrator, kept until
 * {@link #release(String)} so it can still be cancelled or rolled back.
 *
 * <p>{@link #start} hands back the session id before any fix runs, so callers can cancel or
 * inspect the session from another thread while {@link #execute} is in progress. Starting a
 * session resets the shared request pacer; sessions are expected to run one at a time.
 */
@Service
public class FixSessionService {
  private static final Logger log = LoggerFactory.getLogger(FixSessionService.class);

  private final FixHandlerRegistry registry;
  private final FixOrchestrationConfig config;
  private final JacksonValidationIssueReader issueReader;
  private final MeterRegistry meterRegistry;
  private final RequestPacer requestPacer;
  private final Map<String, FixOrchestrator> orchestrators = new ConcurrentHashMap<>();

  public FixSessionService(
      FixHandlerRegistry registry,
      FixOrchestrationConfig config,
      JacksonValidationIssueReader issueReader,
      MeterRegistry meterRegistry,
      RequestPacer requestPacer) {
    this.registry = registry;
    this.config = config;
    this.issueReader = issueReader;
    this.meterRegistry = meterRegistry;
    this.requestPacer = requestPacer;
  }

  /** Registers a {@code PENDING} session for the issues; nothing is sent to the record store. */
  public FixSession start(
      String tenantId, String tenantName, String issuesJson, FixProgressListener listener) {
    List<ValidationIssue> issues = issueReader.readAll(issuesJson);
    FixOrchestrator orchestrator = newOrchestrator();
    orchestrator.setProgressListener(listener);
    FixSession session = orchestrator.initializeSession(tenantId, tenantName, issues);
    orchestrators.put(session.id(), orchestrator);
    log.info(
        "Fix session registered sessionId={} tenantId={} receivedIssues={} fixableIssues={}",
        session.id(),
        tenantId,
        issues.size(),
        session.issues().size());
    return session;
  }

  /** Runs the workflow of a started session and blocks until it is terminal. */
  public FixSession execute(String sessionId, PipedriveCredentials credentials) {
    FixOrchestrator orchestrator = require(sessionId);
    requestPacer.reset();
    log.info("Executing fix session sessionId={}", sessionId);
    return orchestrator.executeFixWorkflow(credentials);
  }

  public Optional<FixSession> findSession(String sessionId) {
    FixOrchestrator orchestrator = orchestrators.get(sessionId);
    return orchestrator == null ? Optional.empty() : orchestrator.getSession();
  }

  public boolean cancel(String sessionId) {
    FixOrchestrator orchestrator = orchestrators.get(sessionId);
    return orchestrator != null && orchestrator.cancelSession();
  }

  public RollbackReport rollback(String sessionId, PipedriveCredentials credentials) {
    return require(sessionId).rollbackSession(credentials);
  }

  public void release(String sessionId) {
    orchestrators.remove(sessionId);
  }

  private FixOrchestrator require(String sessionId) {
    FixOrchestrator orchestrator = orchestrators.get(sessionId);
    if (orchestrator == null) {
      throw new FixSessionException("Unknown fix session sessionId=" + sessionId);
    }
    return orchestrator;
  }

  FixOrchestrator newOrchestrator() {
    return new FixOrchestrator(registry, config, meterRegistry);
  }
}
