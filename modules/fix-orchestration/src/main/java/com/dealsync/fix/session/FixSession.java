package com.dealsync.fix.session;

import com.dealsync.fix.issue.ValidationIssue;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * One run of the fix workflow for a tenant. Instances are immutable; every change produces a new
 * snapshot.
 */
public record FixSession(
    String id,
    String tenantId,
    String tenantName,
    Instant startTime,
    Instant endTime,
    FixSessionStatus status,
    List<ValidationIssue> issues,
    List<FixResult> fixResults,
    FixSummary summary,
    String error) {
  public FixSession {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("id must not be blank");
    }
    if (tenantId == null || tenantId.isBlank()) {
      throw new IllegalArgumentException("tenantId must not be blank");
    }
    tenantName = Objects.requireNonNullElse(tenantName, tenantId);
    Objects.requireNonNull(startTime, "startTime must not be null");
    Objects.requireNonNull(status, "status must not be null");
    issues = List.copyOf(issues);
    fixResults = List.copyOf(fixResults);
  }

  public static FixSession create(
      String tenantId, String tenantName, List<ValidationIssue> issues, Instant startTime) {
    return new FixSession(
        "fix_" + UUID.randomUUID(),
        tenantId,
        tenantName,
        startTime,
        null,
        FixSessionStatus.PENDING,
        issues,
        List.of(),
        null,
        null);
  }

  public FixSession transitionTo(FixSessionStatus nextStatus, Instant now) {
    FixSessionStateMachine.validateTransition(status, nextStatus);
    Instant nextEndTime = nextStatus.isTerminal() ? now : endTime;
    return new FixSession(
        id, tenantId, tenantName, startTime, nextEndTime, nextStatus, issues, fixResults, summary,
        error);
  }

  public FixSession withFixResults(List<FixResult> nextResults) {
    return new FixSession(
        id, tenantId, tenantName, startTime, endTime, status, issues, nextResults, summary, error);
  }

  public FixSession withAppendedResults(List<FixResult> appended) {
    List<FixResult> combined = new ArrayList<>(fixResults);
    combined.addAll(appended);
    return withFixResults(combined);
  }

  public FixSession withSummary(FixSummary nextSummary) {
    return new FixSession(
        id, tenantId, tenantName, startTime, endTime, status, issues, fixResults, nextSummary,
        error);
  }

  public FixSession withError(String nextError) {
    return new FixSession(
        id, tenantId, tenantName, startTime, endTime, status, issues, fixResults, summary,
        nextError);
  }

  public boolean isCancelled() {
    return status == FixSessionStatus.CANCELLED;
  }
}
