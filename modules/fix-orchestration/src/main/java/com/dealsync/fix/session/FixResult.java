package com.dealsync.fix.session;

import com.dealsync.fix.handler.RollbackData;
import com.dealsync.fix.issue.IssueCode;
import java.time.Instant;
import java.util.Objects;

public record FixResult(
    IssueCode issueCode,
    String recordId,
    String originalValue,
    String newValue,
    FixResultStatus status,
    String error,
    Instant timestamp,
    RollbackData rollbackData) {
  public FixResult {
    Objects.requireNonNull(issueCode, "issueCode must not be null");
    Objects.requireNonNull(status, "status must not be null");
    Objects.requireNonNull(timestamp, "timestamp must not be null");
    if ((status == FixResultStatus.FIXED) != (rollbackData != null)) {
      throw new IllegalArgumentException("rollbackData must be present exactly when status is FIXED");
    }
  }

  public static FixResult fixed(
      IssueCode issueCode,
      String recordId,
      String originalValue,
      String newValue,
      RollbackData rollbackData,
      Instant timestamp) {
    return new FixResult(
        issueCode, recordId, originalValue, newValue, FixResultStatus.FIXED, null, timestamp,
        rollbackData);
  }

  public static FixResult skipped(
      IssueCode issueCode, String recordId, String originalValue, String reason, Instant timestamp) {
    return new FixResult(
        issueCode, recordId, originalValue, null, FixResultStatus.SKIPPED, reason, timestamp, null);
  }

  public static FixResult failed(
      IssueCode issueCode, String recordId, String originalValue, String error, Instant timestamp) {
    return new FixResult(
        issueCode, recordId, originalValue, null, FixResultStatus.FAILED, error, timestamp, null);
  }
}
