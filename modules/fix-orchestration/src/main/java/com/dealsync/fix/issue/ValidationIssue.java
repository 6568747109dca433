package com.dealsync.fix.issue;

import java.util.Objects;

public record ValidationIssue(
    IssueCode code,
    IssueSeverity severity,
    String message,
    IssuePayload payload,
    String suggestedFix,
    String category) {
  public ValidationIssue {
    Objects.requireNonNull(code, "code must not be null");
    Objects.requireNonNull(severity, "severity must not be null");
    Objects.requireNonNull(payload, "payload must not be null");
    message = Objects.requireNonNullElse(message, "");
  }

  public String recordId() {
    return payload.recordId();
  }
}
