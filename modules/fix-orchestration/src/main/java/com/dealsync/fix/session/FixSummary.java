package com.dealsync.fix.session;

import java.time.Duration;
import java.util.List;

public record FixSummary(
    int totalIssues,
    int fixableIssues,
    int fixedCount,
    int skippedCount,
    int failedCount,
    int batchesExecuted,
    Duration duration,
    List<FixResult> fixResults,
    List<String> recommendations) {
  public FixSummary {
    fixResults = List.copyOf(fixResults);
    recommendations = List.copyOf(recommendations);
  }
}
