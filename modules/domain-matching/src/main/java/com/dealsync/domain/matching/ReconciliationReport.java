package com.dealsync.domain.matching;

import java.util.List;

public record ReconciliationReport(
    int sideACount,
    int sideBCount,
    int matchedCount,
    List<ProjectMatch> matches,
    List<ValueDiscrepancy> valueDiscrepancies,
    List<UnmatchedRecord> unmatchedA,
    List<UnmatchedRecord> unmatchedB,
    List<String> recommendations) {
  public ReconciliationReport {
    matches = List.copyOf(matches);
    valueDiscrepancies = List.copyOf(valueDiscrepancies);
    unmatchedA = List.copyOf(unmatchedA);
    unmatchedB = List.copyOf(unmatchedB);
    recommendations = List.copyOf(recommendations);
  }

  public int unmatchedACount() {
    return unmatchedA.size();
  }

  public int unmatchedBCount() {
    return unmatchedB.size();
  }
}
