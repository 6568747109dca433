package com.dealsync.domain.matching;

import java.util.List;

public record MatchResult(
    List<ProjectMatch> matches, List<CanonicalRecord> unmatchedA, List<CanonicalRecord> unmatchedB) {
  public MatchResult {
    matches = List.copyOf(matches);
    unmatchedA = List.copyOf(unmatchedA);
    unmatchedB = List.copyOf(unmatchedB);
  }
}
