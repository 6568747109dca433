package com.dealsync.domain.matching;

import java.util.ArrayList;
import java.util.List;

/** Turns a {@link MatchResult} into a report of value discrepancies and follow-up actions. */
public class DiscrepancyAnalyzer {
  private final boolean valueComparisonEnabled;

  public DiscrepancyAnalyzer(boolean valueComparisonEnabled) {
    this.valueComparisonEnabled = valueComparisonEnabled;
  }

  public ReconciliationReport analyze(
      List<CanonicalRecord> sideA, List<CanonicalRecord> sideB, MatchResult result) {
    List<ValueDiscrepancy> discrepancies = findDiscrepancies(result.matches());
    List<UnmatchedRecord> unmatchedA = withKeys(result.unmatchedA());
    List<UnmatchedRecord> unmatchedB = withKeys(result.unmatchedB());
    return new ReconciliationReport(
        sideA.size(),
        sideB.size(),
        result.matches().size(),
        result.matches(),
        discrepancies,
        unmatchedA,
        unmatchedB,
        recommendations(sideA, sideB, result, discrepancies));
  }

  List<ValueDiscrepancy> findDiscrepancies(List<ProjectMatch> matches) {
    List<ValueDiscrepancy> discrepancies = new ArrayList<>();
    if (!valueComparisonEnabled) {
      return discrepancies;
    }
    for (ProjectMatch match : matches) {
      if (match.valueMatch()) {
        continue;
      }
      discrepancies.add(
          new ValueDiscrepancy(
              match.sideB().name(),
              match.matchKey(),
              match.sideA().value(),
              match.sideB().value(),
              match.valueDifference(),
              match.valueDifferencePercentage()));
    }
    return discrepancies;
  }

  private static List<UnmatchedRecord> withKeys(List<CanonicalRecord> records) {
    List<UnmatchedRecord> annotated = new ArrayList<>(records.size());
    for (CanonicalRecord record : records) {
      annotated.add(new UnmatchedRecord(record, MatchKeyGenerator.generate(record.name())));
    }
    return annotated;
  }

  private static List<String> recommendations(
      List<CanonicalRecord> sideA,
      List<CanonicalRecord> sideB,
      MatchResult result,
      List<ValueDiscrepancy> discrepancies) {
    List<String> recommendations = new ArrayList<>();
    if (!result.unmatchedA().isEmpty()) {
      recommendations.add(
          result.unmatchedA().size() + " won deal(s) need to be created as projects");
    }
    if (!result.unmatchedB().isEmpty()) {
      recommendations.add(
          result.unmatchedB().size() + " project(s) may need to be reviewed or linked to deals");
    }
    if (!discrepancies.isEmpty()) {
      recommendations.add(
          discrepancies.size() + " project(s) have value discrepancies that need reconciliation");
    }
    if (result.matches().isEmpty() && !sideA.isEmpty() && !sideB.isEmpty()) {
      recommendations.add("No matches found - review record naming conventions in both systems");
      recommendations.add("Consider standardizing names or using common project codes");
    }
    if (recommendations.isEmpty()) {
      recommendations.add("All projects are synchronized");
    }
    return recommendations;
  }
}
