package com.dealsync.domain.matching;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.Test;

class DiscrepancyAnalyzerTest {
  private final RecordMatcher matcher = new RecordMatcher(ValueTolerance.ofPercent(5));

  @Test
  void shouldReportDiscrepanciesAndResiduals() {
    List<CanonicalRecord> deals =
        List.of(record("d-1", "ED1 - Alpha", "1000"), record("d-2", "ED2 - Beta", "50"));
    List<CanonicalRecord> projects =
        List.of(record("p-1", "ED1 - Alpha", "1500"), record("p-9", "ED9 - Omega", "10"));

    ReconciliationReport report =
        new DiscrepancyAnalyzer(true).analyze(deals, projects, matcher.match(deals, projects));

    assertEquals(2, report.sideACount());
    assertEquals(2, report.sideBCount());
    assertEquals(1, report.matchedCount());
    assertEquals(1, report.valueDiscrepancies().size());
    ValueDiscrepancy discrepancy = report.valueDiscrepancies().get(0);
    assertEquals("ed1-alpha", discrepancy.matchKey());
    assertEquals(0, new BigDecimal("500").compareTo(discrepancy.difference()));
    assertEquals("ed2-beta", report.unmatchedA().get(0).matchKey());
    assertEquals("ed9-omega", report.unmatchedB().get(0).matchKey());
    assertEquals(
        List.of(
            "1 won deal(s) need to be created as projects",
            "1 project(s) may need to be reviewed or linked to deals",
            "1 project(s) have value discrepancies that need reconciliation"),
        report.recommendations());
  }

  @Test
  void shouldSkipValueComparisonWhenDisabled() {
    List<CanonicalRecord> deals = List.of(record("d-1", "ED1 - Alpha", "1000"));
    List<CanonicalRecord> projects = List.of(record("p-1", "ED1 - Alpha", "9000"));

    ReconciliationReport report =
        new DiscrepancyAnalyzer(false).analyze(deals, projects, matcher.match(deals, projects));

    assertTrue(report.valueDiscrepancies().isEmpty());
    assertEquals(List.of("All projects are synchronized"), report.recommendations());
  }

  @Test
  void shouldSuggestNamingReviewWhenNothingMatches() {
    List<CanonicalRecord> deals = List.of(record("d-1", "ED1 - Alpha", "1"));
    List<CanonicalRecord> projects = List.of(record("p-1", "ED2 - Beta", "1"));

    ReconciliationReport report =
        new DiscrepancyAnalyzer(true).analyze(deals, projects, matcher.match(deals, projects));

    assertTrue(
        report.recommendations()
            .contains("No matches found - review record naming conventions in both systems"));
  }

  private static CanonicalRecord record(String id, String name, String value) {
    return new CanonicalRecord(id, name, new BigDecimal(value), "USD");
  }
}
