package com.dealsync.worker.reconciliation;

import com.dealsync.domain.matching.CanonicalRecord;
import com.dealsync.domain.matching.DiscrepancyAnalyzer;
import com.dealsync.domain.matching.MatchResult;
import com.dealsync.domain.matching.ReconciliationReport;
import com.dealsync.domain.matching.RecordMatcher;
import com.dealsync.domain.matching.ValueTolerance;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Service;

/** Matches won deals against accounting projects and reports what is out of sync. */
@Service
@EnableConfigurationProperties(ReconciliationProperties.class)
public class ProjectReconciliationService {
  private final CanonicalRecordNormalizer normalizer;
  private final RecordMatcher matcher;
  private final DiscrepancyAnalyzer analyzer;
  private final ReconciliationReporter reporter;

  public ProjectReconciliationService(
      CanonicalRecordNormalizer normalizer,
      ReconciliationProperties properties,
      ReconciliationReporter reporter) {
    this.normalizer = normalizer;
    this.matcher = new RecordMatcher(ValueTolerance.ofPercent(properties.getTolerancePercentage()));
    this.analyzer = new DiscrepancyAnalyzer(properties.isValueComparisonEnabled());
    this.reporter = reporter;
  }

  public ReconciliationReport reconcile(JsonNode dealsPayload, JsonNode projectsPayload) {
    List<CanonicalRecord> deals = normalizer.normalizeDeals(dealsPayload);
    List<CanonicalRecord> projects = normalizer.normalizeProjects(projectsPayload);
    MatchResult result = matcher.match(deals, projects);
    ReconciliationReport report = analyzer.analyze(deals, projects, result);
    reporter.report(report);
    return report;
  }
}
