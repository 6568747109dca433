package com.dealsync.worker.reconciliation;

import com.dealsync.domain.matching.ReconciliationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingReconciliationReporter implements ReconciliationReporter {
  private static final Logger log = LoggerFactory.getLogger(LoggingReconciliationReporter.class);

  @Override
  public void report(ReconciliationReport report) {
    log.info(
        "Project reconciliation deals={} projects={} matched={} unmatched_deals={} "
            + "unmatched_projects={} value_discrepancies={}",
        report.sideACount(),
        report.sideBCount(),
        report.matchedCount(),
        report.unmatchedACount(),
        report.unmatchedBCount(),
        report.valueDiscrepancies().size());
    for (String recommendation : report.recommendations()) {
      log.info("Reconciliation recommendation={}", recommendation);
    }
  }
}
