package com.dealsync.worker.reconciliation;

import com.dealsync.domain.matching.ReconciliationReport;

public interface ReconciliationReporter {
  void report(ReconciliationReport report);
}
