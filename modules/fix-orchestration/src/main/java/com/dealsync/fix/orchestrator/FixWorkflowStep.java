package com.dealsync.fix.orchestrator;

import com.dealsync.fix.session.FixStep;

enum FixWorkflowStep {
  ANALYZE_ISSUES("analyze_issues", "Analyze Issues", "Identifying fixable issues"),
  VALIDATE_FIXES("validate_fixes", "Validate Fixes", "Checking that fixes are still safe to apply"),
  APPLY_FIXES("apply_fixes", "Apply Fixes", "Applying fixes in batches"),
  GENERATE_SUMMARY("generate_summary", "Generate Summary", "Summarizing fix results");

  private final String id;
  private final String displayName;
  private final String description;

  FixWorkflowStep(String id, String displayName, String description) {
    this.id = id;
    this.displayName = displayName;
    this.description = description;
  }

  String id() {
    return id;
  }

  FixStep pending() {
    return FixStep.pending(id, displayName, description);
  }
}
