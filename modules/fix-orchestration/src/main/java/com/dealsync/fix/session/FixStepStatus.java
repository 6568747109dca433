package com.dealsync.fix.session;

public enum FixStepStatus {
  PENDING,
  RUNNING,
  COMPLETED,
  ERROR,
  SKIPPED
}
