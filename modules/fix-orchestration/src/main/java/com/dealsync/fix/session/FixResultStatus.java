package com.dealsync.fix.session;

public enum FixResultStatus {
  FIXED,
  SKIPPED,
  FAILED
}
