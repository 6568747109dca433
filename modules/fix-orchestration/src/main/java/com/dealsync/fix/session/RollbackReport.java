package com.dealsync.fix.session;

public record RollbackReport(int attempted, int succeeded) {
  public static RollbackReport empty() {
    return new RollbackReport(0, 0);
  }

  public boolean isComplete() {
    return succeeded == attempted;
  }

  public int failed() {
    return attempted - succeeded;
  }
}
