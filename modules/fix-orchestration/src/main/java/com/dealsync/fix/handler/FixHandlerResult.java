package com.dealsync.fix.handler;

public record FixHandlerResult(
    boolean success,
    String originalValue,
    String newValue,
    String error,
    RollbackData rollbackData) {
  public FixHandlerResult {
    if (success && rollbackData == null) {
      throw new IllegalArgumentException("successful fix must carry rollbackData");
    }
    if (!success) {
      rollbackData = null;
    }
  }

  public static FixHandlerResult fixed(
      String originalValue, String newValue, RollbackData rollbackData) {
    return new FixHandlerResult(true, originalValue, newValue, null, rollbackData);
  }

  public static FixHandlerResult failed(String error) {
    return new FixHandlerResult(false, null, null, error, null);
  }
}
