package com.dealsync.fix.issue;

import java.util.Locale;

public enum IssueSeverity {
  ERROR,
  WARNING,
  INFO;

  public static IssueSeverity fromWire(String severity) {
    if (severity == null || severity.isBlank()) {
      return INFO;
    }
    return switch (severity.trim().toLowerCase(Locale.ROOT)) {
      case "error" -> ERROR;
      case "warning" -> WARNING;
      default -> INFO;
    };
  }
}
