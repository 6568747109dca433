package com.dealsync.fix.issue;

import java.util.Locale;

/**
 * Closed set of issue codes the engine knows how to route. Codes produced by the rule engine that
 * are not listed here map to {@link #UNRECOGNIZED}.
 */
public enum IssueCode {
  INVALID_TITLE_FORMAT,
  WON_DEAL_IN_UNQUALIFIED_PIPELINE,
  OPEN_DEAL_IN_WRONG_PIPELINE,
  MISSING_VESSEL,
  VALUE_MISMATCH,
  QUOTE_VALUE_MISMATCH,
  QUOTE_CURRENCY_MISMATCH,
  UNRECOGNIZED;

  public static IssueCode fromWire(String code) {
    if (code == null || code.isBlank()) {
      return UNRECOGNIZED;
    }
    try {
      return valueOf(code.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      return UNRECOGNIZED;
    }
  }
}
