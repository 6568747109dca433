package com.dealsync.fix.handler;

import com.dealsync.fix.issue.IssueCode;
import com.dealsync.fix.issue.ValidationIssue;
import java.util.Set;

/**
 * Validates, applies and reverses one category of automated fix.
 *
 * <p>Handlers are stateless: everything they need arrives through {@link FixHandlerContext}.
 */
public interface FixHandler {
  String handlerId();

  Set<IssueCode> supportedCodes();

  default boolean canHandle(ValidationIssue issue) {
    return issue != null && supportedCodes().contains(issue.code());
  }

  /**
   * Checks the live state of the target record. Must not modify the record store. Returns
   * {@code false} when the fix is unsafe or no longer needed.
   */
  boolean validate(ValidationIssue issue, FixHandlerContext context);

  /**
   * Applies exactly one idempotent mutation. The current state is read again first so that the
   * returned rollback data reflects what was actually overwritten.
   */
  FixHandlerResult applyFix(ValidationIssue issue, FixHandlerContext context);

  /** Restores the original value. Returns {@code false} for malformed rollback data. */
  boolean rollback(ValidationIssue issue, RollbackData rollbackData, FixHandlerContext context);

  String description();
}
