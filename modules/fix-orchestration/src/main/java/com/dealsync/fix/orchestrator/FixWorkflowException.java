package com.dealsync.fix.orchestrator;

public class FixWorkflowException extends RuntimeException {
  public FixWorkflowException(String message, Throwable cause) {
    super(message, cause);
  }
}
