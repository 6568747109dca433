package com.dealsync.fix.session;

public class FixSessionException extends RuntimeException {
  public FixSessionException(String message) {
    super(message);
  }
}
