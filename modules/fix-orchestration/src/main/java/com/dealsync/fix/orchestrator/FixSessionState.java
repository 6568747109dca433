package com.dealsync.fix.orchestrator;

import com.dealsync.fix.session.FixSession;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Mutable holder for everything a workflow run changes. Session updates are serialized so that a
 * cancel request from another thread cannot be lost between a read and a write.
 */
final class FixSessionState {
  private final CircuitBreaker circuitBreaker;
  private FixSession session;
  private int batchesExecuted;

  FixSessionState(FixSession session, CircuitBreaker circuitBreaker) {
    this.session = Objects.requireNonNull(session, "session must not be null");
    this.circuitBreaker = Objects.requireNonNull(circuitBreaker, "circuitBreaker must not be null");
  }

  synchronized FixSession session() {
    return session;
  }

  synchronized FixSession update(UnaryOperator<FixSession> updater) {
    FixSession next = Objects.requireNonNull(updater.apply(session), "updated session");
    session = next;
    return next;
  }

  synchronized boolean isCancelled() {
    return session.isCancelled();
  }

  CircuitBreaker circuitBreaker() {
    return circuitBreaker;
  }

  synchronized void recordBatch() {
    batchesExecuted++;
  }

  synchronized int batchesExecuted() {
    return batchesExecuted;
  }
}
