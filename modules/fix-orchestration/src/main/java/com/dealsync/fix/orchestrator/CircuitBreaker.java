package com.dealsync.fix.orchestrator;

import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Consecutive-failure breaker. Opens for a fixed window once the threshold is reached and closes
 * on the first check made at or after the end of that window.
 */
public class CircuitBreaker {
  private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);
  private static final String OPENED_COUNTER = "fix.orchestrator.circuit_breaker.opened";

  private final int threshold;
  private final Duration resetAfter;
  private final Clock clock;
  private final MeterRegistry meterRegistry;

  private int consecutiveFailures;
  private Instant openUntil;
  private int timesOpened;

  public CircuitBreaker(
      int threshold, Duration resetAfter, Clock clock, MeterRegistry meterRegistry) {
    if (threshold <= 0) {
      throw new IllegalArgumentException("threshold must be positive");
    }
    this.threshold = threshold;
    this.resetAfter = Objects.requireNonNull(resetAfter, "resetAfter must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry must not be null");
  }

  public synchronized boolean isOpen() {
    if (openUntil == null) {
      return false;
    }
    if (clock.instant().isBefore(openUntil)) {
      return true;
    }
    log.info("Circuit breaker closed after reset window openUntil={}", openUntil);
    openUntil = null;
    consecutiveFailures = 0;
    return false;
  }

  public synchronized void recordSuccess() {
    consecutiveFailures = 0;
  }

  public synchronized void recordFailure() {
    consecutiveFailures++;
    if (consecutiveFailures >= threshold && openUntil == null) {
      openUntil = clock.instant().plus(resetAfter);
      timesOpened++;
      meterRegistry.counter(OPENED_COUNTER).increment();
      log.warn(
          "Circuit breaker opened failures={} threshold={} openUntil={}",
          consecutiveFailures,
          threshold,
          openUntil);
    }
  }

  public synchronized int consecutiveFailures() {
    return consecutiveFailures;
  }

  public synchronized int timesOpened() {
    return timesOpened;
  }
}
