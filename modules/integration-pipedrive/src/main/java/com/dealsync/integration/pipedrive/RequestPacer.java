package com.dealsync.integration.pipedrive;

import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Spaces outbound calls by a minimum interval and adds a progressive extra delay once the request
 * counter passes two thresholds. This is a congestion-avoidance heuristic, not a token bucket.
 *
 * <p>State is local to the instance. Two pacers pointed at the same backend do not coordinate.
 */
public class RequestPacer {
  private static final String DELAY_COUNTER = "connector.pipedrive.pacer.delay";

  private final PipedriveConnectorProperties.Pacing pacing;
  private final Clock clock;
  private final Sleeper sleeper;
  private final MeterRegistry meterRegistry;

  private long requestCount;
  private long lastRequestAtMs;

  public RequestPacer(PipedriveConnectorProperties.Pacing pacing, MeterRegistry meterRegistry) {
    this(
        pacing, Clock.systemUTC(), duration -> Thread.sleep(duration.toMillis()), meterRegistry);
  }

  public RequestPacer(
      PipedriveConnectorProperties.Pacing pacing,
      Clock clock,
      Sleeper sleeper,
      MeterRegistry meterRegistry) {
    this.pacing = Objects.requireNonNull(pacing, "pacing must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry must not be null");
  }

  public synchronized void acquire() {
    long sinceLast = clock.millis() - lastRequestAtMs;
    if (sinceLast < pacing.getMinIntervalMs()) {
      pause(Duration.ofMillis(pacing.getMinIntervalMs() - sinceLast));
    }

    lastRequestAtMs = clock.millis();
    requestCount++;

    if (requestCount > pacing.getSecondThreshold()) {
      pause(Duration.ofMillis(pacing.getSecondExtraDelayMs()));
    } else if (requestCount > pacing.getFirstThreshold()) {
      pause(Duration.ofMillis(pacing.getFirstExtraDelayMs()));
    }
  }

  public synchronized void reset() {
    requestCount = 0;
    lastRequestAtMs = 0;
  }

  public synchronized PacerStatus status() {
    return new PacerStatus(requestCount, lastRequestAtMs);
  }

  void pause(Duration duration) {
    if (duration.isZero() || duration.isNegative()) {
      return;
    }
    meterRegistry.counter(DELAY_COUNTER).increment();
    try {
      sleeper.sleep(duration);
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while pacing Pipedrive requests", interrupted);
    }
  }

  @FunctionalInterface
  public interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;
  }
}
