package com.dealsync.fix.session;

import java.time.Instant;

/** Immutable snapshot of one workflow step, as published to progress listeners. */
public record FixStep(
    String id,
    String name,
    String description,
    FixStepStatus status,
    int progress,
    Instant startTime,
    Instant endTime,
    String result,
    String error) {
  public static FixStep pending(String id, String name, String description) {
    return new FixStep(id, name, description, FixStepStatus.PENDING, 0, null, null, null, null);
  }

  public FixStep running(Instant startTime) {
    return new FixStep(
        id, name, description, FixStepStatus.RUNNING, 0, startTime, null, null, null);
  }

  public FixStep withProgress(int nextProgress) {
    return new FixStep(
        id, name, description, status, nextProgress, startTime, endTime, result, error);
  }

  public FixStep completed(Instant endTime, String result) {
    return new FixStep(
        id, name, description, FixStepStatus.COMPLETED, 100, startTime, endTime, result, null);
  }

  public FixStep failed(Instant endTime, String error) {
    return new FixStep(
        id, name, description, FixStepStatus.ERROR, 0, startTime, endTime, null, error);
  }
}
