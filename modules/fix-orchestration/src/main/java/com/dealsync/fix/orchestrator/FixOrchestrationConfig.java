package com.dealsync.fix.orchestrator;

import com.dealsync.fix.issue.IssueCode;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

public record FixOrchestrationConfig(
    int batchSize,
    int retryAttempts,
    long retryDelayMs,
    long interBatchDelayMs,
    int circuitBreakerThreshold,
    long circuitBreakerResetMs,
    boolean dryRun,
    Set<IssueCode> manualResolutionCodes) {
  public FixOrchestrationConfig {
    if (batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be positive");
    }
    if (retryAttempts <= 0) {
      throw new IllegalArgumentException("retryAttempts must be positive");
    }
    if (retryDelayMs < 0 || interBatchDelayMs < 0 || circuitBreakerResetMs < 0) {
      throw new IllegalArgumentException("delays must not be negative");
    }
    if (circuitBreakerThreshold <= 0) {
      throw new IllegalArgumentException("circuitBreakerThreshold must be positive");
    }
    manualResolutionCodes =
        manualResolutionCodes == null || manualResolutionCodes.isEmpty()
            ? Set.of()
            : Set.copyOf(EnumSet.copyOf(manualResolutionCodes));
  }

  public static FixOrchestrationConfig defaults() {
    return new FixOrchestrationConfig(
        10,
        3,
        1000,
        1000,
        5,
        60_000,
        false,
        EnumSet.of(
            IssueCode.WON_DEAL_IN_UNQUALIFIED_PIPELINE, IssueCode.OPEN_DEAL_IN_WRONG_PIPELINE));
  }

  public FixOrchestrationConfig withDryRun(boolean nextDryRun) {
    return new FixOrchestrationConfig(
        batchSize,
        retryAttempts,
        retryDelayMs,
        interBatchDelayMs,
        circuitBreakerThreshold,
        circuitBreakerResetMs,
        nextDryRun,
        manualResolutionCodes);
  }

  public Duration retryDelayForAttempt(int attempt) {
    return Duration.ofMillis(retryDelayMs * attempt);
  }

  public Duration interBatchDelay() {
    return Duration.ofMillis(interBatchDelayMs);
  }

  public Duration circuitBreakerReset() {
    return Duration.ofMillis(circuitBreakerResetMs);
  }
}
