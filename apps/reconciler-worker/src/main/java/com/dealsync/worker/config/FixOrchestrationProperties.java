package com.dealsync.worker.config;

import com.dealsync.fix.issue.IssueCode;
import com.dealsync.fix.orchestrator.FixOrchestrationConfig;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "fix.orchestration")
public class FixOrchestrationProperties {
  private int batchSize = 10;
  private int retryAttempts = 3;
  private long retryDelayMs = 1000L;
  private long interBatchDelayMs = 1000L;
  private int circuitBreakerThreshold = 5;
  private long circuitBreakerResetMs = 60000L;
  private boolean dryRun;
  private Set<IssueCode> manualResolutionCodes =
      new LinkedHashSet<>(
          EnumSet.of(
              IssueCode.WON_DEAL_IN_UNQUALIFIED_PIPELINE, IssueCode.OPEN_DEAL_IN_WRONG_PIPELINE));

  public FixOrchestrationConfig toConfig() {
    return new FixOrchestrationConfig(
        batchSize,
        retryAttempts,
        retryDelayMs,
        interBatchDelayMs,
        circuitBreakerThreshold,
        circuitBreakerResetMs,
        dryRun,
        manualResolutionCodes);
  }

  public int getBatchSize() {
    return batchSize;
  }

  public void setBatchSize(int batchSize) {
    this.batchSize = batchSize;
  }

  public int getRetryAttempts() {
    return retryAttempts;
  }

  public void setRetryAttempts(int retryAttempts) {
    this.retryAttempts = retryAttempts;
  }

  public long getRetryDelayMs() {
    return retryDelayMs;
  }

  public void setRetryDelayMs(long retryDelayMs) {
    this.retryDelayMs = retryDelayMs;
  }

  public long getInterBatchDelayMs() {
    return interBatchDelayMs;
  }

  public void setInterBatchDelayMs(long interBatchDelayMs) {
    this.interBatchDelayMs = interBatchDelayMs;
  }

  public int getCircuitBreakerThreshold() {
    return circuitBreakerThreshold;
  }

  public void setCircuitBreakerThreshold(int circuitBreakerThreshold) {
    this.circuitBreakerThreshold = circuitBreakerThreshold;
  }

  public long getCircuitBreakerResetMs() {
    return circuitBreakerResetMs;
  }

  public void setCircuitBreakerResetMs(long circuitBreakerResetMs) {
    this.circuitBreakerResetMs = circuitBreakerResetMs;
  }

  public boolean isDryRun() {
    return dryRun;
  }

  public void setDryRun(boolean dryRun) {
    this.dryRun = dryRun;
  }

  public Set<IssueCode> getManualResolutionCodes() {
    return manualResolutionCodes;
  }

  public void setManualResolutionCodes(Set<IssueCode> manualResolutionCodes) {
    this.manualResolutionCodes = manualResolutionCodes;
  }
}
