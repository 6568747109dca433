package com.dealsync.worker.reconciliation;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "reconciliation")
public class ReconciliationProperties {
  private double tolerancePercentage = 5.0d;
  private boolean valueComparisonEnabled = true;

  public double getTolerancePercentage() {
    return tolerancePercentage;
  }

  public void setTolerancePercentage(double tolerancePercentage) {
    this.tolerancePercentage = tolerancePercentage;
  }

  public boolean isValueComparisonEnabled() {
    return valueComparisonEnabled;
  }

  public void setValueComparisonEnabled(boolean valueComparisonEnabled) {
    this.valueComparisonEnabled = valueComparisonEnabled;
  }
}
