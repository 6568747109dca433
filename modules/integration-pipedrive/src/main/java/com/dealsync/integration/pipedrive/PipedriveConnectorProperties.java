package com.dealsync.integration.pipedrive;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "connector.pipedrive")
public class PipedriveConnectorProperties {
  private String baseUrlTemplate = "https://%s.pipedrive.com";
  private long connectTimeoutMs = 3000L;
  private long readTimeoutMs = 10000L;
  private long batchUpdateDelayMs = 200L;
  private Pacing pacing = new Pacing();

  public String getBaseUrlTemplate() {
    return baseUrlTemplate;
  }

  public void setBaseUrlTemplate(String baseUrlTemplate) {
    this.baseUrlTemplate = baseUrlTemplate;
  }

  public long getConnectTimeoutMs() {
    return connectTimeoutMs;
  }

  public void setConnectTimeoutMs(long connectTimeoutMs) {
    this.connectTimeoutMs = connectTimeoutMs;
  }

  public long getReadTimeoutMs() {
    return readTimeoutMs;
  }

  public void setReadTimeoutMs(long readTimeoutMs) {
    this.readTimeoutMs = readTimeoutMs;
  }

  public long getBatchUpdateDelayMs() {
    return batchUpdateDelayMs;
  }

  public void setBatchUpdateDelayMs(long batchUpdateDelayMs) {
    this.batchUpdateDelayMs = batchUpdateDelayMs;
  }

  public Pacing getPacing() {
    return pacing;
  }

  public void setPacing(Pacing pacing) {
    this.pacing = pacing;
  }

  public static class Pacing {
    private long minIntervalMs = 100L;
    private int firstThreshold = 30;
    private long firstExtraDelayMs = 200L;
    private int secondThreshold = 50;
    private long secondExtraDelayMs = 500L;

    public long getMinIntervalMs() {
      return minIntervalMs;
    }

    public void setMinIntervalMs(long minIntervalMs) {
      this.minIntervalMs = minIntervalMs;
    }

    public int getFirstThreshold() {
      return firstThreshold;
    }

    public void setFirstThreshold(int firstThreshold) {
      this.firstThreshold = firstThreshold;
    }

    public long getFirstExtraDelayMs() {
      return firstExtraDelayMs;
    }

    public void setFirstExtraDelayMs(long firstExtraDelayMs) {
      this.firstExtraDelayMs = firstExtraDelayMs;
    }

    public int getSecondThreshold() {
      return secondThreshold;
    }

    public void setSecondThreshold(int secondThreshold) {
      this.secondThreshold = secondThreshold;
    }

    public long getSecondExtraDelayMs() {
      return secondExtraDelayMs;
    }

    public void setSecondExtraDelayMs(long secondExtraDelayMs) {
      this.secondExtraDelayMs = secondExtraDelayMs;
    }
  }
}
