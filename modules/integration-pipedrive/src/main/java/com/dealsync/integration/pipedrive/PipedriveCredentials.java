package com.dealsync.integration.pipedrive;

public record PipedriveCredentials(String apiKey, String companyDomain) {
  public PipedriveCredentials {
    if (apiKey == null || apiKey.isBlank()) {
      throw new IllegalArgumentException("apiKey is required");
    }
    if (companyDomain == null || companyDomain.isBlank()) {
      throw new IllegalArgumentException("companyDomain is required");
    }
  }

  @Override
  public String toString() {
    return "PipedriveCredentials[companyDomain=" + companyDomain + "]";
  }
}
