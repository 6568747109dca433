package com.dealsync.worker.job;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "reconciler.job")
public class ReconcilerJobProperties {
  private boolean enabled;
  private String dealsFile;
  private String projectsFile;
  private String issuesFile;
  private String tenantId;
  private String tenantName;
  private String apiKey;
  private String apiKeyFile;
  private String companyDomain;

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public String getDealsFile() {
    return dealsFile;
  }

  public void setDealsFile(String dealsFile) {
    this.dealsFile = dealsFile;
  }

  public String getProjectsFile() {
    return projectsFile;
  }

  public void setProjectsFile(String projectsFile) {
    this.projectsFile = projectsFile;
  }

  public String getIssuesFile() {
    return issuesFile;
  }

  public void setIssuesFile(String issuesFile) {
    this.issuesFile = issuesFile;
  }

  public String getTenantId() {
    return tenantId;
  }

  public void setTenantId(String tenantId) {
    this.tenantId = tenantId;
  }

  public String getTenantName() {
    return tenantName;
  }

  public void setTenantName(String tenantName) {
    this.tenantName = tenantName;
  }

  public String getApiKey() {
    return apiKey;
  }

  public void setApiKey(String apiKey) {
    this.apiKey = apiKey;
  }

  public String getApiKeyFile() {
    return apiKeyFile;
  }

  public void setApiKeyFile(String apiKeyFile) {
    this.apiKeyFile = apiKeyFile;
  }

  public String getCompanyDomain() {
    return companyDomain;
  }

  public void setCompanyDomain(String companyDomain) {
    this.companyDomain = companyDomain;
  }
}
