package com.dealsync.worker.job;

import com.dealsync.domain.matching.ReconciliationReport;
import com.dealsync.fix.session.FixSession;
import com.dealsync.integration.pipedrive.PipedriveCredentials;
import com.dealsync.worker.fix.FixSessionService;
import com.dealsync.worker.reconciliation.ProjectReconciliationService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * One-shot job: reconciles exported deals against exported projects, then runs the fix workflow
 * over a rule engine issue export. Each half runs only when its input files are configured.
 */
@Component
@EnableConfigurationProperties(ReconcilerJobProperties.class)
@ConditionalOnProperty(
    prefix = "reconciler.job",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = false)
public class ReconcilerJobRunner implements ApplicationRunner {
  private static final Logger log = LoggerFactory.getLogger(ReconcilerJobRunner.class);

  private final ReconcilerJobProperties properties;
  private final ProjectReconciliationService reconciliationService;
  private final FixSessionService fixSessionService;
  private final ObjectMapper objectMapper;

  public ReconcilerJobRunner(
      ReconcilerJobProperties properties,
      ProjectReconciliationService reconciliationService,
      FixSessionService fixSessionService,
      ObjectMapper objectMapper) {
    this.properties = properties;
    this.reconciliationService = reconciliationService;
    this.fixSessionService = fixSessionService;
    this.objectMapper = objectMapper;
  }

  @Override
  public void run(ApplicationArguments args) {
    if (hasText(properties.getDealsFile()) && hasText(properties.getProjectsFile())) {
      ReconciliationReport report =
          reconciliationService.reconcile(
              readJson(properties.getDealsFile(), "reconciler.job.deals-file"),
              readJson(properties.getProjectsFile(), "reconciler.job.projects-file"));
      log.info(
          "Reconciliation job finished matched={} unmatched_deals={} unmatched_projects={}",
          report.matchedCount(),
          report.unmatchedACount(),
          report.unmatchedBCount());
    }
    if (hasText(properties.getIssuesFile())) {
      PipedriveCredentials credentials =
          new PipedriveCredentials(
              resolveOptionalSecret(
                  properties.getApiKey(), properties.getApiKeyFile(), "reconciler.job.api-key-file"),
              properties.getCompanyDomain());
      FixSession started =
          fixSessionService.start(
              properties.getTenantId(),
              properties.getTenantName(),
              readText(properties.getIssuesFile(), "reconciler.job.issues-file"),
              step ->
                  log.info(
                      "Fix step id={} status={} progress={}",
                      step.id(),
                      step.status(),
                      step.progress()));
      try {
        FixSession session = fixSessionService.execute(started.id(), credentials);
        log.info(
            "Fix job finished sessionId={} status={} recommendations={}",
            session.id(),
            session.status(),
            session.summary() == null ? null : session.summary().recommendations());
      } finally {
        fixSessionService.release(started.id());
      }
    }
  }

  private JsonNode readJson(String filePath, String propertyName) {
    try {
      return objectMapper.readTree(readText(filePath, propertyName));
    } catch (IOException ex) {
      throw new IllegalArgumentException(propertyName + " is not valid JSON: " + filePath, ex);
    }
  }

  private static String readText(String filePath, String propertyName) {
    try {
      return Files.readString(Path.of(filePath), StandardCharsets.UTF_8);
    } catch (IOException ex) {
      throw new IllegalArgumentException(propertyName + " cannot be read: " + filePath, ex);
    }
  }

  private static String resolveOptionalSecret(String value, String filePath, String propertyName) {
    if (!hasText(filePath)) {
      return value;
    }
    String fromFile = readText(filePath, propertyName).trim();
    return fromFile.isBlank() ? value : fromFile;
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
