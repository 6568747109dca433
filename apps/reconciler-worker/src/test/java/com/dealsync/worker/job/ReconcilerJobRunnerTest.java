package com.dealsync.worker.job;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.dealsync.domain.matching.ReconciliationReport;
import com.dealsync.fix.orchestrator.FixWorkflowException;
import com.dealsync.fix.session.FixSession;
import com.dealsync.integration.pipedrive.PipedriveCredentials;
import com.dealsync.worker.fix.FixSessionService;
import com.dealsync.worker.reconciliation.ProjectReconciliationService;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.DefaultApplicationArguments;

class ReconcilerJobRunnerTest {
  @TempDir Path tempDir;

  private ReconcilerJobProperties properties;
  private ProjectReconciliationService reconciliationService;
  private FixSessionService fixSessionService;
  private ReconcilerJobRunner runner;

  @BeforeEach
  void setUp() {
    properties = new ReconcilerJobProperties();
    reconciliationService = mock(ProjectReconciliationService.class);
    fixSessionService = mock(FixSessionService.class);
    runner =
        new ReconcilerJobRunner(
            properties, reconciliationService, fixSessionService, new ObjectMapper());
  }

  @Test
  void shouldReconcileConfiguredExports() throws Exception {
    properties.setDealsFile(write("deals.json", "[]").toString());
    properties.setProjectsFile(write("projects.json", "[]").toString());
    when(reconciliationService.reconcile(any(), any()))
        .thenReturn(
            new ReconciliationReport(
                0, 0, 0, List.of(), List.of(), List.of(), List.of(), List.of()));

    runner.run(new DefaultApplicationArguments());

    verify(reconciliationService).reconcile(any(), any());
    verify(fixSessionService, never()).start(any(), any(), any(), any());
    verify(fixSessionService, never()).execute(any(), any());
  }

  @Test
  void shouldRunFixesWithApiKeyReadFromFile() throws Exception {
    properties.setIssuesFile(write("issues.json", "[]").toString());
    properties.setApiKeyFile(write("api-key", "secret-key\n").toString());
    properties.setCompanyDomain("acme");
    properties.setTenantId("tenant-1");
    properties.setTenantName("Acme Marine");
    FixSession session =
        FixSession.create(
            "tenant-1", "Acme Marine", List.of(), Instant.parse("2026-03-02T09:00:00Z"));
    when(fixSessionService.start(eq("tenant-1"), eq("Acme Marine"), eq("[]"), any()))
        .thenReturn(session);
    when(fixSessionService.execute(eq(session.id()), any(PipedriveCredentials.class)))
        .thenReturn(session);

    runner.run(new DefaultApplicationArguments());

    verify(fixSessionService)
        .execute(session.id(), new PipedriveCredentials("secret-key", "acme"));
    verify(fixSessionService).release(session.id());
    verify(reconciliationService, never()).reconcile(any(), any());
  }

  @Test
  void shouldReleaseSessionWhenFixWorkflowFails() throws Exception {
    properties.setIssuesFile(write("issues.json", "[]").toString());
    properties.setApiKey("api-key");
    properties.setCompanyDomain("acme");
    FixSession session =
        FixSession.create(
            "tenant-1", "Acme Marine", List.of(), Instant.parse("2026-03-02T09:00:00Z"));
    when(fixSessionService.start(any(), any(), eq("[]"), any())).thenReturn(session);
    when(fixSessionService.execute(eq(session.id()), any(PipedriveCredentials.class)))
        .thenThrow(
            new FixWorkflowException(
                "Fix workflow failed at step apply_fixes", new IllegalStateException("boom")));

    FixWorkflowException thrown =
        assertThrows(
            FixWorkflowException.class, () -> runner.run(new DefaultApplicationArguments()));

    assertEquals("Fix workflow failed at step apply_fixes", thrown.getMessage());
    verify(fixSessionService).release(session.id());
  }

  @Test
  void shouldFailWhenConfiguredFileIsMissing() {
    properties.setDealsFile(tempDir.resolve("missing.json").toString());
    properties.setProjectsFile(tempDir.resolve("missing.json").toString());

    assertThrows(
        IllegalArgumentException.class, () -> runner.run(new DefaultApplicationArguments()));
    verify(fixSessionService, never()).release(anyString());
  }

  private Path write(String name, String content) throws Exception {
    return Files.writeString(tempDir.resolve(name), content, StandardCharsets.UTF_8);
  }
}
