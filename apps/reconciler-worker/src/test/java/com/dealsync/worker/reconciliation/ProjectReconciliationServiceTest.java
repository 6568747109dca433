package com.dealsync.worker.reconciliation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import com.dealsync.domain.matching.ReconciliationReport;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ProjectReconciliationServiceTest {
  private final ObjectMapper objectMapper = new ObjectMapper();
  private ReconciliationReporter reporter;
  private ProjectReconciliationService service;

  @BeforeEach
  void setUp() {
    reporter = mock(ReconciliationReporter.class);
    service =
        new ProjectReconciliationService(
            new CanonicalRecordNormalizer(), new ReconciliationProperties(), reporter);
  }

  @Test
  void shouldMatchDealsToProjectsAndReportDiscrepancies() throws Exception {
    ReconciliationReport report =
        service.reconcile(
            objectMapper.readTree(
                "[{\"id\":1,\"title\":\"NY25202 - LST 207 RSS ENDURANCE (2)\",\"value\":1000},"
                    + "{\"id\":2,\"title\":\"ED25002 - Titanic\",\"value\":1000},"
                    + "{\"id\":3,\"title\":\"Job 4411 Harbour survey\",\"value\":50}]"),
            objectMapper.readTree(
                "[{\"projectId\":\"p-1\",\"name\":\"NY25202 - LST 207 RSS Endurance\","
                    + "\"totalAmount\":{\"value\":1040}},"
                    + "{\"projectId\":\"p-2\",\"name\":\"ED25002-Titanic\","
                    + "\"totalAmount\":{\"value\":1200}},"
                    + "{\"projectId\":\"p-3\",\"name\":\"Unrelated refit\","
                    + "\"totalAmount\":{\"value\":10}}]"));

    assertEquals(3, report.sideACount());
    assertEquals(2, report.matchedCount());
    assertEquals(1, report.valueDiscrepancies().size());
    assertEquals("ED25002-Titanic", report.valueDiscrepancies().get(0).recordName());
    assertEquals(1, report.unmatchedACount());
    assertEquals(1, report.unmatchedBCount());
    assertEquals(
        List.of(
            "1 won deal(s) need to be created as projects",
            "1 project(s) may need to be reviewed or linked to deals",
            "1 project(s) have value discrepancies that need reconciliation"),
        report.recommendations());
    verify(reporter).report(report);
  }
}
