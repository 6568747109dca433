package com.dealsync.fix.handler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.dealsync.fix.issue.GenericPayload;
import com.dealsync.fix.issue.IssueCode;
import com.dealsync.fix.issue.IssueSeverity;
import com.dealsync.fix.issue.TitleFormatPayload;
import com.dealsync.fix.issue.ValidationIssue;
import com.dealsync.fix.orchestrator.FixOrchestrationConfig;
import com.dealsync.integration.pipedrive.PipedriveCredentials;
import com.dealsync.integration.pipedrive.PipedriveDeal;
import com.dealsync.integration.pipedrive.PipedriveDealClient;
import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TitleFormatFixHandlerTest {
  private static final PipedriveCredentials CREDENTIALS =
      new PipedriveCredentials("api-key", "acme");
  private static final FixHandlerContext CONTEXT =
      new FixHandlerContext(CREDENTIALS, "tenant-1", FixOrchestrationConfig.defaults());

  @Mock private PipedriveDealClient dealClient;

  private TitleFormatFixHandler handler;

  @BeforeEach
  void setUp() {
    handler = new TitleFormatFixHandler(dealClient);
  }

  @Test
  void shouldValidateWhenLiveTitleStillMatchesRecordedTitle() {
    when(dealClient.getDeal(CREDENTIALS, 42L)).thenReturn(Optional.of(deal(42L, "ny25202 endurance")));

    assertTrue(handler.validate(issue(42L, "ny25202 endurance", "NY25202-Endurance"), CONTEXT));
  }

  @Test
  void shouldRejectWhenTitleAlreadyMatchesIgnoringCase() {
    assertFalse(handler.validate(issue(42L, "ny25202-endurance", "NY25202-Endurance"), CONTEXT));
    verifyNoInteractions(dealClient);
  }

  @Test
  void shouldRejectPlaceholderExpectedTitles() {
    assertFalse(handler.validate(issue(42L, "Endurance", "(missing project code)-Endurance"), CONTEXT));
    assertFalse(handler.validate(issue(42L, "Endurance", "NY25202-(set vessel)"), CONTEXT));
    assertFalse(handler.validate(issue(42L, "Endurance", null), CONTEXT));
    verifyNoInteractions(dealClient);
  }

  @Test
  void shouldRejectDuplicateDeals() {
    assertFalse(handler.validate(issue(42L, "Endurance (Copy)", "NY25202-Endurance"), CONTEXT));
    verifyNoInteractions(dealClient);
  }

  @Test
  void shouldRejectWhenDealIsMissing() {
    when(dealClient.getDeal(CREDENTIALS, 42L)).thenReturn(Optional.empty());

    assertFalse(handler.validate(issue(42L, "Endurance", "NY25202-Endurance"), CONTEXT));
  }

  @Test
  void shouldRejectWhenLiveTitleDriftedSinceValidation() {
    when(dealClient.getDeal(CREDENTIALS, 42L)).thenReturn(Optional.of(deal(42L, "Renamed by user")));

    assertFalse(handler.validate(issue(42L, "Endurance", "NY25202-Endurance"), CONTEXT));
  }

  @Test
  void shouldTreatClientExceptionAsNotValid() {
    when(dealClient.getDeal(CREDENTIALS, 42L)).thenThrow(new IllegalStateException("boom"));

    assertFalse(handler.validate(issue(42L, "Endurance", "NY25202-Endurance"), CONTEXT));
  }

  @Test
  void shouldRejectUnexpectedPayload() {
    ValidationIssue issue =
        new ValidationIssue(
            IssueCode.INVALID_TITLE_FORMAT,
            IssueSeverity.ERROR,
            "bad title",
            new GenericPayload("42", Map.of()),
            null,
            "deal");

    assertFalse(handler.validate(issue, CONTEXT));
    assertFalse(handler.applyFix(issue, CONTEXT).success());
  }

  @Test
  void shouldApplyFixAndCaptureLiveTitleForRollback() {
    when(dealClient.getDeal(CREDENTIALS, 42L)).thenReturn(Optional.of(deal(42L, "Endurance live")));
    when(dealClient.updateDealTitle(CREDENTIALS, 42L, "NY25202-Endurance")).thenReturn(true);

    FixHandlerResult result =
        handler.applyFix(issue(42L, "Endurance", "NY25202-Endurance"), CONTEXT);

    assertTrue(result.success());
    assertEquals("Endurance live", result.originalValue());
    assertEquals("NY25202-Endurance", result.newValue());
    TitleRollbackData rollbackData = assertInstanceOf(TitleRollbackData.class, result.rollbackData());
    assertEquals(42L, rollbackData.dealId());
    assertEquals("Endurance live", rollbackData.originalTitle());
  }

  @Test
  void shouldReportFailureWhenUpdateIsRejected() {
    when(dealClient.getDeal(CREDENTIALS, 42L)).thenReturn(Optional.of(deal(42L, "Endurance")));
    when(dealClient.updateDealTitle(CREDENTIALS, 42L, "NY25202-Endurance")).thenReturn(false);

    FixHandlerResult result =
        handler.applyFix(issue(42L, "Endurance", "NY25202-Endurance"), CONTEXT);

    assertFalse(result.success());
    assertEquals("Failed to update deal title", result.error());
    assertNull(result.rollbackData());
  }

  @Test
  void shouldNotUpdateWhenDealDisappearedBeforeApply() {
    when(dealClient.getDeal(CREDENTIALS, 42L)).thenReturn(Optional.empty());

    FixHandlerResult result =
        handler.applyFix(issue(42L, "Endurance", "NY25202-Endurance"), CONTEXT);

    assertFalse(result.success());
    verify(dealClient, never()).updateDealTitle(any(), anyLong(), anyString());
  }

  @Test
  void shouldRestoreExactOriginalTitleOnRollback() {
    when(dealClient.updateDealTitle(CREDENTIALS, 42L, "Endurance (2)")).thenReturn(true);

    boolean restored =
        handler.rollback(
            issue(42L, "Endurance (2)", "NY25202-Endurance"),
            new TitleRollbackData(42L, "Endurance (2)"),
            CONTEXT);

    assertTrue(restored);
    verify(dealClient).updateDealTitle(CREDENTIALS, 42L, "Endurance (2)");
  }

  @Test
  void shouldRejectMalformedRollbackData() {
    ValidationIssue issue = issue(42L, "Endurance", "NY25202-Endurance");

    assertFalse(handler.rollback(issue, null, CONTEXT));
    assertFalse(handler.rollback(issue, new TitleRollbackData(0L, "Endurance"), CONTEXT));
    assertFalse(handler.rollback(issue, new TitleRollbackData(42L, null), CONTEXT));
    verifyNoInteractions(dealClient);
  }

  private static ValidationIssue issue(long dealId, String dealTitle, String expectedTitle) {
    return new ValidationIssue(
        IssueCode.INVALID_TITLE_FORMAT,
        IssueSeverity.ERROR,
        "Deal title does not follow ProjectCode-VesselName",
        new TitleFormatPayload(
            dealId,
            dealTitle,
            expectedTitle,
            "NY25202",
            "Endurance",
            3L,
            "open",
            new BigDecimal("1200.00"),
            "USD",
            7L),
        "Rename deal",
        "deal");
  }

  private static PipedriveDeal deal(long id, String title) {
    return new PipedriveDeal(
        id, title, new BigDecimal("1200.00"), "USD", "open", 3L, 7L, "2026-03-01 10:00:00");
  }
}
