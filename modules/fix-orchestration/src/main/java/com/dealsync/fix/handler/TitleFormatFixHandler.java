package com.dealsync.fix.handler;

import com.dealsync.fix.issue.IssueCode;
import com.dealsync.fix.issue.TitleFormatPayload;
import com.dealsync.fix.issue.ValidationIssue;
import com.dealsync.integration.pipedrive.PipedriveDeal;
import com.dealsync.integration.pipedrive.PipedriveDealClient;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Rewrites deal titles to the expected {@code ProjectCode-VesselName} form. */
public class TitleFormatFixHandler implements FixHandler {
  private static final Logger log = LoggerFactory.getLogger(TitleFormatFixHandler.class);
  private static final String HANDLER_ID = "title_format_fix";
  private static final String DUPLICATE_MARKER = "(copy)";

  private final PipedriveDealClient dealClient;

  public TitleFormatFixHandler(PipedriveDealClient dealClient) {
    this.dealClient = Objects.requireNonNull(dealClient, "dealClient must not be null");
  }

  @Override
  public String handlerId() {
    return HANDLER_ID;
  }

  @Override
  public Set<IssueCode> supportedCodes() {
    return Set.of(IssueCode.INVALID_TITLE_FORMAT);
  }

  @Override
  public boolean validate(ValidationIssue issue, FixHandlerContext context) {
    if (!(issue.payload() instanceof TitleFormatPayload payload)) {
      log.warn("Title fix issue carries unexpected payload recordId={}", issue.recordId());
      return false;
    }
    String expectedTitle = payload.expectedTitle();
    if (expectedTitle == null || expectedTitle.isBlank()) {
      log.warn("No expected title provided dealId={}", payload.dealId());
      return false;
    }
    if (isPlaceholder(expectedTitle)) {
      log.warn(
          "Expected title is a placeholder dealId={} expectedTitle={}",
          payload.dealId(),
          expectedTitle);
      return false;
    }
    String recordedTitle = payload.dealTitle();
    if (recordedTitle != null && recordedTitle.equalsIgnoreCase(expectedTitle)) {
      log.info("Title already matches expected format dealId={}", payload.dealId());
      return false;
    }
    if (isDuplicate(recordedTitle)) {
      log.info("Skipping duplicate deal dealId={} title={}", payload.dealId(), recordedTitle);
      return false;
    }

    try {
      Optional<PipedriveDeal> current = dealClient.getDeal(context.credentials(), payload.dealId());
      if (current.isEmpty()) {
        log.error("Deal not found or not accessible dealId={}", payload.dealId());
        return false;
      }
      String liveTitle = current.get().title();
      if (!Objects.equals(liveTitle, recordedTitle)) {
        log.warn(
            "Deal title changed since validation dealId={} recordedTitle={} liveTitle={}",
            payload.dealId(),
            recordedTitle,
            liveTitle);
        return false;
      }
      if (isDuplicate(liveTitle)) {
        log.info("Skipping duplicate deal dealId={} title={}", payload.dealId(), liveTitle);
        return false;
      }
      return true;
    } catch (RuntimeException ex) {
      log.error("Error validating title fix dealId={} error={}", payload.dealId(), ex.getMessage());
      return false;
    }
  }

  @Override
  public FixHandlerResult applyFix(ValidationIssue issue, FixHandlerContext context) {
    if (!(issue.payload() instanceof TitleFormatPayload payload)) {
      return FixHandlerResult.failed("Unexpected payload for " + issue.code());
    }
    String expectedTitle = payload.expectedTitle();
    if (expectedTitle == null || expectedTitle.isBlank()) {
      return FixHandlerResult.failed("No expected title provided");
    }

    try {
      Optional<PipedriveDeal> current = dealClient.getDeal(context.credentials(), payload.dealId());
      if (current.isEmpty()) {
        return FixHandlerResult.failed("Deal not found");
      }
      String originalTitle = current.get().title();
      if (originalTitle == null) {
        return FixHandlerResult.failed("Deal has no title to preserve");
      }

      log.info(
          "Applying title fix dealId={} oldTitle={} newTitle={}",
          payload.dealId(),
          originalTitle,
          expectedTitle);
      if (!dealClient.updateDealTitle(context.credentials(), payload.dealId(), expectedTitle)) {
        return FixHandlerResult.failed("Failed to update deal title");
      }
      return FixHandlerResult.fixed(
          originalTitle, expectedTitle, new TitleRollbackData(payload.dealId(), originalTitle));
    } catch (RuntimeException ex) {
      log.error("Error applying title fix dealId={} error={}", payload.dealId(), ex.getMessage());
      return FixHandlerResult.failed(
          ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage());
    }
  }

  @Override
  public boolean rollback(
      ValidationIssue issue, RollbackData rollbackData, FixHandlerContext context) {
    if (!(rollbackData instanceof TitleRollbackData data)
        || data.dealId() <= 0
        || data.originalTitle() == null) {
      log.error("Invalid rollback data recordId={} rollbackData={}", issue.recordId(), rollbackData);
      return false;
    }
    try {
      log.info(
          "Rolling back title change dealId={} restoringTitle={}",
          data.dealId(),
          data.originalTitle());
      return dealClient.updateDealTitle(context.credentials(), data.dealId(), data.originalTitle());
    } catch (RuntimeException ex) {
      log.error("Error rolling back title fix dealId={} error={}", data.dealId(), ex.getMessage());
      return false;
    }
  }

  @Override
  public String description() {
    return "Fixes deal titles to match the expected format (ProjectCode-VesselName)";
  }

  private static boolean isPlaceholder(String expectedTitle) {
    return expectedTitle.contains("(missing") || expectedTitle.contains("(set ");
  }

  private static boolean isDuplicate(String title) {
    return title != null && title.toLowerCase(Locale.ROOT).contains(DUPLICATE_MARKER);
  }
}
