package com.dealsync.fix.issue;

import java.math.BigDecimal;

public record TitleFormatPayload(
    long dealId,
    String dealTitle,
    String expectedTitle,
    String projectCode,
    String vesselName,
    Long pipelineId,
    String status,
    BigDecimal dealValue,
    String currency,
    Long stageId)
    implements IssuePayload {
  @Override
  public String recordId() {
    return String.valueOf(dealId);
  }
}
