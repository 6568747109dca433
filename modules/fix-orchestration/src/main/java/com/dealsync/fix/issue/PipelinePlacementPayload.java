package com.dealsync.fix.issue;

public record PipelinePlacementPayload(
    long dealId, String dealTitle, Long pipelineId, Long stageId, String status)
    implements IssuePayload {
  @Override
  public String recordId() {
    return String.valueOf(dealId);
  }
}
