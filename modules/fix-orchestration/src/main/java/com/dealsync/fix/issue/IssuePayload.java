package com.dealsync.fix.issue;

/** Code-specific context attached to a {@link ValidationIssue}. */
public sealed interface IssuePayload
    permits TitleFormatPayload, PipelinePlacementPayload, GenericPayload {
  String recordId();
}
