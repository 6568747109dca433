package com.dealsync.fix.issue;

import java.util.Map;

public record GenericPayload(String recordId, Map<String, String> attributes)
    implements IssuePayload {
  public GenericPayload {
    recordId = recordId == null ? "" : recordId;
    attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
  }
}
