package com.dealsync.integration.pipedrive;

import java.util.Map;

public record DealUpdate(long dealId, Map<String, Object> fields) {
  public DealUpdate {
    if (fields == null || fields.isEmpty()) {
      throw new IllegalArgumentException("fields must not be empty");
    }
    fields = Map.copyOf(fields);
  }
}
