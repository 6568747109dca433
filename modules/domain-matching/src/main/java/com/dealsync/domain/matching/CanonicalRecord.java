package com.dealsync.domain.matching;

import java.math.BigDecimal;
import java.util.Objects;

public record CanonicalRecord(String id, String name, BigDecimal value, String currency) {
  public CanonicalRecord {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("id must not be blank");
    }
    name = Objects.requireNonNullElse(name, "");
    value = Objects.requireNonNullElse(value, BigDecimal.ZERO);
    currency = currency == null || currency.isBlank() ? "USD" : currency;
  }
}
