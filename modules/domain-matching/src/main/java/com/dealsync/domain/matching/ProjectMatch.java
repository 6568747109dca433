package com.dealsync.domain.matching;

import java.math.BigDecimal;
import java.util.Objects;

public record ProjectMatch(
    CanonicalRecord sideA,
    CanonicalRecord sideB,
    String matchKey,
    boolean valueMatch,
    BigDecimal valueDifference,
    BigDecimal valueDifferencePercentage) {
  public ProjectMatch {
    Objects.requireNonNull(sideA, "sideA must not be null");
    Objects.requireNonNull(sideB, "sideB must not be null");
    if (matchKey == null || matchKey.isEmpty()) {
      throw new IllegalArgumentException("matchKey must not be empty");
    }
    Objects.requireNonNull(valueDifference, "valueDifference must not be null");
    Objects.requireNonNull(valueDifferencePercentage, "valueDifferencePercentage must not be null");
  }
}
