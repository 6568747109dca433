package com.dealsync.domain.matching;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

class ValueToleranceTest {
  private final ValueTolerance tolerance = ValueTolerance.ofPercent(5);

  @Test
  void shouldMatchWithinTolerance() {
    assertTrue(tolerance.matches(new BigDecimal("100"), new BigDecimal("104")));
    assertFalse(tolerance.matches(new BigDecimal("100"), new BigDecimal("110")));
  }

  @Test
  void shouldTreatExactBoundaryAsMatch() {
    // |205 - 195| / 200 * 100 = 5
    assertTrue(tolerance.matches(new BigDecimal("205"), new BigDecimal("195")));
  }

  @Test
  void shouldMatchWhenBothValuesAreZero() {
    assertTrue(tolerance.matches(BigDecimal.ZERO, new BigDecimal("0.00")));
    assertEquals(BigDecimal.ZERO, tolerance.differencePercentage(BigDecimal.ZERO, BigDecimal.ZERO));
  }

  @Test
  void shouldReportFullDifferenceWhenAverageIsZero() {
    assertFalse(tolerance.matches(new BigDecimal("5"), new BigDecimal("-5")));
    assertEquals(
        0,
        BigDecimal.valueOf(100)
            .compareTo(tolerance.differencePercentage(new BigDecimal("5"), new BigDecimal("-5"))));
  }

  @Test
  void shouldComputeDifferencePercentageAgainstAverage() {
    assertEquals(
        0,
        new BigDecimal("10")
            .compareTo(
                tolerance.differencePercentage(new BigDecimal("105"), new BigDecimal("95"))));
  }

  @Test
  void shouldCompareNegativeValuesByMagnitude() {
    assertFalse(tolerance.matches(new BigDecimal("-100"), new BigDecimal("-10")));
    assertTrue(tolerance.matches(new BigDecimal("-100"), new BigDecimal("-104")));
    assertEquals(
        0,
        new BigDecimal("10")
            .compareTo(
                tolerance.differencePercentage(new BigDecimal("-105"), new BigDecimal("-95"))));
  }

  @Test
  void shouldRejectNegativeTolerance() {
    assertThrows(IllegalArgumentException.class, () -> ValueTolerance.ofPercent(-1));
  }
}
