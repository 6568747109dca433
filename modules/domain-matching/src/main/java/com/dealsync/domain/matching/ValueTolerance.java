package com.dealsync.domain.matching;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Objects;

/**
 * Percentage difference against the average of two values. The average is taken by magnitude, so
 * two negative values compare like their positive counterparts.
 */
public record ValueTolerance(BigDecimal tolerancePercentage) {
  private static final BigDecimal TWO = BigDecimal.valueOf(2);
  private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

  public ValueTolerance {
    Objects.requireNonNull(tolerancePercentage, "tolerancePercentage must not be null");
    if (tolerancePercentage.signum() < 0) {
      throw new IllegalArgumentException("tolerancePercentage must be >= 0");
    }
  }

  public static ValueTolerance ofPercent(double tolerancePercentage) {
    return new ValueTolerance(BigDecimal.valueOf(tolerancePercentage));
  }

  public boolean matches(BigDecimal left, BigDecimal right) {
    if (left.compareTo(right) == 0) {
      return true;
    }
    BigDecimal average = left.add(right).divide(TWO, MathContext.DECIMAL64).abs();
    if (average.signum() == 0) {
      return false;
    }
    BigDecimal percentage =
        left.subtract(right).abs().divide(average, MathContext.DECIMAL64).multiply(HUNDRED);
    return percentage.compareTo(tolerancePercentage) <= 0;
  }

  public BigDecimal differencePercentage(BigDecimal left, BigDecimal right) {
    if (left.signum() == 0 && right.signum() == 0) {
      return BigDecimal.ZERO;
    }
    BigDecimal average = left.add(right).divide(TWO, MathContext.DECIMAL64).abs();
    if (average.signum() == 0) {
      return HUNDRED;
    }
    return left.subtract(right).abs().divide(average, MathContext.DECIMAL64).multiply(HUNDRED);
  }
}
