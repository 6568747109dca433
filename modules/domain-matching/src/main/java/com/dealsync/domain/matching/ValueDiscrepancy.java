package com.dealsync.domain.matching;

import java.math.BigDecimal;

public record ValueDiscrepancy(
    String recordName,
    String matchKey,
    BigDecimal valueA,
    BigDecimal valueB,
    BigDecimal difference,
    BigDecimal differencePercentage) {}
