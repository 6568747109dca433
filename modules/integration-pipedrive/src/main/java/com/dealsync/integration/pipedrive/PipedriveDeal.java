package com.dealsync.integration.pipedrive;

import java.math.BigDecimal;

public record PipedriveDeal(
    long id,
    String title,
    BigDecimal value,
    String currency,
    String status,
    Long pipelineId,
    Long stageId,
    String updateTime) {}
