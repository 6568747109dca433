package com.dealsync.fix.handler;

public record TitleRollbackData(long dealId, String originalTitle) implements RollbackData {}
