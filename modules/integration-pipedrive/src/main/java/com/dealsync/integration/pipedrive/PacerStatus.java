package com.dealsync.integration.pipedrive;

public record PacerStatus(long requestCount, long lastRequestAtMs) {}
