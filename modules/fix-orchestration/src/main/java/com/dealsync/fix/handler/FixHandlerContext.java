package com.dealsync.fix.handler;

import com.dealsync.fix.orchestrator.FixOrchestrationConfig;
import com.dealsync.integration.pipedrive.PipedriveCredentials;
import java.util.Objects;

/** Per-call context handed to handlers. Handlers must not keep a reference to it. */
public record FixHandlerContext(
    PipedriveCredentials credentials, String tenantId, FixOrchestrationConfig config) {
  public FixHandlerContext {
    Objects.requireNonNull(credentials, "credentials must not be null");
    tenantId = Objects.requireNonNullElse(tenantId, "");
    Objects.requireNonNull(config, "config must not be null");
  }
}
