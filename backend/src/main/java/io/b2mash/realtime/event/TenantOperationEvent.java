package io.b2mash.realtime.event;

import java.time.Instant;

/** Administrative signal for a tenant's connection owner. */
public record TenantOperationEvent(String tenantId, Operation operation, Instant occurredAt)
    implements RealtimeEvent {

  public enum Operation {
    SUSPEND_TENANT,
    DISCONNECT
  }

  public static TenantOperationEvent of(String tenantId, Operation operation) {
    return new TenantOperationEvent(tenantId, operation, Instant.now());
  }
}
