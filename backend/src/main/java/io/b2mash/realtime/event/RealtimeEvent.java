package io.b2mash.realtime.event;

import java.time.Instant;

/**
 * Base interface of events published through Spring's ApplicationEventPublisher. Events are
 * records of plain values so they can be handed across threads without copying. Every event is
 * scoped to one tenant.
 */
public sealed interface RealtimeEvent
    permits TenantOperationEvent, ReplicationMessageEvent, DatabaseNotificationEvent {

  String tenantId();

  Instant occurredAt();
}
