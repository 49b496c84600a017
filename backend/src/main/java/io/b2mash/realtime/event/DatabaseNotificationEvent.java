package io.b2mash.realtime.event;

import java.time.Instant;

/** A NOTIFY received from a tenant database. */
public record DatabaseNotificationEvent(
    String tenantId, String channel, String payload, Instant occurredAt)
    implements RealtimeEvent {}
