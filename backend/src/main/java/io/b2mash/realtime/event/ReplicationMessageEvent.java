package io.b2mash.realtime.event;

import java.time.Instant;

/**
 * Raw pgoutput message read from a tenant's replication slot.
 *
 * @param lsn WAL position of the message, as printed by Postgres
 * @param payload undecoded message bytes
 */
public record ReplicationMessageEvent(
    String tenantId, String lsn, byte[] payload, Instant occurredAt) implements RealtimeEvent {}
