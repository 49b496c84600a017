package io.b2mash.realtime.connect.registry;

import java.time.Instant;

/** A row of the cluster-wide claim table. */
public record ConnectionClaim(
    String tenantId, String node, boolean connected, Instant leaseExpiresAt) {}
