package io.b2mash.realtime.connect.registry;

import io.b2mash.realtime.connect.ConnectionManager;

/**
 * A tenant's connection owner.
 *
 * @param tenantId registry key
 * @param node cluster node the owner runs on
 * @param owner the owning manager when it runs on this node, otherwise null
 * @param metadata connection state published by the owner
 */
public record RegistryEntry(
    String tenantId, String node, ConnectionManager owner, ConnectionMetadata metadata) {

  public boolean isLocal() {
    return owner != null;
  }

  RegistryEntry withMetadata(ConnectionMetadata newMetadata) {
    return new RegistryEntry(tenantId, node, owner, newMetadata);
  }
}
