package io.b2mash.realtime.connect.registry;

import io.b2mash.realtime.connect.ConnectionHandle;

/**
 * Mutable part of a registry entry. A null {@code conn} means the owner exists but has not
 * established its connection yet.
 */
public record ConnectionMetadata(ConnectionHandle conn) {

  public static final ConnectionMetadata INITIALIZING = new ConnectionMetadata(null);

  public boolean isConnected() {
    return conn != null;
  }
}
