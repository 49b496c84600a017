package io.b2mash.realtime.connect;

/** Where a tenant's connection manager lives. {@code manager} is null when it runs elsewhere. */
public record ConnectionOwner(String node, ConnectionManager manager) {

  public boolean isLocal() {
    return manager != null;
  }
}
