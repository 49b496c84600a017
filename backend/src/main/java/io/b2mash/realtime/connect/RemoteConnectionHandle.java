package io.b2mash.realtime.connect;

/** Connection owned by another node. */
public record RemoteConnectionHandle(String node, String tenantId) implements ConnectionHandle {

  @Override
  public boolean isLocal() {
    return false;
  }
}
