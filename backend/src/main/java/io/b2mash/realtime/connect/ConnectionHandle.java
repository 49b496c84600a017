package io.b2mash.realtime.connect;

/**
 * A tenant's established database connection as seen by callers. Local handles expose the pool;
 * remote handles only say which node owns it.
 */
public interface ConnectionHandle {

  String tenantId();

  /** Name of the cluster node owning the connection. */
  String node();

  boolean isLocal();
}
