package io.b2mash.realtime.replication;

import io.b2mash.realtime.connect.ConnectionManager;
import io.b2mash.realtime.tenant.Tenant;

/** Starts the replication worker of a tenant. The owner is told if the worker exits. */
@FunctionalInterface
public interface ReplicationStarter {

  ChildProcess start(Tenant tenant, ConnectionManager owner);
}
