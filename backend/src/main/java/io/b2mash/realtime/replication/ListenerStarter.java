package io.b2mash.realtime.replication;

import io.b2mash.realtime.connect.ConnectionManager;
import io.b2mash.realtime.tenant.Tenant;

/** Starts the notification listener of a tenant. The owner is told if the listener exits. */
@FunctionalInterface
public interface ListenerStarter {

  ChildProcess start(Tenant tenant, ConnectionManager owner);
}
