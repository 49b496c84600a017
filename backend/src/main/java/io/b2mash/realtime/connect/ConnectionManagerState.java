package io.b2mash.realtime.connect;

import io.b2mash.realtime.connect.pipeline.ConnectContext;
import io.b2mash.realtime.database.ConnectionMonitor;
import io.b2mash.realtime.database.TenantDatabaseConnection;
import io.b2mash.realtime.event.TenantOperationEvent.Operation;
import io.b2mash.realtime.replication.ChildProcess;
import io.b2mash.realtime.tenant.Tenant;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Consumer;

/** Resources held by a connection manager. Only touched from the manager's mailbox. */
final class ConnectionManagerState {

  Tenant tenant;
  TenantDatabaseConnection connection;
  ConnectionMonitor monitor;
  ChildProcess replication;
  ChildProcess listener;
  ScheduledFuture<?> checkTimer;
  Consumer<Operation> operationsSubscriber;
  final ConnectedUsersWindow window = ConnectedUsersWindow.seeded();

  void apply(ConnectContext context) {
    tenant = context.tenant();
    connection = context.connection();
    monitor = context.monitor();
  }

  boolean isChild(ChildProcess child) {
    return child != null && (child == replication || child == listener);
  }
}
