package io.b2mash.realtime.connect;

import io.b2mash.realtime.connect.pipeline.ConnectStep;
import io.b2mash.realtime.connect.registry.TenantRegistry;
import io.b2mash.realtime.counter.ConnectedUsersCounter;
import io.b2mash.realtime.counter.TenantRateCounters;
import io.b2mash.realtime.migration.TenantMigrations;
import io.b2mash.realtime.replication.ListenerStarter;
import io.b2mash.realtime.replication.ReplicationStarter;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executor;
import org.springframework.scheduling.TaskScheduler;

/** Collaborators shared by every connection manager of this node. */
record ConnectionManagerDependencies(
    String node,
    TenantRegistry registry,
    List<ConnectStep> steps,
    TenantMigrations migrations,
    ReplicationStarter replicationStarter,
    ListenerStarter listenerStarter,
    ConnectedUsersCounter usersCounter,
    TenantRateCounters rateCounters,
    TenantOperationsTopic operationsTopic,
    Executor executor,
    TaskScheduler scheduler,
    Duration childShutdownTimeout) {}
