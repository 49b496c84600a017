package io.b2mash.realtime.connect;

import io.b2mash.realtime.config.RealtimeProperties;
import io.b2mash.realtime.connect.pipeline.ConnectStep;
import io.b2mash.realtime.connect.registry.TenantRegistry;
import io.b2mash.realtime.counter.ConnectedUsersCounter;
import io.b2mash.realtime.counter.TenantRateCounters;
import io.b2mash.realtime.migration.TenantMigrations;
import io.b2mash.realtime.replication.ListenerStarter;
import io.b2mash.realtime.replication.ReplicationStarter;
import java.util.List;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

@Component
public class ConnectionManagerFactory {

  private final ConnectionManagerDependencies deps;

  @Autowired
  public ConnectionManagerFactory(
      RealtimeProperties properties,
      TenantRegistry registry,
      List<ConnectStep> steps,
      TenantMigrations migrations,
      ReplicationStarter replicationStarter,
      ListenerStarter listenerStarter,
      ConnectedUsersCounter usersCounter,
      TenantRateCounters rateCounters,
      TenantOperationsTopic operationsTopic,
      @Qualifier("connectExecutor") TaskExecutor executor,
      @Qualifier("connectScheduler") TaskScheduler scheduler) {
    this(
        new ConnectionManagerDependencies(
            properties.cluster().nodeName(),
            registry,
            List.copyOf(steps),
            migrations,
            replicationStarter,
            listenerStarter,
            usersCounter,
            rateCounters,
            operationsTopic,
            executor,
            scheduler,
            properties.connect().childShutdownTimeout()));
  }

  ConnectionManagerFactory(ConnectionManagerDependencies deps) {
    this.deps = deps;
  }

  /** Creates an unstarted manager. {@code options} must already be resolved. */
  public ConnectionManager create(String tenantId, ConnectOptions options) {
    return new ConnectionManager(tenantId, options, deps);
  }
}
