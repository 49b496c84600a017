package io.b2mash.realtime.connect.pipeline;

import io.b2mash.realtime.config.RealtimeProperties;
import io.b2mash.realtime.database.ConnectionMonitor;
import io.b2mash.realtime.database.DatabaseConnector;
import io.b2mash.realtime.exception.ConnectError;
import io.b2mash.realtime.exception.TenantConnectionException;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.annotation.Order;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

/**
 * Refuses suspended tenants, then opens the tenant pool if the database has room for it. The
 * owner is told when the pool stops answering.
 */
@Component
@Order(2)
public class CheckConnection implements ConnectStep {

  private final DatabaseConnector connector;
  private final TaskScheduler scheduler;
  private final Duration livenessInterval;

  public CheckConnection(
      DatabaseConnector connector,
      @Qualifier("connectScheduler") TaskScheduler scheduler,
      RealtimeProperties properties) {
    this.connector = connector;
    this.scheduler = scheduler;
    this.livenessInterval = properties.connect().livenessCheckInterval();
  }

  @Override
  public ConnectContext apply(ConnectContext context) {
    var tenant = context.tenant();
    if (tenant.suspended()) {
      throw new TenantConnectionException(
          ConnectError.TENANT_SUSPENDED, "Tenant " + tenant.externalId() + " is suspended");
    }
    connector.checkCapacity(tenant);
    var connection = connector.open(tenant);
    var monitor =
        ConnectionMonitor.watch(
            scheduler, connection, livenessInterval, context.owner()::connectionDown);
    return context.withConnection(connection, monitor);
  }
}
