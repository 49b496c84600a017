package io.b2mash.realtime.replication;

import io.b2mash.realtime.config.RealtimeProperties;
import io.b2mash.realtime.connect.ConnectionManager;
import io.b2mash.realtime.event.DatabaseNotificationEvent;
import io.b2mash.realtime.exception.ConnectError;
import io.b2mash.realtime.tenant.Tenant;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.Properties;
import java.util.concurrent.Executor;
import java.util.function.BiConsumer;
import org.postgresql.PGConnection;
import org.postgresql.PGProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

/** Listens on the tenant database's system channel and republishes notifications as events. */
@Component
public class PostgresListenStarter implements ListenerStarter {

  private static final Logger log = LoggerFactory.getLogger(PostgresListenStarter.class);

  static final String CHANNEL = "realtime:system";
  static final String APPLICATION_NAME = "realtime_listen";

  private final ApplicationEventPublisher eventPublisher;
  private final TaskScheduler scheduler;
  private final Executor closeExecutor;
  private final Duration pollInterval;

  public PostgresListenStarter(
      ApplicationEventPublisher eventPublisher,
      @Qualifier("connectScheduler") TaskScheduler scheduler,
      @Qualifier("connectExecutor") Executor closeExecutor,
      RealtimeProperties properties) {
    this.eventPublisher = eventPublisher;
    this.scheduler = scheduler;
    this.closeExecutor = closeExecutor;
    this.pollInterval = properties.connect().childPollInterval();
  }

  @Override
  public ChildProcess start(Tenant tenant, ConnectionManager owner) {
    var tenantId = tenant.externalId();
    Connection connection = null;
    try {
      var props = new Properties();
      PGProperty.USER.set(props, tenant.database().user());
      PGProperty.PASSWORD.set(props, tenant.database().password());
      PGProperty.APPLICATION_NAME.set(props, APPLICATION_NAME);
      connection = DriverManager.getConnection(tenant.database().jdbcUrl(), props);
      try (var statement = connection.createStatement()) {
        statement.execute("LISTEN \"" + CHANNEL + "\"");
      }
      var child =
          new ListenChild(
              tenantId,
              connection,
              connection.unwrap(PGConnection.class),
              owner::childExited,
              closeExecutor);
      child.schedule(scheduler, pollInterval);
      log.info("Listening on {} for tenant {}", CHANNEL, tenantId);
      return child;
    } catch (SQLException e) {
      if (connection != null) {
        try {
          connection.close();
        } catch (SQLException closeError) {
          e.addSuppressed(closeError);
        }
      }
      throw new ChildStartException(
          ConnectError.LISTENER_START_FAILED,
          "Listener of tenant " + tenantId + " failed to start: " + e.getMessage(),
          e);
    }
  }

  private final class ListenChild extends PollingChild {

    private final Connection connection;
    private final PGConnection pgConnection;

    ListenChild(
        String tenantId,
        Connection connection,
        PGConnection pgConnection,
        BiConsumer<ChildProcess, Throwable> onExit,
        Executor closeExecutor) {
      super("listener", tenantId, onExit, closeExecutor);
      this.connection = connection;
      this.pgConnection = pgConnection;
    }

    @Override
    protected void poll() throws SQLException {
      var notifications = pgConnection.getNotifications(1);
      if (notifications == null) {
        return;
      }
      for (var notification : notifications) {
        eventPublisher.publishEvent(
            new DatabaseNotificationEvent(
                tenantId(), notification.getName(), notification.getParameter(), Instant.now()));
      }
    }

    @Override
    protected void close() throws SQLException {
      connection.close();
    }
  }
}
