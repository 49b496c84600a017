package io.b2mash.realtime.replication;

import io.b2mash.realtime.config.RealtimeProperties;
import io.b2mash.realtime.connect.ConnectionManager;
import io.b2mash.realtime.event.ReplicationMessageEvent;
import io.b2mash.realtime.exception.ConnectError;
import io.b2mash.realtime.tenant.Tenant;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Properties;
import java.util.concurrent.Executor;
import java.util.function.BiConsumer;
import org.postgresql.PGConnection;
import org.postgresql.PGProperty;
import org.postgresql.replication.PGReplicationStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

/**
 * Streams {@code realtime.messages} changes out of a tenant database through a temporary pgoutput
 * slot. Messages are published undecoded as {@link ReplicationMessageEvent}s.
 */
@Component
public class PostgresReplicationStarter implements ReplicationStarter {

  private static final Logger log = LoggerFactory.getLogger(PostgresReplicationStarter.class);

  static final String PUBLICATION = "realtime_messages_publication";
  static final String APPLICATION_NAME = "realtime_replication_connection";
  private static final String WAL_SENDERS_EXHAUSTED_SQLSTATE = "53300";
  private static final int MAX_MESSAGES_PER_POLL = 500;

  private static final String WAL_SENDERS_SQL =
      """
      SELECT current_setting('max_wal_senders')::int AS max_senders,
             (SELECT count(*) FROM pg_stat_replication) AS used_senders
      """;

  private final ApplicationEventPublisher eventPublisher;
  private final TaskScheduler scheduler;
  private final Executor closeExecutor;
  private final Duration pollInterval;

  public PostgresReplicationStarter(
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
    checkWalSenders(tenant);
    Connection connection = null;
    try {
      connection = openReplicationConnection(tenant);
      var pgConnection = connection.unwrap(PGConnection.class);
      var slotName = slotName(tenantId);
      pgConnection
          .getReplicationAPI()
          .createReplicationSlot()
          .logical()
          .withSlotName(slotName)
          .withOutputPlugin("pgoutput")
          .withTemporaryOption()
          .make();
      var stream =
          pgConnection
              .getReplicationAPI()
              .replicationStream()
              .logical()
              .withSlotName(slotName)
              .withSlotOption("proto_version", "1")
              .withSlotOption("publication_names", PUBLICATION)
              .start();
      var child =
          new ReplicationChild(tenantId, connection, stream, owner::childExited, closeExecutor);
      child.schedule(scheduler, pollInterval);
      log.info("Started replication of tenant {} on slot {}", tenantId, slotName);
      return child;
    } catch (SQLException e) {
      closeQuietly(connection, tenantId);
      if (WAL_SENDERS_EXHAUSTED_SQLSTATE.equals(e.getSQLState())) {
        throw ChildStartException.maxWalSendersReached(tenantId, e);
      }
      throw new ChildStartException(
          ConnectError.REPLICATION_START_FAILED,
          "Replication of tenant " + tenantId + " failed to start: " + e.getMessage(),
          e);
    }
  }

  private void checkWalSenders(Tenant tenant) {
    var settings = tenant.database();
    try (var connection = DriverManager.getConnection(settings.jdbcUrl(), baseProperties(tenant));
        var statement = connection.createStatement();
        var rs = statement.executeQuery(WAL_SENDERS_SQL)) {
      rs.next();
      if (rs.getInt("used_senders") >= rs.getInt("max_senders")) {
        throw ChildStartException.maxWalSendersReached(tenant.externalId(), null);
      }
    } catch (SQLException e) {
      throw new ChildStartException(
          ConnectError.REPLICATION_START_FAILED,
          "Cannot inspect WAL senders of tenant " + tenant.externalId(),
          e);
    }
  }

  private static Connection openReplicationConnection(Tenant tenant) throws SQLException {
    var props = baseProperties(tenant);
    PGProperty.REPLICATION.set(props, "database");
    PGProperty.PREFER_QUERY_MODE.set(props, "simple");
    PGProperty.ASSUME_MIN_SERVER_VERSION.set(props, "9.4");
    return DriverManager.getConnection(tenant.database().jdbcUrl(), props);
  }

  private static Properties baseProperties(Tenant tenant) {
    var props = new Properties();
    PGProperty.USER.set(props, tenant.database().user());
    PGProperty.PASSWORD.set(props, tenant.database().password());
    PGProperty.APPLICATION_NAME.set(props, APPLICATION_NAME);
    return props;
  }

  /** Slot names allow only lower-case letters, digits and underscores. */
  static String slotName(String tenantId) {
    var sanitized = tenantId.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_]", "_");
    var name = "realtime_" + sanitized;
    return name.length() > 63 ? name.substring(0, 63) : name;
  }

  private static void closeQuietly(Connection connection, String tenantId) {
    if (connection == null) {
      return;
    }
    try {
      connection.close();
    } catch (SQLException e) {
      log.debug("Closing replication connection of tenant {} failed", tenantId, e);
    }
  }

  private final class ReplicationChild extends PollingChild {

    private final Connection connection;
    private final PGReplicationStream stream;

    ReplicationChild(
        String tenantId,
        Connection connection,
        PGReplicationStream stream,
        BiConsumer<ChildProcess, Throwable> onExit,
        Executor closeExecutor) {
      super("replication", tenantId, onExit, closeExecutor);
      this.connection = connection;
      this.stream = stream;
    }

    @Override
    protected void poll() throws SQLException {
      for (int i = 0; i < MAX_MESSAGES_PER_POLL; i++) {
        var buffer = stream.readPending();
        if (buffer == null) {
          break;
        }
        var payload = new byte[buffer.remaining()];
        buffer.get(payload);
        var lsn = stream.getLastReceiveLSN();
        eventPublisher.publishEvent(
            new ReplicationMessageEvent(tenantId(), lsn.asString(), payload, Instant.now()));
        stream.setAppliedLSN(lsn);
        stream.setFlushedLSN(lsn);
      }
    }

    @Override
    protected void close() throws SQLException {
      try {
        stream.close();
      } finally {
        connection.close();
      }
    }
  }
}
