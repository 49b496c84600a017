package io.b2mash.realtime.connect;

import io.b2mash.realtime.connect.pipeline.ConnectContext;
import io.b2mash.realtime.connect.pipeline.ConnectPipeline;
import io.b2mash.realtime.database.ConnectionMonitor;
import io.b2mash.realtime.database.TenantDatabaseConnection;
import io.b2mash.realtime.event.TenantOperationEvent.Operation;
import io.b2mash.realtime.exception.ConnectError;
import io.b2mash.realtime.exception.TenantConnectionException;
import io.b2mash.realtime.replication.ChildProcess;
import io.b2mash.realtime.replication.ChildStartException;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owner of one tenant's database connection on this node.
 *
 * <p>All state changes run on the manager's {@link Mailbox}, one signal at a time. The manager
 * connects through the pipeline, publishes the connection, then runs migrations and starts the
 * replication and listener workers before it becomes {@link ManagerPhase#READY}. From then on it
 * samples connected users and terminates once the tenant has been idle for six samples, or when
 * suspended, stopped, or its connection or a worker dies.
 *
 * <p>Callers register the manager in the {@link
 * io.b2mash.realtime.connect.registry.TenantRegistry} before calling {@link #start()}; the manager
 * removes its own entry on termination.
 */
public class ConnectionManager {

  private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);

  private final String tenantId;
  private final ConnectOptions options;
  private final ConnectionManagerDependencies deps;
  private final Mailbox mailbox;
  private final ConnectionManagerState state = new ConnectionManagerState();
  private final CompletableFuture<TenantDatabaseConnection> ready = new CompletableFuture<>();
  private final CompletableFuture<String> terminated = new CompletableFuture<>();
  private volatile ManagerPhase phase = ManagerPhase.INITIALIZING;

  ConnectionManager(String tenantId, ConnectOptions options, ConnectionManagerDependencies deps) {
    this.tenantId = tenantId;
    this.options = options;
    this.deps = deps;
    this.mailbox = new Mailbox(tenantId, deps.executor());
  }

  public String tenantId() {
    return tenantId;
  }

  public ManagerPhase phase() {
    return phase;
  }

  /** Starts connecting. The returned future completes once the connection is published. */
  public CompletableFuture<TenantDatabaseConnection> start() {
    mailbox.send(this::initialize);
    return ready();
  }

  public CompletableFuture<TenantDatabaseConnection> ready() {
    return ready.copy();
  }

  /** Completes with the termination reason. */
  public CompletableFuture<String> terminated() {
    return terminated.copy();
  }

  public void checkConnectedUsers() {
    mailbox.send(this::onCheckConnectedUsers);
  }

  public CompletableFuture<String> stop() {
    mailbox.send(() -> terminate("shutdown requested"));
    return terminated();
  }

  public void suspend() {
    mailbox.send(() -> terminate("tenant suspended"));
  }

  /** The cluster claim on this tenant expired and may already belong to another node. */
  public CompletableFuture<String> claimLost() {
    mailbox.send(() -> terminate("connection claim lost"));
    return terminated();
  }

  public void connectionDown(ConnectionMonitor monitor) {
    mailbox.send(
        () -> {
          if (monitor == null || monitor != state.monitor) {
            return;
          }
          log.warn("Database connection of tenant {} is down", tenantId);
          terminate("database connection down");
        });
  }

  public void childExited(ChildProcess child, Throwable cause) {
    mailbox.send(
        () -> {
          if (!state.isChild(child)) {
            return;
          }
          log.warn("{} of tenant {} exited unexpectedly", child.name(), tenantId, cause);
          terminate(child.name() + " exited");
        });
  }

  // Mailbox tasks below

  private void initialize() {
    if (phase != ManagerPhase.INITIALIZING) {
      return;
    }
    var result = ConnectPipeline.run(deps.steps(), ConnectContext.initial(tenantId, this));
    state.apply(result.context());
    if (!result.succeeded()) {
      var error = result.error();
      if (!error.getReason().isPassedThrough()) {
        log.error("UnableToConnectToTenantDatabase: tenant {}", tenantId, error);
      }
      terminate(error.getReason().name(), error);
      return;
    }

    ready.complete(state.connection);

    // The caller is released; the rest runs before any other signal.
    if (runMigrations() && startListenAndReplication()) {
      setupConnectedUserEvents();
    }
  }

  private boolean runMigrations() {
    try {
      deps.migrations().runMigrations(state.tenant, state.connection);
      deps.migrations().createPartitions(state.connection);
      return true;
    } catch (RuntimeException e) {
      log.error("MigrationsFailedToRun: tenant {}", tenantId, e);
      terminate(ConnectError.MIGRATION_FAILED.name());
      return false;
    }
  }

  private boolean startListenAndReplication() {
    try {
      state.replication = deps.replicationStarter().start(state.tenant, this);
      state.listener = deps.listenerStarter().start(state.tenant, this);
      return true;
    } catch (ChildStartException e) {
      if (e.getReason() == ConnectError.MAX_WAL_SENDERS_REACHED) {
        log.warn("ReplicationMaxWalSendersReached: tenant {}: {}", tenantId, e.getMessage());
      } else {
        log.error("StartListenAndReplicationFailed: tenant {}", tenantId, e);
      }
      terminate(e.getReason().name());
      return false;
    } catch (RuntimeException e) {
      log.error("StartListenAndReplicationFailed: tenant {}", tenantId, e);
      terminate(ConnectError.REPLICATION_START_FAILED.name());
      return false;
    }
  }

  private void setupConnectedUserEvents() {
    state.operationsSubscriber = this::onOperation;
    deps.operationsTopic().subscribe(tenantId, state.operationsSubscriber);
    phase = ManagerPhase.READY;
    log.info("Tenant {} connected on node {}", tenantId, deps.node());
    scheduleConnectedUsersCheck();
  }

  private void onOperation(Operation operation) {
    switch (operation) {
      case SUSPEND_TENANT -> suspend();
      case DISCONNECT -> stop();
    }
  }

  private void scheduleConnectedUsersCheck() {
    state.checkTimer =
        deps.scheduler()
            .schedule(
                this::checkConnectedUsers,
                Instant.now().plus(options.checkConnectedUserInterval()));
  }

  private void onCheckConnectedUsers() {
    if (phase != ManagerPhase.READY) {
      return;
    }
    int connectedUsers;
    try {
      connectedUsers = deps.usersCounter().countForTenant(tenantId);
    } catch (RuntimeException e) {
      log.warn("Failed to count connected users of tenant {}", tenantId, e);
      scheduleConnectedUsersCheck();
      return;
    }
    state.window.record(connectedUsers);
    if (state.window.isIdle()) {
      log.info("Tenant {} has no connected users, shutting down", tenantId);
      mailbox.send(() -> terminate("no connected users"));
      return;
    }
    scheduleConnectedUsersCheck();
  }

  private void terminate(String reason) {
    terminate(reason, null);
  }

  /** Fails {@code ready} with {@code failure}, or UNAVAILABLE, once the entry is gone. */
  private void terminate(String reason, TenantConnectionException failure) {
    if (phase == ManagerPhase.TERMINATING || phase == ManagerPhase.TERMINATED) {
      return;
    }
    phase = ManagerPhase.TERMINATING;
    try {
      if (state.checkTimer != null) {
        state.checkTimer.cancel(false);
      }
      if (state.monitor != null) {
        state.monitor.cancel();
      }
      if (state.operationsSubscriber != null) {
        deps.operationsTopic().unsubscribe(tenantId, state.operationsSubscriber);
      }
      stopChild(state.listener);
      stopChild(state.replication);
      if (state.connection != null && !state.connection.stop(deps.childShutdownTimeout())) {
        log.warn("Connection of tenant {} did not stop cleanly", tenantId);
      }
    } finally {
      try {
        deps.registry().unregister(tenantId, this);
      } catch (RuntimeException e) {
        log.warn("Failed to unregister tenant {}", tenantId, e);
      }
      deps.rateCounters().remove(tenantId);
      phase = ManagerPhase.TERMINATED;
      log.info("Tenant {} has been terminated: {}", tenantId, reason);
      ready.completeExceptionally(
          failure != null
              ? failure
              : new TenantConnectionException(
                  ConnectError.UNAVAILABLE, "Connection of tenant " + tenantId + " terminated"));
      terminated.complete(reason);
    }
  }

  private void stopChild(ChildProcess child) {
    if (child == null || !child.isAlive()) {
      return;
    }
    try {
      if (!child.stop(deps.childShutdownTimeout())) {
        log.warn("{} of tenant {} did not stop cleanly", child.name(), tenantId);
      }
    } catch (RuntimeException e) {
      log.warn("Failed to stop {} of tenant {}", child.name(), tenantId, e);
    }
  }

  @Override
  public String toString() {
    return "ConnectionManager[tenantId=" + tenantId + ", phase=" + phase + "]";
  }
}
