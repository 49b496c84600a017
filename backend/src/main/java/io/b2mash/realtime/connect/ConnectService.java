package io.b2mash.realtime.connect;

import io.b2mash.realtime.cluster.NodeAssignment;
import io.b2mash.realtime.cluster.NodeClient;
import io.b2mash.realtime.config.RealtimeProperties;
import io.b2mash.realtime.connect.registry.RegistryEntry;
import io.b2mash.realtime.connect.registry.RegistryException;
import io.b2mash.realtime.connect.registry.TenantRegistry;
import io.b2mash.realtime.event.TenantOperationEvent;
import io.b2mash.realtime.event.TenantOperationEvent.Operation;
import io.b2mash.realtime.exception.ConnectError;
import io.b2mash.realtime.exception.TenantConnectionException;
import io.b2mash.realtime.tenant.TenantCache;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Entry point for obtaining a tenant's database connection anywhere in the cluster. Routes to the
 * existing owner, or starts one on the node the tenant is assigned to.
 */
@Service
public class ConnectService {

  private static final Logger log = LoggerFactory.getLogger(ConnectService.class);

  private static final Duration LOCAL_STOP_TIMEOUT = Duration.ofSeconds(10);

  private final TenantRegistry registry;
  private final ConnectionManagerFactory managerFactory;
  private final TenantCache tenantCache;
  private final NodeAssignment nodeAssignment;
  private final NodeClient nodeClient;
  private final ApplicationEventPublisher eventPublisher;
  private final RealtimeProperties.Connect defaults;

  public ConnectService(
      TenantRegistry registry,
      ConnectionManagerFactory managerFactory,
      TenantCache tenantCache,
      NodeAssignment nodeAssignment,
      NodeClient nodeClient,
      ApplicationEventPublisher eventPublisher,
      RealtimeProperties properties) {
    this.registry = registry;
    this.managerFactory = managerFactory;
    this.tenantCache = tenantCache;
    this.nodeAssignment = nodeAssignment;
    this.nodeClient = nodeClient;
    this.eventPublisher = eventPublisher;
    this.defaults = properties.connect();
  }

  public ConnectionHandle lookupOrStartConnection(String tenantId) {
    return lookupOrStartConnection(tenantId, ConnectOptions.defaults());
  }

  /**
   * Returns the tenant's connection, starting it on its assigned node if no owner exists.
   *
   * @throws TenantConnectionException when the tenant cannot be connected
   */
  public ConnectionHandle lookupOrStartConnection(String tenantId, ConnectOptions options) {
    var resolved = options.resolve(defaults);
    var status = getStatus(tenantId);
    return switch (status.state()) {
      case CONNECTED -> status.connection();
      case UNAVAILABLE -> callExternalNode(tenantId, resolved);
      case CONNECTION_INITIALIZING -> {
        // Another caller is mid-pipeline; give it one backoff before joining it.
        sleep(defaults.initializingBackoff());
        yield callExternalNode(tenantId, resolved);
      }
      case INITIALIZING ->
          throw new TenantConnectionException(
              ConnectError.UNAVAILABLE, "Registry could not resolve tenant " + tenantId);
    };
  }

  /** Non-blocking registry lookup. */
  public ConnectionStatus getStatus(String tenantId) {
    try {
      return registry
          .lookup(tenantId)
          .map(
              entry ->
                  entry.metadata().isConnected()
                      ? ConnectionStatus.connected(entry.metadata().conn())
                      : ConnectionStatus.connectionInitializing())
          .orElseGet(ConnectionStatus::unavailable);
    } catch (RegistryException e) {
      log.error("Registry lookup of tenant {} failed", tenantId, e);
      return ConnectionStatus.initializing();
    }
  }

  public Optional<ConnectionOwner> whereis(String tenantId) {
    try {
      return registry
          .lookup(tenantId)
          .map(entry -> new ConnectionOwner(entry.node(), entry.owner()));
    } catch (RegistryException e) {
      log.error("Registry lookup of tenant {} failed", tenantId, e);
      return Optional.empty();
    }
  }

  /** Stops the tenant's connection wherever it runs. No-op when none exists. */
  public void shutdown(String tenantId) {
    whereis(tenantId)
        .ifPresent(
            owner -> {
              if (owner.isLocal()) {
                owner.manager().stop();
                return;
              }
              nodeAssignment
                  .findNode(owner.node())
                  .ifPresentOrElse(
                      node -> nodeClient.shutdown(node, tenantId),
                      () ->
                          log.warn(
                              "Tenant {} is owned by unknown node {}", tenantId, owner.node()));
            });
  }

  /**
   * Stops the tenant's connection if this node owns it.
   *
   * @return the termination future of the stopped owner
   */
  public Optional<CompletableFuture<String>> shutdownLocal(String tenantId) {
    return whereis(tenantId)
        .filter(ConnectionOwner::isLocal)
        .map(owner -> owner.manager().stop());
  }

  /** Tenants with an established connection owned by this node. */
  public Set<String> localTenants() {
    return registry.localTenants();
  }

  /**
   * Stops every manager on this node when the application shuts down, so tenant pools close and
   * cluster claims are released instead of waiting out their lease.
   */
  @EventListener(ContextClosedEvent.class)
  public void stopLocalConnections() {
    var owners = registry.localOwners();
    if (owners.isEmpty()) {
      return;
    }
    log.info("Stopping {} local tenant connections", owners.size());
    var stopped =
        CompletableFuture.allOf(
            owners.stream().map(ConnectionManager::stop).toArray(CompletableFuture[]::new));
    try {
      stopped.get(LOCAL_STOP_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      log.warn("Local tenant connections did not stop within {}", LOCAL_STOP_TIMEOUT);
    } catch (ExecutionException e) {
      log.warn("Failed to stop local tenant connections", e.getCause());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  /** Suspends the tenant's connection wherever it runs and drops it from the tenant cache. */
  public void suspend(String tenantId) {
    tenantCache.invalidate(tenantId);
    whereis(tenantId)
        .ifPresent(
            owner -> {
              if (owner.isLocal()) {
                // Only a ready owner listens on the operations topic
                if (owner.manager().phase() == ManagerPhase.READY) {
                  eventPublisher.publishEvent(
                      TenantOperationEvent.of(tenantId, Operation.SUSPEND_TENANT));
                } else {
                  owner.manager().suspend();
                }
                return;
              }
              nodeAssignment
                  .findNode(owner.node())
                  .ifPresent(node -> nodeClient.suspend(node, tenantId));
            });
  }

  /**
   * Connects the tenant on this node, joining an owner that already exists.
   *
   * @throws TenantConnectionException not found, suspended and too-many-connections failures as
   *     is, {@link ConnectError#CONNECTION_INITIALIZING} when the owner is not ready in time, and
   *     {@link ConnectError#UNAVAILABLE} for everything else
   */
  public ConnectionHandle connect(String tenantId, ConnectOptions options) {
    var resolved = options.resolve(defaults);
    try {
      var manager = managerFactory.create(tenantId, resolved);
      var registration = registry.registerIfAbsent(tenantId, manager);
      if (!registration.registered()) {
        return awaitExisting(registration.existing(), resolved.rpcTimeout());
      }
      return await(manager.start(), tenantId, resolved.rpcTimeout());
    } catch (TenantConnectionException e) {
      var reason = e.getReason();
      if (reason.isPassedThrough() || reason == ConnectError.CONNECTION_INITIALIZING) {
        throw e;
      }
      throw new TenantConnectionException(
          ConnectError.UNAVAILABLE, "Database of tenant " + tenantId + " is unavailable", e);
    } catch (RegistryException e) {
      log.error("UnableToConnectToTenantDatabase: tenant {}", tenantId, e);
      throw new TenantConnectionException(
          ConnectError.UNAVAILABLE, "Database of tenant " + tenantId + " is unavailable", e);
    }
  }

  private ConnectionHandle callExternalNode(String tenantId, ConnectOptions options) {
    var tenant =
        tenantCache
            .getTenant(tenantId)
            .orElseThrow(
                () ->
                    new TenantConnectionException(
                        ConnectError.TENANT_NOT_FOUND, "No tenant " + tenantId));
    if (tenant.suspended()) {
      throw new TenantConnectionException(
          ConnectError.TENANT_SUSPENDED, "Tenant " + tenantId + " is suspended");
    }
    var node = nodeAssignment.nodeForTenant(tenant);
    if (nodeAssignment.isLocal(node)) {
      return connect(tenantId, options);
    }
    return nodeClient.connect(node, tenantId, options);
  }

  private ConnectionHandle awaitExisting(RegistryEntry existing, Duration timeout) {
    if (existing.isLocal()) {
      return await(existing.owner().ready(), existing.tenantId(), timeout);
    }
    if (existing.metadata().isConnected()) {
      return existing.metadata().conn();
    }
    throw new TenantConnectionException(
        ConnectError.CONNECTION_INITIALIZING,
        "Tenant " + existing.tenantId() + " is connecting on node " + existing.node());
  }

  private static ConnectionHandle await(
      CompletableFuture<? extends ConnectionHandle> ready, String tenantId, Duration timeout) {
    try {
      return ready.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (ExecutionException e) {
      if (e.getCause() instanceof TenantConnectionException connectException) {
        throw connectException;
      }
      throw new TenantConnectionException(
          ConnectError.UNAVAILABLE, "Connecting tenant " + tenantId + " failed", e.getCause());
    } catch (TimeoutException e) {
      throw new TenantConnectionException(
          ConnectError.CONNECTION_INITIALIZING,
          "Tenant " + tenantId + " not connected within " + timeout);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TenantConnectionException(
          ConnectError.UNAVAILABLE, "Interrupted while connecting tenant " + tenantId, e);
    }
  }

  private static void sleep(Duration duration) {
    try {
      Thread.sleep(duration.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TenantConnectionException(
          ConnectError.UNAVAILABLE, "Interrupted while waiting for a connection", e);
    }
  }
}
