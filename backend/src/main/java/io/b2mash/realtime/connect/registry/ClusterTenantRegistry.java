package io.b2mash.realtime.connect.registry;

import io.b2mash.realtime.connect.ConnectionManager;
import io.b2mash.realtime.connect.RemoteConnectionHandle;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Cluster-wide registry. Local owners live in a {@link LocalTenantRegistry}; the claim table in
 * the control-plane database arbitrates between nodes. Claims are kept alive by {@link
 * #renewLeases()}, so a node that dies loses its claims once their lease runs out. An owner whose
 * claim could not be renewed is dropped and told to terminate.
 */
public class ClusterTenantRegistry implements TenantRegistry {

  private static final Logger log = LoggerFactory.getLogger(ClusterTenantRegistry.class);

  private final LocalTenantRegistry local;
  private final ConnectionClaimRepository claims;
  private final String node;
  private final Duration leaseTtl;
  private final Set<String> claimed = ConcurrentHashMap.newKeySet();

  public ClusterTenantRegistry(
      LocalTenantRegistry local,
      ConnectionClaimRepository claims,
      String node,
      Duration leaseTtl) {
    this.local = local;
    this.claims = claims;
    this.node = node;
    this.leaseTtl = leaseTtl;
  }

  /** Drops claims left behind by a previous run of this node. */
  public void releaseStaleClaims() {
    int released = claims.releaseAll(node);
    if (released > 0) {
      log.info("Released {} stale connection claims of node {}", released, node);
    }
  }

  @Override
  public Optional<RegistryEntry> lookup(String tenantId) {
    var localEntry = local.lookup(tenantId);
    if (localEntry.isPresent()) {
      return localEntry;
    }
    try {
      // A live claim of this node without a local owner is stale and reads as absent
      return claims
          .findLive(tenantId)
          .filter(claim -> !node.equals(claim.node()))
          .map(ClusterTenantRegistry::remoteEntry);
    } catch (DataAccessException e) {
      throw new RegistryException("Failed to read connection claim of tenant " + tenantId, e);
    }
  }

  @Override
  public RegistrationResult registerIfAbsent(String tenantId, ConnectionManager owner) {
    var result = local.registerIfAbsent(tenantId, owner);
    if (!result.registered()) {
      return result;
    }

    boolean won;
    try {
      won = claims.tryClaim(tenantId, node, leaseTtl);
    } catch (DataAccessException e) {
      local.unregister(tenantId, owner);
      throw new RegistryException("Failed to claim tenant " + tenantId, e);
    }
    if (won) {
      claimed.add(tenantId);
      return result;
    }

    local.unregister(tenantId, owner);
    try {
      return claims
          .findLive(tenantId)
          .map(claim -> RegistrationResult.alreadyRegistered(remoteEntry(claim)))
          .orElseThrow(
              () -> new RegistryException("Claim of tenant " + tenantId + " changed hands"));
    } catch (DataAccessException e) {
      throw new RegistryException("Failed to read connection claim of tenant " + tenantId, e);
    }
  }

  @Override
  public boolean updateMetadata(
      String tenantId, ConnectionManager owner, UnaryOperator<ConnectionMetadata> update) {
    if (!local.updateMetadata(tenantId, owner, update)) {
      return false;
    }
    var connected = local.lookup(tenantId).map(e -> e.metadata().isConnected()).orElse(false);
    try {
      claims.markConnected(tenantId, node, connected);
    } catch (DataAccessException e) {
      throw new RegistryException("Failed to publish connection of tenant " + tenantId, e);
    }
    return true;
  }

  @Override
  public void unregister(String tenantId, ConnectionManager owner) {
    var held = local.lookup(tenantId).map(entry -> entry.owner() == owner).orElse(false);
    local.unregister(tenantId, owner);
    if (!held) {
      return;
    }
    claimed.remove(tenantId);
    try {
      claims.release(tenantId, node);
    } catch (DataAccessException e) {
      log.warn("Failed to release claim of tenant {}; it expires in {}", tenantId, leaseTtl, e);
    }
  }

  @Override
  public Set<String> localTenants() {
    return local.localTenants();
  }

  @Override
  public List<ConnectionManager> localOwners() {
    return local.localOwners();
  }

  @Scheduled(fixedDelayString = "${realtime.cluster.heartbeat-interval-ms:5000}")
  public void renewLeases() {
    for (var tenantId : Set.copyOf(claimed)) {
      try {
        if (!claims.renew(tenantId, node, leaseTtl)) {
          onClaimLost(tenantId);
        }
      } catch (DataAccessException e) {
        log.error("Failed to renew connection claim of tenant {}", tenantId, e);
      }
    }
  }

  private void onClaimLost(String tenantId) {
    // Unregistered in the meantime
    if (!claimed.remove(tenantId)) {
      return;
    }
    log.warn("Connection claim of tenant {} is no longer held by node {}", tenantId, node);
    local
        .lookup(tenantId)
        .map(RegistryEntry::owner)
        .ifPresent(
            owner -> {
              local.unregister(tenantId, owner);
              owner.claimLost();
            });
  }

  private static RegistryEntry remoteEntry(ConnectionClaim claim) {
    var metadata =
        claim.connected()
            ? new ConnectionMetadata(new RemoteConnectionHandle(claim.node(), claim.tenantId()))
            : ConnectionMetadata.INITIALIZING;
    return new RegistryEntry(claim.tenantId(), claim.node(), null, metadata);
  }
}
