package io.b2mash.realtime.connect.registry;

import io.b2mash.realtime.connect.ConnectionManager;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Cluster-wide map from tenant id to the single manager owning that tenant's database
 * connection. Entries live exactly as long as their owner: only the owner updates its entry and
 * the owner removes it when it terminates.
 */
public interface TenantRegistry {

  /**
   * @throws RegistryException if the registry cannot be read
   */
  Optional<RegistryEntry> lookup(String tenantId);

  /**
   * Claims the tenant for {@code owner} with an initializing entry. Concurrent claims for the same
   * tenant from any node produce exactly one winner; the others get the winner's entry.
   *
   * @throws RegistryException if the claim cannot be decided
   */
  RegistrationResult registerIfAbsent(String tenantId, ConnectionManager owner);

  /**
   * Atomically replaces the owner's metadata.
   *
   * @return false when {@code owner} no longer holds the entry
   */
  boolean updateMetadata(
      String tenantId, ConnectionManager owner, UnaryOperator<ConnectionMetadata> update);

  /** Removes the entry if {@code owner} still holds it. Called by the owner on termination. */
  void unregister(String tenantId, ConnectionManager owner);

  /** Tenants whose established connection is owned by this node. */
  Set<String> localTenants();

  /** Managers on this node holding an entry, whether connected or still initializing. */
  List<ConnectionManager> localOwners();
}
