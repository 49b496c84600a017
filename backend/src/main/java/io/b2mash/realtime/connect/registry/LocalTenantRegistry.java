package io.b2mash.realtime.connect.registry;

import io.b2mash.realtime.connect.ConnectionManager;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/** Registry scoped to this JVM. Atomicity comes from {@link ConcurrentHashMap} per-key updates. */
public class LocalTenantRegistry implements TenantRegistry {

  private final String node;
  private final Map<String, RegistryEntry> entries = new ConcurrentHashMap<>();

  public LocalTenantRegistry(String node) {
    this.node = node;
  }

  @Override
  public Optional<RegistryEntry> lookup(String tenantId) {
    return Optional.ofNullable(entries.get(tenantId));
  }

  @Override
  public RegistrationResult registerIfAbsent(String tenantId, ConnectionManager owner) {
    var entry = new RegistryEntry(tenantId, node, owner, ConnectionMetadata.INITIALIZING);
    var existing = entries.putIfAbsent(tenantId, entry);
    return existing == null
        ? RegistrationResult.registered(entry)
        : RegistrationResult.alreadyRegistered(existing);
  }

  @Override
  public boolean updateMetadata(
      String tenantId, ConnectionManager owner, UnaryOperator<ConnectionMetadata> update) {
    var updated = new AtomicBoolean();
    entries.computeIfPresent(
        tenantId,
        (key, entry) -> {
          if (entry.owner() != owner) {
            return entry;
          }
          updated.set(true);
          return entry.withMetadata(update.apply(entry.metadata()));
        });
    return updated.get();
  }

  @Override
  public void unregister(String tenantId, ConnectionManager owner) {
    entries.computeIfPresent(tenantId, (key, entry) -> entry.owner() == owner ? null : entry);
  }

  @Override
  public Set<String> localTenants() {
    return entries.values().stream()
        .filter(entry -> entry.metadata().isConnected())
        .map(RegistryEntry::tenantId)
        .collect(Collectors.toUnmodifiableSet());
  }

  @Override
  public List<ConnectionManager> localOwners() {
    return entries.values().stream().map(RegistryEntry::owner).toList();
  }
}
