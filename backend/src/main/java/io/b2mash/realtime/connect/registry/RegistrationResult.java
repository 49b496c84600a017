package io.b2mash.realtime.connect.registry;

/**
 * Outcome of {@link TenantRegistry#registerIfAbsent}. Exactly one of the two fields is set.
 *
 * @param entry the new entry when registration succeeded
 * @param existing the winning entry when another owner got there first
 */
public record RegistrationResult(RegistryEntry entry, RegistryEntry existing) {

  public static RegistrationResult registered(RegistryEntry entry) {
    return new RegistrationResult(entry, null);
  }

  public static RegistrationResult alreadyRegistered(RegistryEntry existing) {
    return new RegistrationResult(null, existing);
  }

  public boolean registered() {
    return entry != null;
  }
}
