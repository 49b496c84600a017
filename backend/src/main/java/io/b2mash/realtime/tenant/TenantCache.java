package io.b2mash.realtime.tenant;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.b2mash.realtime.config.RealtimeProperties;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Tenant lookup tolerant of brief staleness, used on the routing fast path. Connection attempts
 * themselves always read through {@link TenantRepository}.
 */
@Component
public class TenantCache {

  private final TenantRepository tenantRepository;
  private final Cache<String, Tenant> tenants;

  public TenantCache(TenantRepository tenantRepository, RealtimeProperties properties) {
    this.tenantRepository = tenantRepository;
    this.tenants =
        Caffeine.newBuilder()
            .maximumSize(10_000)
            .expireAfterWrite(properties.connect().tenantCacheTtl())
            .build();
  }

  public Optional<Tenant> getTenant(String externalId) {
    // Unknown tenants are not cached so a newly created tenant is visible immediately.
    var cached = tenants.getIfPresent(externalId);
    if (cached != null) {
      return Optional.of(cached);
    }
    var tenant = tenantRepository.findByExternalId(externalId);
    tenant.ifPresent(t -> tenants.put(externalId, t));
    return tenant;
  }

  public void invalidate(String externalId) {
    tenants.invalidate(externalId);
  }
}
