package io.b2mash.realtime.connect.pipeline;

import io.b2mash.realtime.exception.ConnectError;
import io.b2mash.realtime.exception.TenantConnectionException;
import io.b2mash.realtime.tenant.TenantRepository;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Loads the tenant fresh from the control plane, bypassing the cache. */
@Component
@Order(1)
public class GetTenant implements ConnectStep {

  private final TenantRepository tenantRepository;

  public GetTenant(TenantRepository tenantRepository) {
    this.tenantRepository = tenantRepository;
  }

  @Override
  public ConnectContext apply(ConnectContext context) {
    var tenant =
        tenantRepository
            .findByExternalId(context.tenantId())
            .orElseThrow(
                () ->
                    new TenantConnectionException(
                        ConnectError.TENANT_NOT_FOUND, "No tenant " + context.tenantId()));
    return context.withTenant(tenant);
  }
}
