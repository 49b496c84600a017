package io.b2mash.realtime.connect.pipeline;

import io.b2mash.realtime.connect.ConnectionManager;
import io.b2mash.realtime.database.ConnectionMonitor;
import io.b2mash.realtime.database.TenantDatabaseConnection;
import io.b2mash.realtime.tenant.Tenant;

/**
 * State threaded through the connect pipeline. Each step returns an enriched copy.
 *
 * @param tenantId tenant being connected
 * @param owner manager running the pipeline
 * @param tenant loaded by {@link GetTenant}
 * @param connection opened by {@link CheckConnection}
 * @param monitor liveness monitor armed by {@link CheckConnection}
 */
public record ConnectContext(
    String tenantId,
    ConnectionManager owner,
    Tenant tenant,
    TenantDatabaseConnection connection,
    ConnectionMonitor monitor) {

  public static ConnectContext initial(String tenantId, ConnectionManager owner) {
    return new ConnectContext(tenantId, owner, null, null, null);
  }

  public ConnectContext withTenant(Tenant loaded) {
    return new ConnectContext(tenantId, owner, loaded, connection, monitor);
  }

  public ConnectContext withConnection(
      TenantDatabaseConnection opened, ConnectionMonitor armed) {
    return new ConnectContext(tenantId, owner, tenant, opened, armed);
  }
}
