package io.b2mash.realtime.connect.pipeline;

import io.b2mash.realtime.connect.registry.ConnectionMetadata;
import io.b2mash.realtime.connect.registry.TenantRegistry;
import io.b2mash.realtime.exception.ConnectError;
import io.b2mash.realtime.exception.TenantConnectionException;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Publishes the established connection in the owner's registry entry. */
@Component
@Order(4)
public class RegisterProcess implements ConnectStep {

  private final TenantRegistry registry;

  public RegisterProcess(TenantRegistry registry) {
    this.registry = registry;
  }

  @Override
  public ConnectContext apply(ConnectContext context) {
    var connection = context.connection();
    boolean updated =
        registry.updateMetadata(
            context.tenantId(), context.owner(), current -> new ConnectionMetadata(connection));
    if (!updated) {
      throw new TenantConnectionException(
          ConnectError.UNAVAILABLE,
          "Registry entry of tenant " + context.tenantId() + " is no longer held by this owner");
    }
    return context;
  }
}
