package io.b2mash.realtime.connect.pipeline;

/**
 * One stage of the connect pipeline. A stage fails by throwing {@link
 * io.b2mash.realtime.exception.TenantConnectionException}.
 */
@FunctionalInterface
public interface ConnectStep {

  ConnectContext apply(ConnectContext context);
}
