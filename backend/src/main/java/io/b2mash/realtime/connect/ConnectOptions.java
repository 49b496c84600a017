package io.b2mash.realtime.connect;

import io.b2mash.realtime.config.RealtimeProperties;
import java.time.Duration;

/**
 * Per-call overrides for a connection attempt. A null field falls back to the configured default.
 */
public record ConnectOptions(Duration rpcTimeout, Duration checkConnectedUserInterval) {

  public static ConnectOptions defaults() {
    return new ConnectOptions(null, null);
  }

  public ConnectOptions withRpcTimeout(Duration timeout) {
    return new ConnectOptions(timeout, checkConnectedUserInterval);
  }

  public ConnectOptions withCheckConnectedUserInterval(Duration interval) {
    return new ConnectOptions(rpcTimeout, interval);
  }

  /** Fills every unset field from configuration. */
  public ConnectOptions resolve(RealtimeProperties.Connect defaults) {
    return new ConnectOptions(
        rpcTimeout != null ? rpcTimeout : defaults.rpcTimeout(),
        checkConnectedUserInterval != null
            ? checkConnectedUserInterval
            : defaults.checkConnectedUserInterval());
  }
}
