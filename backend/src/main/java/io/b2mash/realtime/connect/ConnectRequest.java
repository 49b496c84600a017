package io.b2mash.realtime.connect;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.Positive;
import java.time.Duration;

/** Overrides a peer forwards with a connect call. Absent fields use this node's defaults. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ConnectRequest(
    @Positive Long rpcTimeoutMs, @Positive Long checkConnectedUserIntervalMs) {

  public static ConnectRequest from(ConnectOptions options) {
    return new ConnectRequest(
        options.rpcTimeout() != null ? options.rpcTimeout().toMillis() : null,
        options.checkConnectedUserInterval() != null
            ? options.checkConnectedUserInterval().toMillis()
            : null);
  }

  public ConnectOptions toOptions() {
    return new ConnectOptions(
        rpcTimeoutMs != null ? Duration.ofMillis(rpcTimeoutMs) : null,
        checkConnectedUserIntervalMs != null
            ? Duration.ofMillis(checkConnectedUserIntervalMs)
            : null);
  }
}
