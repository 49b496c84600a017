package io.b2mash.realtime.connect;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ConnectResponse(String tenantId, String node, ConnectionStatus.State status) {

  public static ConnectResponse of(String tenantId, String node, ConnectionStatus status) {
    return new ConnectResponse(tenantId, node, status.state());
  }
}
