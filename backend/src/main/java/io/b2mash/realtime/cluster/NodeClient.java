package io.b2mash.realtime.cluster;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.b2mash.realtime.connect.ConnectOptions;
import io.b2mash.realtime.connect.ConnectRequest;
import io.b2mash.realtime.connect.ConnectResponse;
import io.b2mash.realtime.connect.ConnectionHandle;
import io.b2mash.realtime.connect.RemoteConnectionHandle;
import io.b2mash.realtime.exception.ConnectError;
import io.b2mash.realtime.exception.TenantConnectionException;
import java.io.IOException;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Calls the internal API of other cluster nodes. Typed connect failures of the peer are rebuilt
 * from the {@code reason} property of its problem response; everything else is an {@link
 * ConnectError#RPC_ERROR}.
 */
@Component
public class NodeClient {

  private static final Logger log = LoggerFactory.getLogger(NodeClient.class);

  static final String API_KEY_HEADER = "X-API-KEY";
  private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);
  private static final Duration MAX_CONNECT_TIMEOUT = Duration.ofSeconds(5);
  private static final Duration MAX_PEER_MARGIN = Duration.ofSeconds(1);

  private final String apiKey;
  private final ObjectMapper objectMapper;
  private final Map<Duration, RestClient> clients = new ConcurrentHashMap<>();

  public NodeClient(@Value("${internal.api.key}") String apiKey, ObjectMapper objectMapper) {
    this.apiKey = apiKey;
    this.objectMapper = objectMapper;
  }

  /**
   * Asks {@code node} to connect the tenant locally.
   *
   * @throws TenantConnectionException with the peer's reason, or {@link ConnectError#RPC_ERROR}
   *     when the peer could not be reached in time
   */
  public ConnectionHandle connect(ClusterNode node, String tenantId, ConnectOptions options) {
    var timeout = options.rpcTimeout();
    long started = System.nanoTime();
    try {
      var response =
          client(timeout)
              .post()
              .uri(endpoint(node, "/internal/tenants/{tenantId}/connect"), tenantId)
              .contentType(MediaType.APPLICATION_JSON)
              .body(ConnectRequest.from(options.withRpcTimeout(peerTimeout(timeout))))
              .retrieve()
              .onStatus(
                  HttpStatusCode::isError,
                  (request, errorResponse) -> {
                    throw toConnectException(node, tenantId, errorResponse);
                  })
              .body(ConnectResponse.class);
      log.debug(
          "Connect of tenant {} on node {} took {} ms",
          tenantId,
          node.name(),
          elapsedMillis(started));
      var owner = response != null && response.node() != null ? response.node() : node.name();
      return new RemoteConnectionHandle(owner, tenantId);
    } catch (RestClientException e) {
      log.warn(
          "Connect of tenant {} on node {} failed after {} ms: {}",
          tenantId,
          node.name(),
          elapsedMillis(started),
          e.getMessage());
      throw new TenantConnectionException(
          ConnectError.RPC_ERROR,
          "Call to node " + node.name() + " failed: " + e.getMessage(),
          e);
    }
  }

  /** Asks {@code node} to stop the tenant's connection. Failures are logged, not thrown. */
  public void shutdown(ClusterNode node, String tenantId) {
    try {
      client(SHUTDOWN_TIMEOUT)
          .delete()
          .uri(endpoint(node, "/internal/tenants/{tenantId}/connection"), tenantId)
          .retrieve()
          .toBodilessEntity();
    } catch (RestClientException e) {
      log.warn(
          "Shutdown of tenant {} on node {} failed: {}", tenantId, node.name(), e.getMessage());
    }
  }

  /** Forwards a suspension to the node owning the tenant. Failures are logged, not thrown. */
  public void suspend(ClusterNode node, String tenantId) {
    try {
      client(SHUTDOWN_TIMEOUT)
          .post()
          .uri(endpoint(node, "/internal/tenants/{tenantId}/suspend"), tenantId)
          .retrieve()
          .toBodilessEntity();
    } catch (RestClientException e) {
      log.warn(
          "Suspend of tenant {} on node {} failed: {}", tenantId, node.name(), e.getMessage());
    }
  }

  private RestClient client(Duration timeout) {
    return clients.computeIfAbsent(timeout, this::buildClient);
  }

  private RestClient buildClient(Duration timeout) {
    var connectTimeout =
        timeout.compareTo(MAX_CONNECT_TIMEOUT) < 0 ? timeout : MAX_CONNECT_TIMEOUT;
    var httpClient = HttpClient.newBuilder().connectTimeout(connectTimeout).build();
    var requestFactory = new JdkClientHttpRequestFactory(httpClient);
    requestFactory.setReadTimeout(timeout);
    return RestClient.builder()
        .requestFactory(requestFactory)
        .defaultHeader(API_KEY_HEADER, apiKey)
        .build();
  }

  private TenantConnectionException toConnectException(
      ClusterNode node, String tenantId, ClientHttpResponse response) throws IOException {
    var status = response.getStatusCode();
    var body = objectMapper.readTree(response.getBody());
    var reason = body.path("reason").asText(null);
    var detail = body.path("detail").asText("Node " + node.name() + " answered " + status);
    if (reason != null) {
      try {
        return new TenantConnectionException(ConnectError.valueOf(reason), detail);
      } catch (IllegalArgumentException e) {
        log.warn(
            "Node {} answered unknown reason {} for tenant {}", node.name(), reason, tenantId);
      }
    }
    return new TenantConnectionException(
        ConnectError.RPC_ERROR, "Node " + node.name() + " answered " + status + ": " + detail);
  }

  private static String endpoint(ClusterNode node, String path) {
    var base = node.url().toString();
    return (base.endsWith("/") ? base.substring(0, base.length() - 1) : base) + path;
  }

  private static long elapsedMillis(long startedNanos) {
    return Duration.ofNanos(System.nanoTime() - startedNanos).toMillis();
  }

  /**
   * How long the peer may wait for its owner. Shorter than the read timeout of the call, so a slow
   * owner comes back as the peer's {@link ConnectError#CONNECTION_INITIALIZING} instead of a
   * timed-out call.
   */
  static Duration peerTimeout(Duration timeout) {
    var margin = timeout.dividedBy(10);
    return timeout.minus(margin.compareTo(MAX_PEER_MARGIN) > 0 ? MAX_PEER_MARGIN : margin);
  }
}
