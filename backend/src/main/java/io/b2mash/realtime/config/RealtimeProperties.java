package io.b2mash.realtime.config;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Configuration for tenant connection management.
 *
 * @param connect per-connection defaults, overridable per call through {@code ConnectOptions}
 * @param cluster identity of this node, its peers and the registry backing
 */
@ConfigurationProperties(prefix = "realtime")
public record RealtimeProperties(@DefaultValue Connect connect, @DefaultValue Cluster cluster) {

  /**
   * @param rpcTimeout timeout for a forwarded connect call to another node
   * @param checkConnectedUserInterval how often a ready connection samples its connected users
   * @param initializingBackoff wait before retrying when another caller is mid-initialization
   * @param childShutdownTimeout grace period for stopping the connection and each child
   * @param livenessCheckInterval how often the database connection is validated
   * @param childPollInterval how often replication and listener children poll the database
   * @param tenantCacheTtl staleness tolerated on the fast-path tenant lookup
   */
  public record Connect(
      @DefaultValue("30s") Duration rpcTimeout,
      @DefaultValue("50s") Duration checkConnectedUserInterval,
      @DefaultValue("100ms") Duration initializingBackoff,
      @DefaultValue("500ms") Duration childShutdownTimeout,
      @DefaultValue("5s") Duration livenessCheckInterval,
      @DefaultValue("100ms") Duration childPollInterval,
      @DefaultValue("30s") Duration tenantCacheTtl) {}

  /**
   * @param nodeName name of this node; must match a key of {@code nodes} when peers are listed
   * @param nodeUrl base URL peers use to reach this node
   * @param nodes all cluster members by name, including this one
   * @param registry {@code local} for a single-node registry, {@code cluster} for the lease table
   * @param leaseTtl how long a connection claim survives without a heartbeat
   */
  public record Cluster(
      @DefaultValue("node-1") String nodeName,
      @DefaultValue("http://localhost:8080") URI nodeUrl,
      Map<String, URI> nodes,
      @DefaultValue("local") String registry,
      @DefaultValue("15s") Duration leaseTtl) {}
}
