package io.b2mash.realtime.cluster;

import io.b2mash.realtime.config.RealtimeProperties;
import io.b2mash.realtime.tenant.Tenant;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Picks the node that should own a tenant's connection. Uses rendezvous hashing so that adding or
 * removing a node only moves the tenants that node wins or loses.
 */
@Component
public class NodeAssignment {

  private final ClusterNode self;
  private final List<ClusterNode> nodes;

  public NodeAssignment(RealtimeProperties properties) {
    var cluster = properties.cluster();
    this.self = new ClusterNode(cluster.nodeName(), cluster.nodeUrl());
    var members = new ArrayList<ClusterNode>();
    members.add(self);
    if (cluster.nodes() != null) {
      cluster.nodes().forEach(
          (name, url) -> {
            if (!name.equals(self.name())) {
              members.add(new ClusterNode(name, url));
            }
          });
    }
    members.sort(Comparator.comparing(ClusterNode::name));
    this.nodes = List.copyOf(members);
  }

  public ClusterNode self() {
    return self;
  }

  public List<ClusterNode> nodes() {
    return nodes;
  }

  public ClusterNode nodeForTenant(Tenant tenant) {
    return nodeForTenant(tenant.externalId());
  }

  ClusterNode nodeForTenant(String tenantId) {
    ClusterNode winner = null;
    long best = Long.MIN_VALUE;
    for (var node : nodes) {
      long score = score(node.name(), tenantId);
      if (winner == null || score > best) {
        winner = node;
        best = score;
      }
    }
    return winner;
  }

  public boolean isLocal(ClusterNode node) {
    return self.name().equals(node.name());
  }

  public Optional<ClusterNode> findNode(String name) {
    return nodes.stream().filter(node -> node.name().equals(name)).findFirst();
  }

  static long score(String nodeName, String tenantId) {
    long hash = 0xcbf29ce484222325L;
    for (byte b : (nodeName + '\0' + tenantId).getBytes(StandardCharsets.UTF_8)) {
      hash ^= b & 0xff;
      hash *= 0x100000001b3L;
    }
    // fmix64
    hash ^= hash >>> 33;
    hash *= 0xff51afd7ed558ccdL;
    hash ^= hash >>> 33;
    hash *= 0xc4ceb9fe1a85ec53L;
    hash ^= hash >>> 33;
    return hash;
  }
}
