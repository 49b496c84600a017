package io.b2mash.realtime.connect.registry;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Optional;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

/**
 * Lease table backing {@link ClusterTenantRegistry}. A claim is live while its lease has not
 * expired; an expired claim belongs to a node that stopped heartbeating and may be taken over.
 */
@Repository
public class ConnectionClaimRepository {

  private final JdbcClient jdbc;

  public ConnectionClaimRepository(JdbcClient jdbc) {
    this.jdbc = jdbc;
  }

  /**
   * Inserts a claim for {@code node}, or takes over an expired one. A stale claim held by the same
   * node is also replaced, since that node has no live owner for it.
   *
   * @return true if {@code node} now holds the claim
   */
  public boolean tryClaim(String tenantId, String node, Duration leaseTtl) {
    int rows =
        jdbc.sql(
                """
                INSERT INTO tenant_connection_claims
                    (tenant_id, node, connected, claimed_at, lease_expires_at)
                VALUES (?, ?, false, now(), now() + make_interval(secs => ?))
                ON CONFLICT (tenant_id)
                DO UPDATE SET node = EXCLUDED.node,
                              connected = false,
                              claimed_at = now(),
                              lease_expires_at = EXCLUDED.lease_expires_at
                WHERE tenant_connection_claims.lease_expires_at < now()
                   OR tenant_connection_claims.node = EXCLUDED.node
                """)
            .params(tenantId, node, seconds(leaseTtl))
            .update();
    return rows == 1;
  }

  public Optional<ConnectionClaim> findLive(String tenantId) {
    return jdbc.sql(
            """
            SELECT tenant_id, node, connected, lease_expires_at
            FROM tenant_connection_claims
            WHERE tenant_id = ? AND lease_expires_at >= now()
            """)
        .param(tenantId)
        .query(ConnectionClaimRepository::mapClaim)
        .optional();
  }

  public void markConnected(String tenantId, String node, boolean connected) {
    jdbc.sql(
            """
            UPDATE tenant_connection_claims
            SET connected = ?
            WHERE tenant_id = ? AND node = ?
            """)
        .params(connected, tenantId, node)
        .update();
  }

  /** Extends the lease of a claim still held by {@code node}. */
  public boolean renew(String tenantId, String node, Duration leaseTtl) {
    int rows =
        jdbc.sql(
                """
                UPDATE tenant_connection_claims
                SET lease_expires_at = now() + make_interval(secs => ?)
                WHERE tenant_id = ? AND node = ?
                """)
            .params(seconds(leaseTtl), tenantId, node)
            .update();
    return rows == 1;
  }

  public void release(String tenantId, String node) {
    jdbc.sql("DELETE FROM tenant_connection_claims WHERE tenant_id = ? AND node = ?")
        .params(tenantId, node)
        .update();
  }

  /** Drops every claim of {@code node}; used when the node starts with no live owners. */
  public int releaseAll(String node) {
    return jdbc.sql("DELETE FROM tenant_connection_claims WHERE node = ?").param(node).update();
  }

  private static double seconds(Duration duration) {
    return duration.toMillis() / 1000.0;
  }

  private static ConnectionClaim mapClaim(ResultSet rs, int rowNum) throws SQLException {
    return new ConnectionClaim(
        rs.getString("tenant_id"),
        rs.getString("node"),
        rs.getBoolean("connected"),
        rs.getTimestamp("lease_expires_at").toInstant());
  }
}
