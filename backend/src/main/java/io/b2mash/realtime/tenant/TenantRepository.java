package io.b2mash.realtime.tenant;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

@Repository
public class TenantRepository {

  private final JdbcClient jdbc;

  public TenantRepository(JdbcClient jdbc) {
    this.jdbc = jdbc;
  }

  public Optional<Tenant> findByExternalId(String externalId) {
    return jdbc.sql(
            """
            SELECT external_id, suspended, db_host, db_port, db_name, db_user, db_password,
                   ssl_enforced, db_pool_size, max_concurrent_users, max_events_per_second
            FROM tenants
            WHERE external_id = ?
            """)
        .param(externalId)
        .query(TenantRepository::mapTenant)
        .optional();
  }

  private static Tenant mapTenant(ResultSet rs, int rowNum) throws SQLException {
    return new Tenant(
        rs.getString("external_id"),
        rs.getBoolean("suspended"),
        new Tenant.DatabaseSettings(
            rs.getString("db_host"),
            rs.getInt("db_port"),
            rs.getString("db_name"),
            rs.getString("db_user"),
            rs.getString("db_password"),
            rs.getBoolean("ssl_enforced")),
        rs.getInt("db_pool_size"),
        rs.getInt("max_concurrent_users"),
        rs.getInt("max_events_per_second"));
  }
}
