package io.b2mash.realtime.database;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.b2mash.realtime.config.RealtimeProperties;
import io.b2mash.realtime.exception.ConnectError;
import io.b2mash.realtime.exception.TenantConnectionException;
import io.b2mash.realtime.tenant.Tenant;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/** Opens tenant database pools after checking the database can take them. */
@Component
public class DatabaseConnector {

  private static final Logger log = LoggerFactory.getLogger(DatabaseConnector.class);

  /** Application name of every connection this service opens to a tenant database. */
  public static final String APPLICATION_NAME = "realtime_connect";

  static final String TOO_MANY_CONNECTIONS_SQLSTATE = "53300";

  // Slots reserved for superusers and background workers are not available to a tenant pool
  static final String CAPACITY_SQL =
      """
      SELECT current_setting('max_connections')::int
               - current_setting('superuser_reserved_connections')::int AS max_connections,
             (SELECT count(*) FROM pg_stat_activity
               WHERE backend_type = 'client backend') AS used_connections
      """;

  private final String node;
  private final Executor closeExecutor;

  public DatabaseConnector(
      RealtimeProperties properties, @Qualifier("connectExecutor") Executor closeExecutor) {
    this.node = properties.cluster().nodeName();
    this.closeExecutor = closeExecutor;
  }

  /**
   * Fails with {@link ConnectError#TOO_MANY_CONNECTIONS} if opening the tenant's pool would push
   * the database past {@code max_connections}.
   */
  public void checkCapacity(Tenant tenant) {
    var settings = tenant.database();
    try (var connection =
            DriverManager.getConnection(settings.jdbcUrl(), capacityCheckProperties(settings));
        var statement = connection.createStatement();
        var rs = statement.executeQuery(CAPACITY_SQL)) {
      rs.next();
      int max = rs.getInt("max_connections");
      int used = rs.getInt("used_connections");
      if (used + tenant.dbPoolSize() > max) {
        throw new TenantConnectionException(
            ConnectError.TOO_MANY_CONNECTIONS,
            "Tenant database %s uses %d of %d connections, pool needs %d"
                .formatted(settings.name(), used, max, tenant.dbPoolSize()));
      }
    } catch (SQLException e) {
      throw translate(tenant, e);
    }
  }

  /** Opens the tenant's pool. The first connection is established eagerly. */
  public TenantDatabaseConnection open(Tenant tenant) {
    var settings = tenant.database();
    var config = new HikariConfig();
    config.setPoolName("tenant-" + tenant.externalId());
    config.setJdbcUrl(settings.jdbcUrl());
    config.setUsername(settings.user());
    config.setPassword(settings.password());
    config.setMaximumPoolSize(tenant.dbPoolSize());
    config.setMinimumIdle(1);
    config.setInitializationFailTimeout(1);
    config.addDataSourceProperty("ApplicationName", APPLICATION_NAME);
    try {
      var dataSource = new HikariDataSource(config);
      log.info(
          "Opened pool of {} connections to tenant {}", tenant.dbPoolSize(), tenant.externalId());
      return new TenantDatabaseConnection(
          tenant.externalId(), node, dataSource, closeExecutor);
    } catch (RuntimeException e) {
      if (e.getCause() instanceof SQLException sqlException) {
        throw translate(tenant, sqlException);
      }
      throw new TenantConnectionException(
          ConnectError.UNAVAILABLE,
          "Failed to open pool to tenant " + tenant.externalId(),
          e);
    }
  }

  private static Properties capacityCheckProperties(Tenant.DatabaseSettings settings) {
    var props = new Properties();
    props.setProperty("user", settings.user());
    props.setProperty("password", settings.password());
    props.setProperty("ApplicationName", APPLICATION_NAME);
    props.setProperty("connectTimeout", "5");
    return props;
  }

  private static TenantConnectionException translate(Tenant tenant, SQLException e) {
    if (TOO_MANY_CONNECTIONS_SQLSTATE.equals(e.getSQLState())) {
      return new TenantConnectionException(
          ConnectError.TOO_MANY_CONNECTIONS,
          "Tenant database " + tenant.database().name() + " refused the connection",
          e);
    }
    return new TenantConnectionException(
        ConnectError.UNAVAILABLE,
        "Cannot reach database of tenant " + tenant.externalId() + ": " + e.getMessage(),
        e);
  }
}
