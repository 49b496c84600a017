package io.b2mash.realtime.database;

import com.zaxxer.hikari.HikariDataSource;
import io.b2mash.realtime.connect.ConnectionHandle;
import java.sql.SQLException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Connection pool to one tenant database, owned by that tenant's connection manager. */
public class TenantDatabaseConnection implements ConnectionHandle {

  private static final Logger log = LoggerFactory.getLogger(TenantDatabaseConnection.class);

  private final String tenantId;
  private final String node;
  private final HikariDataSource dataSource;
  private final Executor closeExecutor;

  public TenantDatabaseConnection(
      String tenantId, String node, HikariDataSource dataSource, Executor closeExecutor) {
    this.tenantId = tenantId;
    this.node = node;
    this.dataSource = dataSource;
    this.closeExecutor = closeExecutor;
  }

  @Override
  public String tenantId() {
    return tenantId;
  }

  @Override
  public String node() {
    return node;
  }

  @Override
  public boolean isLocal() {
    return true;
  }

  public DataSource dataSource() {
    return dataSource;
  }

  /** Validates one pooled connection against the database. */
  public boolean isAlive() {
    if (dataSource.isClosed()) {
      return false;
    }
    try (var connection = dataSource.getConnection()) {
      return connection.isValid(1);
    } catch (SQLException e) {
      log.debug("Liveness check failed for tenant {}: {}", tenantId, e.getMessage());
      return false;
    }
  }

  /**
   * Closes the pool, waiting at most {@code timeout} for it.
   *
   * @return true if the pool closed within the timeout
   */
  public boolean stop(Duration timeout) {
    if (dataSource.isClosed()) {
      return true;
    }
    var closing = CompletableFuture.runAsync(dataSource::close, closeExecutor);
    try {
      closing.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      return true;
    } catch (TimeoutException e) {
      log.warn("Pool of tenant {} did not close within {}", tenantId, timeout);
      return false;
    } catch (ExecutionException e) {
      log.warn("Failed to close pool of tenant {}", tenantId, e.getCause());
      return false;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  @Override
  public String toString() {
    return "TenantDatabaseConnection[tenantId=" + tenantId + ", node=" + node + "]";
  }
}
