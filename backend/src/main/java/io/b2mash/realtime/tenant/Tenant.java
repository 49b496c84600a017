package io.b2mash.realtime.tenant;

/**
 * Read-only snapshot of a tenant's configuration. Fetched fresh on every connection attempt so
 * suspension and limit changes apply on the next connect.
 *
 * @param externalId tenant identifier, the registry key
 * @param suspended whether the tenant may hold a database connection
 * @param database connection settings of the tenant database
 * @param dbPoolSize number of database connections the tenant's pool opens
 * @param maxConcurrentUsers connected-client ceiling enforced by the broadcast layer
 * @param maxEventsPerSecond ceiling for the tenant's database event rate counter
 */
public record Tenant(
    String externalId,
    boolean suspended,
    DatabaseSettings database,
    int dbPoolSize,
    int maxConcurrentUsers,
    int maxEventsPerSecond) {

  public record DatabaseSettings(
      String host, int port, String name, String user, String password, boolean sslEnforced) {

    public String jdbcUrl() {
      var url = "jdbc:postgresql://" + host + ":" + port + "/" + name;
      return sslEnforced ? url + "?sslmode=require" : url;
    }

    @Override
    public String toString() {
      return "DatabaseSettings[host=" + host + ", port=" + port + ", name=" + name + "]";
    }
  }
}
