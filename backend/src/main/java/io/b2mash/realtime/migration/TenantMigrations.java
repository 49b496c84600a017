package io.b2mash.realtime.migration;

import io.b2mash.realtime.database.TenantDatabaseConnection;
import io.b2mash.realtime.tenant.Tenant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import org.flywaydb.core.Flyway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Component;

/**
 * Brings a tenant database up to the schema this service needs: Flyway migrations into the
 * {@code realtime} schema, then the daily partitions of {@code realtime.messages}.
 */
@Component
public class TenantMigrations {

  private static final Logger log = LoggerFactory.getLogger(TenantMigrations.class);

  static final String SCHEMA = "realtime";
  static final int PARTITION_DAYS_AHEAD = 3;

  private static final String PARTITION_SQL =
      "CREATE TABLE IF NOT EXISTS %s.%s PARTITION OF %s.messages"
          + " FOR VALUES FROM ('%s') TO ('%s')";

  private static final DateTimeFormatter PARTITION_SUFFIX =
      DateTimeFormatter.ofPattern("yyyy_MM_dd");

  public void runMigrations(Tenant tenant, TenantDatabaseConnection connection) {
    var result =
        Flyway.configure()
            .dataSource(connection.dataSource())
            .locations("classpath:db/migration/tenant")
            .schemas(SCHEMA)
            .baselineOnMigrate(true)
            .load()
            .migrate();
    log.info(
        "Migrated tenant {}, {} migrations applied",
        tenant.externalId(),
        result.migrationsExecuted);
  }

  public List<String> createPartitions(TenantDatabaseConnection connection) {
    return createPartitions(connection, LocalDate.now(ZoneOffset.UTC));
  }

  /** Creates partitions from the day before {@code today} through three days after it. */
  List<String> createPartitions(TenantDatabaseConnection connection, LocalDate today) {
    var jdbc = JdbcClient.create(connection.dataSource());
    var created = new ArrayList<String>();
    for (var day = today.minusDays(1);
        !day.isAfter(today.plusDays(PARTITION_DAYS_AHEAD));
        day = day.plusDays(1)) {
      var name = partitionName(day);
      jdbc.sql(PARTITION_SQL.formatted(SCHEMA, name, SCHEMA, day, day.plusDays(1))).update();
      created.add(name);
    }
    log.debug("Ensured message partitions {} for tenant {}", created, connection.tenantId());
    return created;
  }

  static String partitionName(LocalDate day) {
    return "messages_" + PARTITION_SUFFIX.format(day);
  }
}
