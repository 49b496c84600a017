package io.b2mash.realtime;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.testcontainers.service.connection.ServiceConnection;
import org.springframework.context.annotation.Bean;
import org.springframework.test.context.DynamicPropertyRegistrar;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.images.builder.Transferable;
import org.testcontainers.utility.DockerImageName;

/**
 * One Postgres serving as control plane and as tenant database. Logical WAL is enabled so
 * replication can start against it.
 */
@TestConfiguration(proxyBeanMethods = false)
public class TestcontainersConfiguration {

  // The image only trusts replication connections from inside the container
  private static final String ALLOW_REPLICATION =
      "echo 'host replication all all scram-sha-256' >> \"$PGDATA/pg_hba.conf\"\n";

  @SuppressWarnings("resource")
  @Bean
  @ServiceConnection
  PostgreSQLContainer<?> postgresContainer() {
    return new PostgreSQLContainer<>(DockerImageName.parse("postgres:16-alpine"))
        .withCommand("postgres", "-c", "wal_level=logical", "-c", "max_wal_senders=10")
        .withCopyToContainer(
            Transferable.of(ALLOW_REPLICATION, 0755),
            "/docker-entrypoint-initdb.d/10-allow-replication.sh");
  }

  @Bean
  DynamicPropertyRegistrar datasourceProperties(PostgreSQLContainer<?> container) {
    return registry -> {
      registry.add("spring.datasource.app.jdbc-url", container::getJdbcUrl);
      registry.add("spring.datasource.app.username", container::getUsername);
      registry.add("spring.datasource.app.password", container::getPassword);
    };
  }
}
