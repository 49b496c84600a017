package io.b2mash.realtime.config;

import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class FlywayConfig {

  @Bean(initMethod = "migrate")
  public Flyway globalFlyway(@Qualifier("appDataSource") DataSource appDataSource) {
    return Flyway.configure()
        .dataSource(appDataSource)
        .locations("classpath:db/migration/global")
        .schemas("public")
        .baselineOnMigrate(true)
        .load();
  }
}
