package io.b2mash.realtime.connect.registry;

import io.b2mash.realtime.config.RealtimeProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.DependsOn;

@Configuration
public class RegistryConfig {

  @Bean
  @ConditionalOnProperty(
      name = "realtime.cluster.registry",
      havingValue = "local",
      matchIfMissing = true)
  public TenantRegistry localTenantRegistry(RealtimeProperties properties) {
    return new LocalTenantRegistry(properties.cluster().nodeName());
  }

  @Bean
  @ConditionalOnProperty(name = "realtime.cluster.registry", havingValue = "cluster")
  @DependsOn("globalFlyway")
  public TenantRegistry clusterTenantRegistry(
      RealtimeProperties properties, ConnectionClaimRepository claims) {
    var cluster = properties.cluster();
    var registry =
        new ClusterTenantRegistry(
            new LocalTenantRegistry(cluster.nodeName()),
            claims,
            cluster.nodeName(),
            cluster.leaseTtl());
    registry.releaseStaleClaims();
    return registry;
  }
}
