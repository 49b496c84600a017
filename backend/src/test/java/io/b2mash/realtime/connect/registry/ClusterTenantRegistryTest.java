package io.b2mash.realtime.connect.registry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.realtime.connect.ConnectionManager;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ClusterTenantRegistryTest {

  private static final Duration LEASE = Duration.ofSeconds(15);

  private ConnectionClaimRepository claims;
  private ClusterTenantRegistry registry;
  private ConnectionManager owner;

  @BeforeEach
  void setUp() {
    claims = mock(ConnectionClaimRepository.class);
    registry =
        new ClusterTenantRegistry(new LocalTenantRegistry("node-a"), claims, "node-a", LEASE);
    owner = mock(ConnectionManager.class);
    when(claims.tryClaim(anyString(), eq("node-a"), any())).thenReturn(true);
  }

  @Test
  void lostRenewal_terminatesOwnerAndDropsLocalEntry() {
    registry.registerIfAbsent("t1", owner);
    when(claims.renew("t1", "node-a", LEASE)).thenReturn(false);

    registry.renewLeases();

    verify(owner).claimLost();
    assertThat(registry.localOwners()).isEmpty();
    // The claim now belongs to whoever took it over
    registry.unregister("t1", owner);
    verify(claims, never()).release("t1", "node-a");
  }

  @Test
  void successfulRenewal_keepsOwner() {
    registry.registerIfAbsent("t1", owner);
    when(claims.renew("t1", "node-a", LEASE)).thenReturn(true);

    registry.renewLeases();

    verify(owner, never()).claimLost();
    assertThat(registry.localOwners()).containsExactly(owner);
  }

  @Test
  void renewLeases_skipsReleasedClaims() {
    registry.registerIfAbsent("t1", owner);
    registry.unregister("t1", owner);

    registry.renewLeases();

    verify(claims).release("t1", "node-a");
    verify(claims, never()).renew(anyString(), anyString(), any());
  }
}
