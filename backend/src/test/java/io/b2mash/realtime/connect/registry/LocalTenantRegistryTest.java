package io.b2mash.realtime.connect.registry;

import static io.b2mash.realtime.TestFixtures.connection;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import io.b2mash.realtime.TestFixtures;
import io.b2mash.realtime.connect.ConnectionManager;
import java.util.ArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class LocalTenantRegistryTest {

  private final LocalTenantRegistry registry = new LocalTenantRegistry(TestFixtures.NODE);

  @Test
  void register_createsInitializingEntry() {
    var owner = mock(ConnectionManager.class);

    var result = registry.registerIfAbsent("t1", owner);

    assertThat(result.registered()).isTrue();
    var entry = registry.lookup("t1").orElseThrow();
    assertThat(entry.owner()).isSameAs(owner);
    assertThat(entry.node()).isEqualTo(TestFixtures.NODE);
    assertThat(entry.metadata().isConnected()).isFalse();
    assertThat(registry.localTenants()).isEmpty();
  }

  @Test
  void secondRegistration_returnsTheExistingOwner() {
    var first = mock(ConnectionManager.class);
    var second = mock(ConnectionManager.class);
    registry.registerIfAbsent("t1", first);

    var result = registry.registerIfAbsent("t1", second);

    assertThat(result.registered()).isFalse();
    assertThat(result.existing().owner()).isSameAs(first);
  }

  @Test
  void updateMetadata_onlyAppliesForTheOwner() {
    var owner = mock(ConnectionManager.class);
    var stranger = mock(ConnectionManager.class);
    var handle = connection("t1");
    registry.registerIfAbsent("t1", owner);

    assertThat(registry.updateMetadata("t1", stranger, m -> new ConnectionMetadata(handle)))
        .isFalse();
    assertThat(registry.lookup("t1").orElseThrow().metadata().isConnected()).isFalse();

    assertThat(registry.updateMetadata("t1", owner, m -> new ConnectionMetadata(handle))).isTrue();
    assertThat(registry.lookup("t1").orElseThrow().metadata().conn()).isSameAs(handle);
    assertThat(registry.localTenants()).containsExactly("t1");
  }

  @Test
  void updateMetadata_forMissingEntryFails() {
    assertThat(
            registry.updateMetadata(
                "t1", mock(ConnectionManager.class), m -> ConnectionMetadata.INITIALIZING))
        .isFalse();
  }

  @Test
  void unregister_ignoresOtherOwners() {
    var owner = mock(ConnectionManager.class);
    registry.registerIfAbsent("t1", owner);

    registry.unregister("t1", mock(ConnectionManager.class));
    assertThat(registry.lookup("t1")).isPresent();

    registry.unregister("t1", owner);
    assertThat(registry.lookup("t1")).isEmpty();
  }

  @Test
  void concurrentRegistrations_haveExactlyOneWinner() throws Exception {
    int contenders = 32;
    var pool = Executors.newFixedThreadPool(contenders);
    try {
      var start = new CountDownLatch(1);
      var results = new ArrayList<Future<RegistrationResult>>();
      for (int i = 0; i < contenders; i++) {
        var owner = mock(ConnectionManager.class);
        results.add(
            pool.submit(
                () -> {
                  start.await();
                  return registry.registerIfAbsent("t1", owner);
                }));
      }
      start.countDown();

      int winners = 0;
      for (var result : results) {
        if (result.get(5, TimeUnit.SECONDS).registered()) {
          winners++;
        }
      }
      assertThat(winners).isEqualTo(1);
    } finally {
      pool.shutdownNow();
    }
  }
}
