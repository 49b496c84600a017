package io.b2mash.realtime.connect;

import static io.b2mash.realtime.TestFixtures.connection;
import static io.b2mash.realtime.TestFixtures.tenant;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.b2mash.realtime.TestFixtures;
import io.b2mash.realtime.cluster.NodeAssignment;
import io.b2mash.realtime.cluster.NodeClient;
import io.b2mash.realtime.connect.pipeline.ConnectStep;
import io.b2mash.realtime.connect.pipeline.RegisterProcess;
import io.b2mash.realtime.connect.registry.LocalTenantRegistry;
import io.b2mash.realtime.counter.ConnectedUsersCounter;
import io.b2mash.realtime.counter.TenantRateCounters;
import io.b2mash.realtime.migration.TenantMigrations;
import io.b2mash.realtime.replication.ChildProcess;
import io.b2mash.realtime.tenant.TenantCache;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/** Many callers racing for one tenant against real managers. */
class ConnectServiceConcurrencyTest {

  private static final String TENANT_ID = "tenant-race";
  private static final int CALLERS = 16;

  private ExecutorService managerExecutor;
  private ExecutorService callers;
  private ThreadPoolTaskScheduler scheduler;
  private LocalTenantRegistry registry;
  private AtomicInteger pipelineRuns;
  private ConnectService service;

  @BeforeEach
  void setUp() {
    managerExecutor = Executors.newCachedThreadPool();
    callers = Executors.newFixedThreadPool(CALLERS);
    scheduler = new ThreadPoolTaskScheduler();
    scheduler.initialize();
    registry = new LocalTenantRegistry(TestFixtures.NODE);
    pipelineRuns = new AtomicInteger();

    var properties = TestFixtures.properties();
    var connection = connection(TENANT_ID);
    List<ConnectStep> steps =
        List.of(
            context -> {
              pipelineRuns.incrementAndGet();
              sleep(50);
              return context.withTenant(tenant(TENANT_ID));
            },
            context -> context.withConnection(connection, null),
            new RegisterProcess(registry));
    var factory =
        new ConnectionManagerFactory(
            new ConnectionManagerDependencies(
                TestFixtures.NODE,
                registry,
                steps,
                mock(TenantMigrations.class),
                (tenant, owner) -> mock(ChildProcess.class),
                (tenant, owner) -> mock(ChildProcess.class),
                new ConnectedUsersCounter(),
                new TenantRateCounters(),
                new TenantOperationsTopic(),
                managerExecutor,
                scheduler,
                Duration.ofMillis(500)));

    var tenantCache = mock(TenantCache.class);
    when(tenantCache.getTenant(TENANT_ID)).thenReturn(Optional.of(tenant(TENANT_ID)));
    service =
        new ConnectService(
            registry,
            factory,
            tenantCache,
            new NodeAssignment(properties),
            mock(NodeClient.class),
            mock(ApplicationEventPublisher.class),
            properties);
  }

  @AfterEach
  void tearDown() {
    callers.shutdownNow();
    scheduler.shutdown();
    managerExecutor.shutdownNow();
  }

  @Test
  void concurrentCallers_shareOneOwnerAndOneHandle() throws Exception {
    var start = new CountDownLatch(1);
    var results = new ArrayList<Future<ConnectionHandle>>();
    for (int i = 0; i < CALLERS; i++) {
      Callable<ConnectionHandle> call =
          () -> {
            start.await();
            return service.lookupOrStartConnection(TENANT_ID);
          };
      results.add(callers.submit(call));
    }

    start.countDown();

    var first = results.get(0).get(10, TimeUnit.SECONDS);
    for (var result : results) {
      assertThat(result.get(10, TimeUnit.SECONDS)).isSameAs(first);
    }
    assertThat(pipelineRuns).hasValue(1);
    assertThat(registry.localTenants()).containsExactly(TENANT_ID);
  }

  private static void sleep(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException(e);
    }
  }
}
