package io.b2mash.realtime.database;

import static io.b2mash.realtime.TestFixtures.connection;
import static io.b2mash.realtime.TestFixtures.pool;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

class ConnectionMonitorTest {

  private final List<ConnectionMonitor> downs = new CopyOnWriteArrayList<>();
  private final CompletableFuture<ConnectionMonitor> firstDown = new CompletableFuture<>();
  private ThreadPoolTaskScheduler scheduler;

  @BeforeEach
  void setUp() {
    scheduler = new ThreadPoolTaskScheduler();
    scheduler.initialize();
  }

  @AfterEach
  void tearDown() {
    scheduler.shutdown();
  }

  @Test
  void closedPool_isReportedOnce() throws Exception {
    var connection = connection("t1");
    when(pool(connection).isClosed()).thenReturn(true);

    var monitor =
        ConnectionMonitor.watch(scheduler, connection, Duration.ofMillis(20), this::onDown);

    assertThat(firstDown.get(5, TimeUnit.SECONDS)).isSameAs(monitor);
    Thread.sleep(100);
    assertThat(downs).containsExactly(monitor);
  }

  @Test
  void failingConnection_isReported() throws Exception {
    var connection = connection("t1");
    when(pool(connection).getConnection()).thenThrow(new SQLException("refused"));

    ConnectionMonitor.watch(scheduler, connection, Duration.ofMillis(20), this::onDown);

    assertThat(firstDown.get(5, TimeUnit.SECONDS)).isNotNull();
  }

  @Test
  void cancelledMonitor_neverReports() throws Exception {
    var connection = connection("t1");
    when(pool(connection).isClosed()).thenReturn(true);

    var monitor =
        ConnectionMonitor.watch(scheduler, connection, Duration.ofMillis(50), this::onDown);
    monitor.cancel();

    Thread.sleep(200);
    assertThat(downs).isEmpty();
  }

  private void onDown(ConnectionMonitor monitor) {
    downs.add(monitor);
    firstDown.complete(monitor);
  }
}
