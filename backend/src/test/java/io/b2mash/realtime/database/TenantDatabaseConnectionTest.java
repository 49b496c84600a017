package io.b2mash.realtime.database;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.zaxxer.hikari.HikariDataSource;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TenantDatabaseConnectionTest {

  private ExecutorService closeExecutor;
  private HikariDataSource dataSource;
  private TenantDatabaseConnection connection;

  @BeforeEach
  void setUp() {
    closeExecutor = Executors.newSingleThreadExecutor(task -> new Thread(task, "close-worker"));
    dataSource = mock(HikariDataSource.class);
    connection = new TenantDatabaseConnection("t1", "node-1", dataSource, closeExecutor);
  }

  @AfterEach
  void tearDown() {
    closeExecutor.shutdownNow();
  }

  @Test
  void stop_closesPoolOnTheGivenExecutor() {
    var closedOn = new AtomicReference<String>();
    doAnswer(
            invocation -> {
              closedOn.set(Thread.currentThread().getName());
              return null;
            })
        .when(dataSource)
        .close();

    assertThat(connection.stop(Duration.ofSeconds(1))).isTrue();

    assertThat(closedOn.get()).isEqualTo("close-worker");
  }

  @Test
  void stop_givesUpOnAHangingClose() throws Exception {
    var release = new CountDownLatch(1);
    doAnswer(
            invocation -> {
              release.await();
              return null;
            })
        .when(dataSource)
        .close();

    assertThat(connection.stop(Duration.ofMillis(50))).isFalse();
    release.countDown();
  }

  @Test
  void stop_skipsAClosedPool() {
    when(dataSource.isClosed()).thenReturn(true);

    assertThat(connection.stop(Duration.ofSeconds(1))).isTrue();

    verify(dataSource, never()).close();
  }
}
