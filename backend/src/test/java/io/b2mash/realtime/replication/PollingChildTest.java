package io.b2mash.realtime.replication;

import static org.assertj.core.api.Assertions.assertThat;

import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

class PollingChildTest {

  private final List<Throwable> exits = new CopyOnWriteArrayList<>();
  private final CompletableFuture<Throwable> firstExit = new CompletableFuture<>();
  private ThreadPoolTaskScheduler scheduler;
  private ExecutorService closeExecutor;

  @BeforeEach
  void setUp() {
    scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(2);
    scheduler.initialize();
    closeExecutor = Executors.newSingleThreadExecutor(task -> new Thread(task, "close-worker"));
  }

  @AfterEach
  void tearDown() {
    scheduler.shutdown();
    closeExecutor.shutdownNow();
  }

  @Test
  void failedPoll_reportsExitOnceAndCloses() throws Exception {
    var child = new ScriptedChild(3);
    child.schedule(scheduler, Duration.ofMillis(10));

    assertThat(firstExit.get(5, TimeUnit.SECONDS)).hasMessage("connection reset");
    Thread.sleep(100);

    assertThat(child.isAlive()).isFalse();
    assertThat(exits).singleElement().isInstanceOf(SQLException.class);
    assertThat(child.closes.get()).isEqualTo(1);
    assertThat(child.polls.get()).isEqualTo(3);
  }

  @Test
  void requestedStop_isNotReported() throws Exception {
    var child = new ScriptedChild(Integer.MAX_VALUE);
    child.schedule(scheduler, Duration.ofMillis(10));
    child.firstPoll.get(5, TimeUnit.SECONDS);

    assertThat(child.stop(Duration.ofSeconds(1))).isTrue();

    assertThat(child.isAlive()).isFalse();
    assertThat(child.closes.get()).isEqualTo(1);
    assertThat(exits).isEmpty();
  }

  @Test
  void stop_closesOnTheGivenExecutor() {
    var child = new ScriptedChild(Integer.MAX_VALUE);

    assertThat(child.stop(Duration.ofSeconds(1))).isTrue();

    assertThat(child.closedOn.get()).isEqualTo("close-worker");
  }

  @Test
  void secondStop_isANoop() {
    var child = new ScriptedChild(Integer.MAX_VALUE);

    assertThat(child.stop(Duration.ofSeconds(1))).isTrue();
    assertThat(child.stop(Duration.ofSeconds(1))).isTrue();
    assertThat(child.closes.get()).isEqualTo(1);
  }

  /** Polls successfully until the given poll, which fails. */
  private class ScriptedChild extends PollingChild {

    private final int failOnPoll;
    private final AtomicInteger polls = new AtomicInteger();
    private final AtomicInteger closes = new AtomicInteger();
    private final CompletableFuture<Void> firstPoll = new CompletableFuture<>();
    private final AtomicReference<String> closedOn = new AtomicReference<>();

    ScriptedChild(int failOnPoll) {
      super(
          "replication",
          "t1",
          (child, cause) -> {
            exits.add(cause);
            firstExit.complete(cause);
          },
          closeExecutor);
      this.failOnPoll = failOnPoll;
    }

    @Override
    protected void poll() throws SQLException {
      firstPoll.complete(null);
      if (polls.incrementAndGet() >= failOnPoll) {
        throw new SQLException("connection reset");
      }
    }

    @Override
    protected void close() {
      closedOn.set(Thread.currentThread().getName());
      closes.incrementAndGet();
    }
  }
}
