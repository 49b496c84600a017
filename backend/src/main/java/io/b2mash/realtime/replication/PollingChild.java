package io.b2mash.realtime.replication;

import java.sql.SQLException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BiConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

/**
 * Worker that polls a dedicated database connection on the shared scheduler. A failed poll ends
 * the worker and is reported once to the exit listener; a requested stop is not reported.
 */
abstract class PollingChild implements ChildProcess {

  private static final Logger log = LoggerFactory.getLogger(PollingChild.class);

  private final String name;
  private final String tenantId;
  private final BiConsumer<ChildProcess, Throwable> onExit;
  private final Executor closeExecutor;
  private final AtomicBoolean alive = new AtomicBoolean(true);
  private final AtomicBoolean stopping = new AtomicBoolean();
  private volatile ScheduledFuture<?> polling;

  PollingChild(
      String name,
      String tenantId,
      BiConsumer<ChildProcess, Throwable> onExit,
      Executor closeExecutor) {
    this.name = name;
    this.tenantId = tenantId;
    this.onExit = onExit;
    this.closeExecutor = closeExecutor;
  }

  /** Reads whatever the connection has pending. Must not block for long. */
  protected abstract void poll() throws SQLException;

  protected abstract void close() throws SQLException;

  final void schedule(TaskScheduler scheduler, Duration interval) {
    polling = scheduler.scheduleWithFixedDelay(this::pollOnce, interval);
  }

  protected final String tenantId() {
    return tenantId;
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public boolean isAlive() {
    return alive.get();
  }

  @Override
  public boolean stop(Duration timeout) {
    if (!stopping.compareAndSet(false, true)) {
      return !alive.get();
    }
    cancelPolling();
    var closing = CompletableFuture.runAsync(this::closeQuietly, closeExecutor);
    try {
      closing.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      return true;
    } catch (TimeoutException e) {
      log.warn("{} of tenant {} did not stop within {}", name, tenantId, timeout);
      return false;
    } catch (ExecutionException e) {
      log.warn("{} of tenant {} failed to stop", name, tenantId, e.getCause());
      return false;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    } finally {
      alive.set(false);
    }
  }

  private void pollOnce() {
    if (stopping.get() || !alive.get()) {
      return;
    }
    try {
      poll();
    } catch (SQLException | RuntimeException e) {
      if (stopping.get()) {
        return;
      }
      cancelPolling();
      closeQuietly();
      if (alive.compareAndSet(true, false)) {
        log.warn("{} of tenant {} exited: {}", name, tenantId, e.getMessage());
        onExit.accept(this, e);
      }
    }
  }

  private void cancelPolling() {
    var current = polling;
    if (current != null) {
      current.cancel(false);
    }
  }

  private void closeQuietly() {
    try {
      close();
    } catch (SQLException e) {
      log.debug("Closing {} of tenant {} failed: {}", name, tenantId, e.getMessage());
    }
  }
}
