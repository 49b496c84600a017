package io.b2mash.realtime.database;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import org.springframework.scheduling.TaskScheduler;

/**
 * Periodic liveness check of a tenant pool. Reports the first failed check to its listener and
 * then stops checking.
 */
public final class ConnectionMonitor {

  private final AtomicBoolean fired = new AtomicBoolean();
  private volatile ScheduledFuture<?> check;

  private ConnectionMonitor() {}

  public static ConnectionMonitor watch(
      TaskScheduler scheduler,
      TenantDatabaseConnection connection,
      Duration interval,
      Consumer<ConnectionMonitor> onDown) {
    var monitor = new ConnectionMonitor();
    monitor.check =
        scheduler.scheduleWithFixedDelay(
            () -> {
              if (monitor.fired.get() || connection.isAlive()) {
                return;
              }
              if (monitor.fired.compareAndSet(false, true)) {
                monitor.cancel();
                onDown.accept(monitor);
              }
            },
            Instant.now().plus(interval),
            interval);
    return monitor;
  }

  public void cancel() {
    var current = check;
    if (current != null) {
      current.cancel(false);
    }
  }
}
