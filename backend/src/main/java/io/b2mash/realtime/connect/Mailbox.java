package io.b2mash.realtime.connect;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Serial task queue for one connection manager. Tasks run one at a time, in submission order, on
 * a shared executor; at most one thread drains a mailbox at any moment.
 */
final class Mailbox {

  private static final Logger log = LoggerFactory.getLogger(Mailbox.class);
  private static final String MDC_TENANT_ID = "tenantId";

  private final String tenantId;
  private final Executor executor;
  private final Queue<Runnable> tasks = new ConcurrentLinkedQueue<>();
  private final AtomicBoolean draining = new AtomicBoolean();

  Mailbox(String tenantId, Executor executor) {
    this.tenantId = tenantId;
    this.executor = executor;
  }

  void send(Runnable task) {
    tasks.add(task);
    scheduleDrain();
  }

  private void scheduleDrain() {
    if (draining.compareAndSet(false, true)) {
      executor.execute(this::drain);
    }
  }

  private void drain() {
    MDC.put(MDC_TENANT_ID, tenantId);
    try {
      Runnable task;
      while ((task = tasks.poll()) != null) {
        try {
          task.run();
        } catch (RuntimeException e) {
          log.error("Unhandled error in connection manager for tenant {}", tenantId, e);
        }
      }
    } finally {
      MDC.remove(MDC_TENANT_ID);
      draining.set(false);
      // A task may have arrived between the last poll and the flag reset
      if (!tasks.isEmpty()) {
        scheduleDrain();
      }
    }
  }
}
