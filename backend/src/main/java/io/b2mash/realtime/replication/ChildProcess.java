package io.b2mash.realtime.replication;

import java.time.Duration;

/** Long-running worker attached to a tenant connection. */
public interface ChildProcess {

  String name();

  boolean isAlive();

  /**
   * Stops the worker, waiting at most {@code timeout}.
   *
   * @return true if the worker released its resources within the timeout
   */
  boolean stop(Duration timeout);
}
