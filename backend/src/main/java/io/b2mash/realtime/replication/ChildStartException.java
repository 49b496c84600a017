package io.b2mash.realtime.replication;

import io.b2mash.realtime.exception.ConnectError;

/** A replication or listener worker could not be started. */
public class ChildStartException extends RuntimeException {

  private final ConnectError reason;

  public ChildStartException(ConnectError reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public static ChildStartException maxWalSendersReached(String tenantId, Throwable cause) {
    return new ChildStartException(
        ConnectError.MAX_WAL_SENDERS_REACHED,
        "Database of tenant " + tenantId + " has no free WAL sender",
        cause);
  }

  public ConnectError getReason() {
    return reason;
  }
}
