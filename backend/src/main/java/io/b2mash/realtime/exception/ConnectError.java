package io.b2mash.realtime.exception;

import org.springframework.http.HttpStatus;

/** Reasons a tenant connection attempt can fail. */
public enum ConnectError {
  TENANT_NOT_FOUND(HttpStatus.NOT_FOUND, "Tenant not found", false),
  TENANT_SUSPENDED(HttpStatus.FORBIDDEN, "Tenant suspended", false),
  TOO_MANY_CONNECTIONS(
      HttpStatus.TOO_MANY_REQUESTS, "Tenant database has too many connections", true),
  CONNECTION_INITIALIZING(
      HttpStatus.SERVICE_UNAVAILABLE, "Tenant database connection initializing", true),
  UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "Tenant database unavailable", false),
  RPC_ERROR(HttpStatus.BAD_GATEWAY, "Remote node call failed", false),
  MIGRATION_FAILED(HttpStatus.INTERNAL_SERVER_ERROR, "Tenant migrations failed", false),
  REPLICATION_START_FAILED(
      HttpStatus.INTERNAL_SERVER_ERROR, "Replication failed to start", false),
  MAX_WAL_SENDERS_REACHED(
      HttpStatus.SERVICE_UNAVAILABLE, "Tenant database has no free WAL senders", false),
  LISTENER_START_FAILED(HttpStatus.INTERNAL_SERVER_ERROR, "Listener failed to start", false);

  private final HttpStatus status;
  private final String title;
  private final boolean retryable;

  ConnectError(HttpStatus status, String title, boolean retryable) {
    this.status = status;
    this.title = title;
    this.retryable = retryable;
  }

  public HttpStatus status() {
    return status;
  }

  public String title() {
    return title;
  }

  /** Whether a caller may retry after a backoff. */
  public boolean isRetryable() {
    return retryable;
  }

  /** Errors returned to the caller as-is when a local connection attempt fails. */
  public boolean isPassedThrough() {
    return this == TENANT_NOT_FOUND || this == TENANT_SUSPENDED || this == TOO_MANY_CONNECTIONS;
  }
}
