package io.b2mash.realtime.connect;

/**
 * Result of a non-blocking registry lookup for a tenant.
 *
 * @param state what the registry reported
 * @param connection the established connection, set only when {@code state} is CONNECTED
 */
public record ConnectionStatus(State state, ConnectionHandle connection) {

  public enum State {
    /** An owner is registered with an established connection. */
    CONNECTED,
    /** An owner is registered but its connection is not established yet. */
    CONNECTION_INITIALIZING,
    /** No owner is registered anywhere. */
    UNAVAILABLE,
    /** The registry itself could not answer. */
    INITIALIZING
  }

  public static ConnectionStatus connected(ConnectionHandle connection) {
    return new ConnectionStatus(State.CONNECTED, connection);
  }

  public static ConnectionStatus connectionInitializing() {
    return new ConnectionStatus(State.CONNECTION_INITIALIZING, null);
  }

  public static ConnectionStatus unavailable() {
    return new ConnectionStatus(State.UNAVAILABLE, null);
  }

  public static ConnectionStatus initializing() {
    return new ConnectionStatus(State.INITIALIZING, null);
  }

  public boolean isConnected() {
    return state == State.CONNECTED;
  }
}
