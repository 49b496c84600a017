package io.b2mash.realtime.connect.registry;

/** The registry could not answer; callers treat the tenant's state as unknown. */
public class RegistryException extends RuntimeException {

  public RegistryException(String message, Throwable cause) {
    super(message, cause);
  }

  public RegistryException(String message) {
    super(message);
  }
}
