package dev.memorynotify.notifier.service;

public class PhotoServiceIntegrationException extends RuntimeException {

  public enum Reason {
    UNAUTHORIZED,
    NOT_FOUND,
    BAD_GATEWAY,
    TIMEOUT,
    INVALID_RESPONSE
  }

  private final Reason reason;

  public PhotoServiceIntegrationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public PhotoServiceIntegrationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
