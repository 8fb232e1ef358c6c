package dev.memorynotify.notifier.service;

public class PushServiceIntegrationException extends RuntimeException {

  public enum Reason {
    UNAUTHORIZED,
    FORBIDDEN,
    BAD_GATEWAY,
    TIMEOUT,
    INVALID_RESPONSE
  }

  private final Reason reason;

  public PushServiceIntegrationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public PushServiceIntegrationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
