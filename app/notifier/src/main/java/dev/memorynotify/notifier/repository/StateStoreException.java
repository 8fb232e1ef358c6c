package dev.memorynotify.notifier.repository;

public class StateStoreException extends RuntimeException {

  public StateStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
