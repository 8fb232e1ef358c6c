package dev.memorynotify.notifier.service;

import java.time.Duration;

/** Blocking pause used between retry attempts and before a slot's deliveries. */
@FunctionalInterface
public interface Sleeper {
  void sleep(Duration duration) throws InterruptedException;
}
