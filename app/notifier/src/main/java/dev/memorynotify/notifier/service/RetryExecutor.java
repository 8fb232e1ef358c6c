/*
 * Where: Notifier service layer
 * What: Runs an upstream operation with a bounded number of attempts and a fixed delay
 * Why: Photo and push services fail transiently; one policy applies to every network call
 */
package dev.memorynotify.notifier.service;

import dev.memorynotify.notifier.config.NotifierSettingsProperties;
import java.time.Duration;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class RetryExecutor {

  private static final Logger logger = LoggerFactory.getLogger(RetryExecutor.class);

  private final NotifierSettingsProperties settings;
  private final Sleeper sleeper;
  private final NotifierMetrics metrics;

  /** Uses the configured retry policy. */
  public <T> T withRetry(String operation, Supplier<T> action) {
    return withRetry(
        operation, action, settings.retry().maxAttempts(), settings.retry().delay());
  }

  public void runWithRetry(String operation, Runnable action) {
    withRetry(
        operation,
        () -> {
          action.run();
          return null;
        });
  }

  /**
   * Invokes {@code action} up to {@code maxAttempts} times, sleeping {@code delay} between
   * attempts. The failure of the last attempt is rethrown.
   */
  public <T> T withRetry(String operation, Supplier<T> action, int maxAttempts, Duration delay) {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be at least 1");
    }
    RuntimeException lastError = null;
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      try {
        return action.get();
      } catch (RuntimeException ex) {
        lastError = ex;
        logger.warn(
            "{} attempt {}/{} failed: {}", operation, attempt, maxAttempts, ex.getMessage());
        if (attempt < maxAttempts) {
          metrics.recordRetry(operation);
          pause(delay, lastError);
        }
      }
    }
    throw lastError;
  }

  private void pause(Duration delay, RuntimeException lastError) {
    if (delay == null || delay.isZero() || delay.isNegative()) {
      return;
    }
    try {
      sleeper.sleep(delay);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      lastError.addSuppressed(ex);
      throw lastError;
    }
  }
}
