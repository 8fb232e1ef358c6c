/*
 * Where: Notifier service layer
 * What: Computes and waits a random delay inside a slot's configured clock-time window
 * Why: Spreads deliveries across the window instead of firing at the trigger instant
 */
package dev.memorynotify.notifier.service;

import com.google.common.annotations.VisibleForTesting;
import dev.memorynotify.notifier.config.NotificationWindow;
import dev.memorynotify.notifier.config.NotifierSettingsProperties;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Optional;
import java.util.Random;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class DeliveryDelayPlanner {

  private static final Logger logger = LoggerFactory.getLogger(DeliveryDelayPlanner.class);
  private static final int TEST_DELAY_MIN_SECONDS = 1;
  private static final int TEST_DELAY_MAX_SECONDS = 5;

  private final NotifierSettingsProperties settings;
  private final Clock clock;
  private final Random random;
  private final Sleeper sleeper;

  /**
   * Seconds to wait before delivering, for a window given as "HH:MM" strings.
   *
   * <ul>
   *   <li>before the window: time until start plus a random offset within the window
   *   <li>inside the window: a random offset up to the window end
   *   <li>after the window: zero
   * </ul>
   *
   * Test mode ignores the window and returns 1 to 5 seconds.
   */
  public long computeDelay(
      String windowStart, String windowEnd, LocalDateTime now, boolean testMode) {
    if (testMode) {
      return uniform(TEST_DELAY_MIN_SECONDS, TEST_DELAY_MAX_SECONDS);
    }
    final LocalDateTime start = now.toLocalDate().atTime(LocalTime.parse(windowStart));
    final LocalDateTime end = now.toLocalDate().atTime(LocalTime.parse(windowEnd));
    if (end.isBefore(start)) {
      throw new IllegalArgumentException(
          "window end " + windowEnd + " is before start " + windowStart);
    }
    if (now.isBefore(start)) {
      final long untilStart = Duration.between(now, start).getSeconds();
      final long windowLength = Duration.between(start, end).getSeconds();
      return untilStart + uniform(0, windowLength);
    }
    if (now.isBefore(end)) {
      return uniform(0, Duration.between(now, end).getSeconds());
    }
    return 0L;
  }

  /** Delay for a 1-based slot; slots without a configured window are sent immediately. */
  public long delayForSlot(int slot, boolean testMode) {
    if (testMode) {
      return computeDelay(null, null, LocalDateTime.now(clock), true);
    }
    final Optional<NotificationWindow> window = settings.windowForSlot(slot);
    if (window.isEmpty()) {
      logger.info("no notification window configured for slot={}; sending immediately", slot);
      return 0L;
    }
    return computeDelay(
        window.get().start(), window.get().end(), LocalDateTime.now(clock), false);
  }

  /** Blocks the calling thread for the slot's delay. */
  public void awaitSlot(int slot, boolean testMode) throws InterruptedException {
    final long seconds = delayForSlot(slot, testMode);
    if (seconds <= 0) {
      return;
    }
    logger.info(
        "waiting {}s before slot={} (until ~{})",
        seconds,
        slot,
        LocalDateTime.now(clock).plusSeconds(seconds).toLocalTime().withNano(0));
    sleeper.sleep(Duration.ofSeconds(seconds));
  }

  @VisibleForTesting
  long uniform(long minInclusive, long maxInclusive) {
    if (maxInclusive <= minInclusive) {
      return minInclusive;
    }
    return minInclusive + (long) random.nextInt(Math.toIntExact(maxInclusive - minInclusive + 1));
  }
}
