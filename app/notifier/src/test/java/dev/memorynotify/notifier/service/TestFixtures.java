package dev.memorynotify.notifier.service;

import dev.memorynotify.notifier.config.NotificationWindow;
import dev.memorynotify.notifier.config.NotifierSettingsProperties;
import dev.memorynotify.notifier.model.AssetType;
import dev.memorynotify.notifier.model.PhotoAsset;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Random;

final class TestFixtures {

  private TestFixtures() {}

  static NotifierSettingsProperties settings(int maxAttempts, Duration delay) {
    return new NotifierSettingsProperties(
        new NotifierSettingsProperties.RetrySettings(maxAttempts, delay),
        null,
        null,
        null,
        null,
        null,
        null,
        null,
        null);
  }

  static NotifierSettingsProperties slotSettings(
      int memorySlots, int personSlots, int fallbackSlots) {
    return new NotifierSettingsProperties(
        new NotifierSettingsProperties.RetrySettings(3, Duration.ZERO),
        memorySlots,
        personSlots,
        fallbackSlots,
        5,
        30,
        true,
        "state.json",
        null);
  }

  static NotifierSettingsProperties windowSettings(List<NotificationWindow> windows) {
    return new NotifierSettingsProperties(
        null, null, null, null, null, null, null, null, windows);
  }

  /** Three attempts, no delay, no real sleeping. */
  static RetryExecutor immediateRetry() {
    return new RetryExecutor(
        settings(3, Duration.ZERO), duration -> {}, new NotifierMetrics(new SimpleMeterRegistry()));
  }

  static PhotoAsset image(String id) {
    return new PhotoAsset(id, AssetType.IMAGE, Instant.parse("2019-06-15T10:00:00Z"));
  }

  static PhotoAsset video(String id) {
    return new PhotoAsset(id, AssetType.VIDEO, Instant.parse("2019-06-15T10:00:00Z"));
  }

  /** Always answers the largest allowed value. */
  static Random maxRandom() {
    return new Random() {
      @Override
      public int nextInt(int bound) {
        return bound - 1;
      }
    };
  }

  /** Always answers zero. */
  static Random minRandom() {
    return new Random() {
      @Override
      public int nextInt(int bound) {
        return 0;
      }
    };
  }
}
