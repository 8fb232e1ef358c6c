/*
 * Where: Notifier configuration binding
 * What: Holds slot counts, retry policy, ranking limits and delivery windows
 * Why: Slot layout and pacing are operator decisions and must be validated at startup
 */
package dev.memorynotify.notifier.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notifier.settings")
@Validated
public record NotifierSettingsProperties(
    @NotNull @Valid RetrySettings retry,
    @NotNull @PositiveOrZero Integer memoryNotifications,
    @NotNull @PositiveOrZero Integer personNotifications,
    @NotNull @PositiveOrZero Integer fallbackNotifications,
    @NotNull @PositiveOrZero Integer topPersonsLimit,
    @NotNull @PositiveOrZero Integer excludeRecentDays,
    @NotNull Boolean videoEmoji,
    @NotBlank String stateFile,
    @NotNull List<@Valid NotificationWindow> notificationWindows) {

  public NotifierSettingsProperties {
    retry = retry == null ? new RetrySettings(null, null) : retry;
    memoryNotifications = memoryNotifications == null ? 3 : memoryNotifications;
    personNotifications = personNotifications == null ? 2 : personNotifications;
    fallbackNotifications = fallbackNotifications == null ? 3 : fallbackNotifications;
    topPersonsLimit = topPersonsLimit == null ? 5 : topPersonsLimit;
    excludeRecentDays = excludeRecentDays == null ? 30 : excludeRecentDays;
    videoEmoji = videoEmoji == null ? Boolean.TRUE : videoEmoji;
    stateFile = stateFile == null || stateFile.isBlank() ? "state.json" : stateFile;
    notificationWindows = notificationWindows == null ? List.of() : List.copyOf(notificationWindows);
  }

  /** Window for a 1-based slot number, if one is configured. */
  public Optional<NotificationWindow> windowForSlot(int slot) {
    if (slot < 1 || slot > notificationWindows.size()) {
      return Optional.empty();
    }
    return Optional.of(notificationWindows.get(slot - 1));
  }

  public record RetrySettings(@NotNull Integer maxAttempts, @NotNull Duration delay) {

    public RetrySettings {
      maxAttempts = maxAttempts == null ? 3 : maxAttempts;
      delay = delay == null ? Duration.ofSeconds(5) : delay;
    }

    @AssertTrue(
        message = "notifier.settings.retry.max-attempts must be at least 1")
    public boolean isMaxAttemptsPositive() {
      return maxAttempts != null && maxAttempts >= 1;
    }

    @AssertTrue(
        message = "notifier.settings.retry.delay must not be negative")
    public boolean isDelayNonNegative() {
      return delay != null && !delay.isNegative();
    }
  }
}
