/*
 * Where: Notifier configuration binding
 * What: A same-day clock-time window ("HH:MM"-"HH:MM") in which one slot is delivered
 * Why: Windows that wrap past midnight have no defined delay semantics and are rejected
 */
package dev.memorynotify.notifier.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;

public record NotificationWindow(
    @NotBlank @Pattern(regexp = NotificationWindow.CLOCK_TIME) String start,
    @NotBlank @Pattern(regexp = NotificationWindow.CLOCK_TIME) String end) {

  static final String CLOCK_TIME = "^\\d{2}:\\d{2}$";

  @AssertTrue(message = "notification window must be a valid same-day range (end >= start)")
  public boolean isSameDayWindow() {
    // malformed values are reported by @NotBlank/@Pattern
    if (start == null || end == null || !start.matches(CLOCK_TIME) || !end.matches(CLOCK_TIME)) {
      return true;
    }
    final LocalTime startTime = parseOrNull(start);
    final LocalTime endTime = parseOrNull(end);
    if (startTime == null || endTime == null) {
      return false;
    }
    return !endTime.isBefore(startTime);
  }

  private static LocalTime parseOrNull(String value) {
    try {
      return LocalTime.parse(value);
    } catch (DateTimeParseException ex) {
      return null;
    }
  }
}
