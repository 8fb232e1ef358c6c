package dev.memorynotify.notifier.model;

import java.time.LocalDate;

public record SlotRunRequest(
    int slot,
    LocalDate targetDate,
    boolean testMode,
    boolean dryRun,
    boolean force,
    boolean noDelay) {

  public SlotRunRequest {
    if (slot < 1) {
      throw new IllegalArgumentException("slot must be at least 1");
    }
    if (targetDate == null) {
      throw new IllegalArgumentException("targetDate is required");
    }
  }
}
