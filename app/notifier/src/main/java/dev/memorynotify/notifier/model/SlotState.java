/*
 * Where: Notifier domain model
 * What: Per-user record of the slots and assets sent on one calendar day
 * Why: Deduplicates sends within a day and resets implicitly when the day changes
 */
package dev.memorynotify.notifier.model;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

public record SlotState(
    LocalDate slotsDate,
    Set<Integer> slotsSent,
    Set<String> assetsSentToday,
    LocalDateTime lastSlotTime) {

  public SlotState {
    slotsSent =
        Collections.unmodifiableSet(new LinkedHashSet<>(slotsSent == null ? Set.of() : slotsSent));
    assetsSentToday =
        Collections.unmodifiableSet(
            new LinkedHashSet<>(assetsSentToday == null ? Set.of() : assetsSentToday));
  }

  public static SlotState empty() {
    return new SlotState(null, Set.of(), Set.of(), null);
  }

  public boolean appliesTo(LocalDate date) {
    return slotsDate != null && Objects.equals(slotsDate, date);
  }

  /** The record as seen on {@code date}: stale days read as empty, keeping only the last send time. */
  public SlotState asOf(LocalDate date) {
    if (appliesTo(date)) {
      return this;
    }
    return new SlotState(date, Set.of(), Set.of(), lastSlotTime);
  }
}
