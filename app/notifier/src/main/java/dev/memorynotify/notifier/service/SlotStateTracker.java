/*
 * Where: Notifier service layer
 * What: Gates slot eligibility and records sends in the per-user day state
 * Why: Each slot is sent at most once per user per day and an asset is not repeated within a day
 */
package dev.memorynotify.notifier.service;

import dev.memorynotify.notifier.model.NotificationState;
import dev.memorynotify.notifier.model.SlotState;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class SlotStateTracker {

  private final Clock clock;

  public boolean isSlotEligible(
      NotificationState state,
      String userName,
      LocalDate date,
      int slot,
      boolean force,
      boolean testMode) {
    if (force || testMode) {
      return true;
    }
    return !state.get(userName).asOf(date).slotsSent().contains(slot);
  }

  public Set<String> sentAssetIds(NotificationState state, String userName, LocalDate date) {
    return state.get(userName).asOf(date).assetsSentToday();
  }

  /** Test sends leave the state untouched. */
  public void recordSend(
      NotificationState state,
      String userName,
      LocalDate date,
      int slot,
      String assetId,
      boolean testMode) {
    if (testMode) {
      return;
    }
    final SlotState current = state.get(userName).asOf(date);
    final Set<Integer> slots = new LinkedHashSet<>(current.slotsSent());
    slots.add(slot);
    final Set<String> assets = new LinkedHashSet<>(current.assetsSentToday());
    if (assetId != null && !assetId.isBlank()) {
      assets.add(assetId);
    }
    state.put(userName, new SlotState(date, slots, assets, LocalDateTime.now(clock)));
  }
}
