package dev.memorynotify.notifier.model;

import java.time.LocalDate;
import java.util.Set;

/** Inputs for choosing one user's notification in one slot. */
public record SlotSelectionRequest(
    String apiKey,
    int slot,
    MemoryDigest digest,
    Set<String> sentAssetIds,
    LocalDate targetDate,
    boolean testMode) {

  public SlotSelectionRequest {
    sentAssetIds = Set.copyOf(sentAssetIds);
  }
}
