/*
 * Where: Notifier domain model
 * What: Memories of one calendar day grouped by year
 * Why: Memory slots cycle through years, so years are kept in descending order
 */
package dev.memorynotify.notifier.model;

import java.util.List;
import java.util.Map;

public record MemoryDigest(
    int totalAssets,
    int imageCount,
    int videoCount,
    List<Integer> years,
    Map<Integer, YearMemories> byYear) {

  public MemoryDigest {
    years = List.copyOf(years);
    byYear = Map.copyOf(byYear);
  }

  public static MemoryDigest empty() {
    return new MemoryDigest(0, 0, 0, List.of(), Map.of());
  }

  public boolean hasMemories() {
    return !years.isEmpty();
  }

  /** Year for a 1-based slot, wrapping when the slot exceeds the number of years. */
  public int yearForSlot(int slot) {
    if (years.isEmpty()) {
      throw new IllegalStateException("no memory years available");
    }
    return years.get(Math.floorMod(slot - 1, years.size()));
  }

  public YearMemories memoriesFor(int year) {
    final YearMemories memories = byYear.get(year);
    return memories == null ? new YearMemories(0, 0, List.of()) : memories;
  }
}
