/*
 * Where: Notifier service layer
 * What: Filters raw memories to one calendar day and groups their assets by year
 * Why: Slot selection works on years in descending order with per-year asset lists
 */
package dev.memorynotify.notifier.service;

import dev.memorynotify.notifier.model.MemoryDigest;
import dev.memorynotify.notifier.model.PhotoAsset;
import dev.memorynotify.notifier.model.YearMemories;
import dev.memorynotify.notifier.service.dto.AssetResponse;
import dev.memorynotify.notifier.service.dto.MemoryResponse;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class MemoryDigests {

  private static final Logger logger = LoggerFactory.getLogger(MemoryDigests.class);
  static final int ALTERNATE_DATE_SCAN_LIMIT = 10;

  private MemoryDigests() {}

  public static List<MemoryResponse> filterForDate(List<MemoryResponse> memories, LocalDate date) {
    final String prefix = date.toString();
    return memories.stream()
        .filter(memory -> memory != null && memory.showAt() != null)
        .filter(memory -> memory.showAt().startsWith(prefix))
        .toList();
  }

  public static MemoryDigest parse(List<MemoryResponse> memories) {
    final Map<Integer, YearAccumulator> byYear = new LinkedHashMap<>();
    int total = 0;
    int images = 0;
    int videos = 0;
    for (MemoryResponse memory : memories) {
      final Integer year = memory.data() == null ? null : memory.data().year();
      if (year == null || year == 0 || memory.assets() == null) {
        continue;
      }
      for (AssetResponse raw : memory.assets()) {
        final PhotoAsset asset = AssetMapper.toAsset(raw);
        if (asset == null) {
          continue;
        }
        final YearAccumulator accumulator =
            byYear.computeIfAbsent(year, ignored -> new YearAccumulator());
        accumulator.assets.add(asset);
        total++;
        if (asset.isVideo()) {
          videos++;
          accumulator.videos++;
        } else {
          images++;
          accumulator.images++;
        }
      }
    }
    final List<Integer> years =
        byYear.keySet().stream().sorted(Comparator.reverseOrder()).toList();
    final Map<Integer, YearMemories> grouped = new LinkedHashMap<>();
    for (Integer year : years) {
      final YearAccumulator accumulator = byYear.get(year);
      grouped.put(
          year, new YearMemories(accumulator.images, accumulator.videos, accumulator.assets));
    }
    return new MemoryDigest(total, images, videos, years, grouped);
  }

  /**
   * First show date among the leading memories that actually has entries. Used by test runs
   * when the requested date has no memories.
   */
  public static Optional<LocalDate> findAlternateDate(List<MemoryResponse> memories) {
    final int limit = Math.min(ALTERNATE_DATE_SCAN_LIMIT, memories.size());
    for (int i = 0; i < limit; i++) {
      final MemoryResponse memory = memories.get(i);
      if (memory == null || memory.showAt() == null || memory.showAt().length() < 10) {
        continue;
      }
      final LocalDate candidate = parseShowDate(memory.showAt());
      if (candidate != null && !filterForDate(memories, candidate).isEmpty()) {
        return Optional.of(candidate);
      }
    }
    return Optional.empty();
  }

  private static LocalDate parseShowDate(String showAt) {
    try {
      return LocalDate.parse(showAt.substring(0, 10));
    } catch (DateTimeParseException ex) {
      logger.debug("ignoring memory with unparseable showAt={}", showAt);
      return null;
    }
  }

  private static final class YearAccumulator {
    private final List<PhotoAsset> assets = new ArrayList<>();
    private int images;
    private int videos;
  }
}
