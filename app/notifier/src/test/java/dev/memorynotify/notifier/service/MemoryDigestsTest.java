package dev.memorynotify.notifier.service;

import static org.assertj.core.api.Assertions.assertThat;

import dev.memorynotify.notifier.model.AssetType;
import dev.memorynotify.notifier.model.MemoryDigest;
import dev.memorynotify.notifier.model.PhotoAsset;
import dev.memorynotify.notifier.service.dto.AssetResponse;
import dev.memorynotify.notifier.service.dto.MemoryDataResponse;
import dev.memorynotify.notifier.service.dto.MemoryResponse;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class MemoryDigestsTest {

  @Test
  void filterForDateKeepsOnlyMatchingShowDate() {
    final List<MemoryResponse> memories =
        List.of(
            memory("m1", "2024-06-15T00:00:00.000Z", 2020, asset("a1", "IMAGE")),
            memory("m2", "2024-06-16T00:00:00.000Z", 2019, asset("a2", "IMAGE")),
            new MemoryResponse("m3", null, new MemoryDataResponse(2018), List.of()));

    final List<MemoryResponse> filtered =
        MemoryDigests.filterForDate(memories, LocalDate.parse("2024-06-15"));

    assertThat(filtered).extracting(MemoryResponse::id).containsExactly("m1");
  }

  @Test
  void parseGroupsByYearDescendingAndCountsMediaTypes() {
    final MemoryDigest digest =
        MemoryDigests.parse(
            List.of(
                memory("m1", "2024-06-15", 2020, asset("a1", "IMAGE"), asset("a2", "VIDEO")),
                memory("m2", "2024-06-15", 2022, asset("a3", "IMAGE")),
                memory("m3", "2024-06-15", 2021, asset("a4", null))));

    assertThat(digest.years()).containsExactly(2022, 2021, 2020);
    assertThat(digest.totalAssets()).isEqualTo(4);
    assertThat(digest.imageCount()).isEqualTo(3);
    assertThat(digest.videoCount()).isEqualTo(1);
    assertThat(digest.memoriesFor(2020).images()).isEqualTo(1);
    assertThat(digest.memoriesFor(2020).videos()).isEqualTo(1);
    assertThat(digest.memoriesFor(2021).assets())
        .extracting(PhotoAsset::type)
        .containsExactly(AssetType.IMAGE);
  }

  @Test
  void parseDropsAssetsWithoutIdAndMemoriesWithoutYear() {
    final MemoryDigest digest =
        MemoryDigests.parse(
            List.of(
                memory("m1", "2024-06-15", 2020, asset(null, "IMAGE"), asset("a1", "IMAGE")),
                new MemoryResponse("m2", "2024-06-15", null, List.of(asset("a2", "IMAGE"))),
                memory("m3", "2024-06-15", 0, asset("a3", "IMAGE"))));

    assertThat(digest.years()).containsExactly(2020);
    assertThat(digest.totalAssets()).isEqualTo(1);
    assertThat(digest.memoriesFor(2020).assets()).extracting(PhotoAsset::id).containsExactly("a1");
  }

  @Test
  void parseOfNothingIsEmpty() {
    final MemoryDigest digest = MemoryDigests.parse(List.of());

    assertThat(digest.hasMemories()).isFalse();
    assertThat(digest.totalAssets()).isZero();
  }

  @Test
  void yearForSlotCyclesThroughYears() {
    final MemoryDigest digest =
        MemoryDigests.parse(
            List.of(
                memory("m1", "2024-06-15", 2022, asset("a1", "IMAGE")),
                memory("m2", "2024-06-15", 2021, asset("a2", "IMAGE")),
                memory("m3", "2024-06-15", 2020, asset("a3", "IMAGE"))));

    assertThat(digest.yearForSlot(1)).isEqualTo(2022);
    assertThat(digest.yearForSlot(3)).isEqualTo(2020);
    assertThat(digest.yearForSlot(4)).isEqualTo(2022);
  }

  @Test
  void findAlternateDateReturnsFirstShowDateWithMemories() {
    final List<MemoryResponse> memories =
        List.of(
            new MemoryResponse("m0", "garbage-date", new MemoryDataResponse(2020), List.of()),
            memory("m1", "2024-06-12T00:00:00.000Z", 2020, asset("a1", "IMAGE")),
            memory("m2", "2024-06-13T00:00:00.000Z", 2019, asset("a2", "IMAGE")));

    assertThat(MemoryDigests.findAlternateDate(memories)).contains(LocalDate.parse("2024-06-12"));
  }

  @Test
  void findAlternateDateScansOnlyLeadingMemories() {
    final List<MemoryResponse> memories = new ArrayList<>();
    for (int i = 0; i < MemoryDigests.ALTERNATE_DATE_SCAN_LIMIT; i++) {
      memories.add(new MemoryResponse("bad" + i, "n/a", null, List.of()));
    }
    memories.add(memory("late", "2024-06-12", 2020, asset("a1", "IMAGE")));

    assertThat(MemoryDigests.findAlternateDate(memories)).isEmpty();
  }

  static MemoryResponse memory(String id, String showAt, int year, AssetResponse... assets) {
    return new MemoryResponse(id, showAt, new MemoryDataResponse(year), List.of(assets));
  }

  static AssetResponse asset(String id, String type) {
    return new AssetResponse(id, type, "2019-06-15T10:00:00.000Z", null, null);
  }
}
