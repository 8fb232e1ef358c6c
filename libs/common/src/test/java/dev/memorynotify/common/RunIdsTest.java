package dev.memorynotify.common;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class RunIdsTest {

  @Test
  void runIdIsShortHexAndUnique() {
    final String first = RunIds.newRunId();
    final String second = RunIds.newRunId();

    assertThat(first).hasSize(8).matches("[0-9a-f]{8}");
    assertThat(first).isNotEqualTo(second);
  }
}
