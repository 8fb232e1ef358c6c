package dev.memorynotify.notifier.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class SlotStateTest {

  private static final LocalDate TODAY = LocalDate.of(2024, 6, 15);
  private static final LocalDateTime LAST = LocalDateTime.of(2024, 6, 14, 20, 15);

  @Test
  void sameDayStateIsReturnedUnchanged() {
    final SlotState state = new SlotState(TODAY, Set.of(1, 2), Set.of("a1"), LAST);

    assertThat(state.asOf(TODAY)).isSameAs(state);
  }

  @Test
  void previousDayStateReadsAsEmptyButKeepsLastSlotTime() {
    final SlotState state =
        new SlotState(TODAY.minusDays(1), Set.of(1, 2, 3), Set.of("a1", "a2"), LAST);

    final SlotState rolled = state.asOf(TODAY);

    assertThat(rolled.slotsDate()).isEqualTo(TODAY);
    assertThat(rolled.slotsSent()).isEmpty();
    assertThat(rolled.assetsSentToday()).isEmpty();
    assertThat(rolled.lastSlotTime()).isEqualTo(LAST);
  }

  @Test
  void emptyStateAppliesToNoDay() {
    assertThat(SlotState.empty().appliesTo(TODAY)).isFalse();
    assertThat(SlotState.empty().asOf(TODAY).slotsDate()).isEqualTo(TODAY);
  }

  @Test
  void unknownUserReadsAsEmptyState() {
    final NotificationState state = NotificationState.empty();

    assertThat(state.contains("alice")).isFalse();
    assertThat(state.get("alice")).isEqualTo(SlotState.empty());
  }

  @Test
  void slotRunRequestRejectsNonPositiveSlotAndMissingDate() {
    assertThatThrownBy(() -> new SlotRunRequest(0, TODAY, false, false, false, false))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new SlotRunRequest(1, null, false, false, false, false))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void runSucceedsOnlyWhenEveryCountedUserSucceededAndStateWasSaved() {
    assertThat(new SlotRunResult(2, 2, true, Map.of()).successful()).isTrue();
    assertThat(new SlotRunResult(1, 2, true, Map.of()).successful()).isFalse();
    assertThat(new SlotRunResult(2, 2, false, Map.of()).successful()).isFalse();
  }
}
