package dev.memorynotify.notifier.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.memorynotify.notifier.model.NotificationState;
import dev.memorynotify.notifier.model.SlotState;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonFileSlotStateRepositoryTest {

  private final ObjectMapper objectMapper = new ObjectMapper();

  @TempDir Path tempDir;

  @Test
  void missingFileLoadsEmptyState() {
    final JsonFileSlotStateRepository repository = repository(tempDir.resolve("state.json"));

    assertThat(repository.load().users()).isEmpty();
  }

  @Test
  void savesSnakeCaseDocumentAndLoadsItBack() throws IOException {
    final Path file = tempDir.resolve("nested/state.json");
    final JsonFileSlotStateRepository repository = repository(file);
    final Map<String, SlotState> users = new LinkedHashMap<>();
    users.put(
        "alice",
        new SlotState(
            LocalDate.parse("2024-06-15"),
            new LinkedHashSet<>(List.of(1, 3)),
            new LinkedHashSet<>(List.of("a1", "a2")),
            LocalDateTime.parse("2024-06-15T09:41:12")));

    repository.save(new NotificationState(users));

    final JsonNode document = objectMapper.readTree(file.toFile());
    final JsonNode alice = document.get("users").get("alice");
    assertThat(alice.get("slots_date").asText()).isEqualTo("2024-06-15");
    assertThat(alice.get("slots_sent").toString()).isEqualTo("[1,3]");
    assertThat(alice.get("assets_sent_today").toString()).isEqualTo("[\"a1\",\"a2\"]");
    assertThat(alice.get("last_slot_time").asText()).isEqualTo("2024-06-15T09:41:12");
    assertThat(Files.exists(tempDir.resolve("nested/state.json.lock"))).isTrue();

    final SlotState loaded = repository.load().get("alice");
    assertThat(loaded.slotsDate()).isEqualTo(LocalDate.parse("2024-06-15"));
    assertThat(loaded.slotsSent()).containsExactly(1, 3);
    assertThat(loaded.assetsSentToday()).containsExactly("a1", "a2");
    assertThat(loaded.lastSlotTime()).isEqualTo(LocalDateTime.parse("2024-06-15T09:41:12"));
  }

  @Test
  void saveLeavesNoTemporaryFilesBehind() throws IOException {
    final JsonFileSlotStateRepository repository = repository(tempDir.resolve("state.json"));

    repository.save(NotificationState.empty());
    repository.save(NotificationState.empty());

    try (var files = Files.list(tempDir)) {
      assertThat(files.map(path -> path.getFileName().toString()))
          .containsExactlyInAnyOrder("state.json", "state.json.lock");
    }
  }

  @Test
  void loadToleratesNullsAndUnknownFields() throws IOException {
    final Path file = tempDir.resolve("state.json");
    Files.writeString(
        file,
        """
        {"users": {
          "alice": {"slots_date": null, "slots_sent": [], "assets_sent_today": [],
                    "last_slot_time": null, "last_sent_date": "2024-06-01"},
          "bob": {"slots_date": "not-a-date", "slots_sent": [2]}
        }}
        """,
        StandardCharsets.UTF_8);

    final NotificationState state = repository(file).load();

    assertThat(state.get("alice").slotsDate()).isNull();
    assertThat(state.get("alice").slotsSent()).isEmpty();
    assertThat(state.get("bob").slotsDate()).isNull();
    assertThat(state.get("bob").slotsSent()).containsExactly(2);
    assertThat(state.get("bob").assetsSentToday()).isEmpty();
  }

  @Test
  void corruptFileLoadsEmptyState() throws IOException {
    final Path file = tempDir.resolve("state.json");
    Files.writeString(file, "{not json", StandardCharsets.UTF_8);

    assertThat(repository(file).load().users()).isEmpty();
  }

  @Test
  void emptyFileLoadsEmptyState() throws IOException {
    final Path file = tempDir.resolve("state.json");
    Files.writeString(file, "", StandardCharsets.UTF_8);

    assertThat(repository(file).load().users()).isEmpty();
  }

  @Test
  void unwritableLocationFailsWithStateStoreException() throws IOException {
    final Path blocker = tempDir.resolve("blocker");
    Files.writeString(blocker, "file, not a directory", StandardCharsets.UTF_8);

    assertThatThrownBy(
            () -> repository(blocker.resolve("state.json")).save(NotificationState.empty()))
        .isInstanceOf(StateStoreException.class);
  }

  private JsonFileSlotStateRepository repository(Path file) {
    return new JsonFileSlotStateRepository(file, objectMapper);
  }
}
