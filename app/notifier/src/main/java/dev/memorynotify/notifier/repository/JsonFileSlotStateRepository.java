/*
 * Where: Notifier persistence layer
 * What: Reads and writes the slot state as a JSON file guarded by a sibling lock file
 * Why: Separate slot processes may overlap; the lock keeps each read and write whole
 */
package dev.memorynotify.notifier.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.memorynotify.notifier.config.NotifierSettingsProperties;
import dev.memorynotify.notifier.model.NotificationState;
import dev.memorynotify.notifier.model.SlotState;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

@Repository
public class JsonFileSlotStateRepository implements SlotStateRepository {

  private static final Logger logger = LoggerFactory.getLogger(JsonFileSlotStateRepository.class);

  private final Path stateFile;
  private final Path lockFile;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper is a shared Spring-managed component")
  private final ObjectMapper objectMapper;

  @Autowired
  public JsonFileSlotStateRepository(
      NotifierSettingsProperties settings, ObjectMapper objectMapper) {
    this(Path.of(settings.stateFile()), objectMapper);
  }

  public JsonFileSlotStateRepository(Path stateFile, ObjectMapper objectMapper) {
    this.stateFile = stateFile.toAbsolutePath();
    this.lockFile = this.stateFile.resolveSibling(this.stateFile.getFileName() + ".lock");
    this.objectMapper = objectMapper;
  }

  @Override
  public NotificationState load() {
    if (!Files.exists(stateFile)) {
      logger.info("no state file at {}; starting empty", stateFile);
      return NotificationState.empty();
    }
    try (FileChannel channel = openLockChannel();
        FileLock ignored = channel.lock()) {
      final byte[] content = Files.readAllBytes(stateFile);
      if (content.length == 0) {
        return NotificationState.empty();
      }
      return toState(objectMapper.readValue(content, StateFileDocument.class));
    } catch (JsonProcessingException ex) {
      logger.warn(
          "state file {} is not valid JSON; starting empty: {}", stateFile, ex.getMessage());
      return NotificationState.empty();
    } catch (IOException ex) {
      logger.warn("state file {} could not be read; starting empty", stateFile, ex);
      return NotificationState.empty();
    }
  }

  @Override
  public void save(NotificationState state) {
    try {
      if (stateFile.getParent() != null) {
        Files.createDirectories(stateFile.getParent());
      }
      try (FileChannel channel = openLockChannel();
          FileLock ignored = channel.lock()) {
        final Path temp =
            Files.createTempFile(stateFile.getParent(), stateFile.getFileName().toString(), ".tmp");
        try {
          objectMapper
              .writerWithDefaultPrettyPrinter()
              .writeValue(temp.toFile(), toDocument(state));
          moveIntoPlace(temp);
        } finally {
          Files.deleteIfExists(temp);
        }
      }
      logger.info("state saved to {} users={}", stateFile, state.users().size());
    } catch (IOException ex) {
      throw new StateStoreException("failed to write state file " + stateFile, ex);
    }
  }

  private FileChannel openLockChannel() throws IOException {
    return FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
  }

  private void moveIntoPlace(Path temp) throws IOException {
    try {
      Files.move(
          temp, stateFile, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException ex) {
      logger.debug("atomic move not supported for {}; replacing in place", stateFile);
      Files.move(temp, stateFile, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private NotificationState toState(StateFileDocument document) {
    if (document == null || document.users() == null) {
      return NotificationState.empty();
    }
    final Map<String, SlotState> users = new LinkedHashMap<>();
    document.users().forEach((name, user) -> users.put(name, toSlotState(name, user)));
    return new NotificationState(users);
  }

  private SlotState toSlotState(String name, UserSlotStateDocument document) {
    if (document == null) {
      return SlotState.empty();
    }
    return new SlotState(
        parse(name, "slots_date", document.slotsDate(), LocalDate::parse),
        document.slotsSent() == null ? Set.of() : new LinkedHashSet<>(document.slotsSent()),
        document.assetsSentToday() == null
            ? Set.of()
            : new LinkedHashSet<>(document.assetsSentToday()),
        parse(name, "last_slot_time", document.lastSlotTime(), LocalDateTime::parse));
  }

  private <T> T parse(
      String user, String field, String value, Function<String, T> parser) {
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      return parser.apply(value);
    } catch (DateTimeParseException ex) {
      logger.warn("ignoring unparseable {}={} for user={}", field, value, user);
      return null;
    }
  }

  private StateFileDocument toDocument(NotificationState state) {
    final Map<String, UserSlotStateDocument> users = new LinkedHashMap<>();
    state
        .users()
        .forEach(
            (name, slotState) ->
                users.put(
                    name,
                    new UserSlotStateDocument(
                        slotState.slotsDate() == null ? null : slotState.slotsDate().toString(),
                        new ArrayList<>(slotState.slotsSent()),
                        new ArrayList<>(slotState.assetsSentToday()),
                        slotState.lastSlotTime() == null
                            ? null
                            : slotState.lastSlotTime().toString())));
    return new StateFileDocument(users);
  }
}
