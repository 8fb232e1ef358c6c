/*
 * Where: Notifier domain model
 * What: In-memory copy of the persisted per-user slot state for one run
 * Why: Loaded once and saved once per run; passed explicitly instead of living in a global
 */
package dev.memorynotify.notifier.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public final class NotificationState {

  private final Map<String, SlotState> users;

  public NotificationState(Map<String, SlotState> users) {
    this.users = new LinkedHashMap<>(users);
  }

  public static NotificationState empty() {
    return new NotificationState(Map.of());
  }

  public SlotState get(String userName) {
    final SlotState state = users.get(userName);
    return state == null ? SlotState.empty() : state;
  }

  public boolean contains(String userName) {
    return users.containsKey(userName);
  }

  public void put(String userName, SlotState state) {
    users.put(userName, state);
  }

  public Map<String, SlotState> users() {
    return Collections.unmodifiableMap(users);
  }
}
