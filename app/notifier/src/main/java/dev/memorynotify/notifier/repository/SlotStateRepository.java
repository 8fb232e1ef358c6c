package dev.memorynotify.notifier.repository;

import dev.memorynotify.notifier.model.NotificationState;

/** Loads and persists the per-user slot state as a whole, once per run. */
public interface SlotStateRepository {

  /** Never fails; a missing or unreadable store yields an empty state. */
  NotificationState load();

  /**
   * @throws StateStoreException when the state cannot be written
   */
  void save(NotificationState state);
}
