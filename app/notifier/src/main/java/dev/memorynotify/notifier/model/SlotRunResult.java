package dev.memorynotify.notifier.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record SlotRunResult(
    int successCount, int totalUsers, boolean stateSaved, Map<String, DispatchOutcome> outcomes) {

  public SlotRunResult {
    outcomes = Collections.unmodifiableMap(new LinkedHashMap<>(outcomes));
  }

  public boolean successful() {
    return stateSaved && successCount == totalUsers;
  }
}
