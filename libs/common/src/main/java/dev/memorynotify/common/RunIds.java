package dev.memorynotify.common;

import java.util.UUID;

public final class RunIds {
  private RunIds() {}

  /** Short correlation id stamped on every log line of one slot run. */
  public static String newRunId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
