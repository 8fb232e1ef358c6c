/*
 * Where: Notifier domain model
 * What: Terminal state of one user's slot dispatch
 * Why: The run's exit code is derived from these outcomes
 */
package dev.memorynotify.notifier.model;

public enum DispatchOutcome {
  DISABLED(true, false),
  NO_CREDENTIAL(false, true),
  SLOT_ALREADY_SENT(true, true),
  FETCH_FAILED(false, true),
  EMPTY(true, true),
  DRY_RUN(true, true),
  SENT(true, true),
  SEND_FAILED(false, true),
  ERROR(false, true);

  private final boolean successful;
  private final boolean counted;

  DispatchOutcome(boolean successful, boolean counted) {
    this.successful = successful;
    this.counted = counted;
  }

  public boolean successful() {
    return successful;
  }

  /** Disabled users are skipped and do not count towards the run total. */
  public boolean counted() {
    return counted;
  }
}
