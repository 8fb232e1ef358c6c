/*
 * Where: Notifier dispatch layer
 * What: Runs one slot for every configured user and persists the day state once
 * Why: A slot run is the unit the external scheduler triggers and the exit code reports on
 */
package dev.memorynotify.notifier.service;

import dev.memorynotify.common.RunIds;
import dev.memorynotify.notifier.config.NotifierUser;
import dev.memorynotify.notifier.config.NotifierUsersProperties;
import dev.memorynotify.notifier.model.DispatchOutcome;
import dev.memorynotify.notifier.model.NotificationState;
import dev.memorynotify.notifier.model.SlotRunRequest;
import dev.memorynotify.notifier.model.SlotRunResult;
import dev.memorynotify.notifier.repository.SlotStateRepository;
import dev.memorynotify.notifier.repository.StateStoreException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class SlotRunService {

  private static final Logger logger = LoggerFactory.getLogger(SlotRunService.class);
  static final String MDC_RUN_ID = "run_id";

  private final NotifierUsersProperties usersProperties;
  private final DeliveryDelayPlanner delayPlanner;
  private final SlotStateRepository stateRepository;
  private final SlotDispatchService dispatchService;
  private final NotifierMetrics metrics;
  private final Clock clock;

  /**
   * Users are processed in configuration order; one user's failure never stops the next. The
   * state is saved once at the end unless this is a dry run.
   *
   * @throws InterruptedException when interrupted while waiting for the slot window
   */
  public SlotRunResult run(SlotRunRequest request) throws InterruptedException {
    MDC.put(MDC_RUN_ID, RunIds.newRunId());
    try {
      logSettings(request);
      if (usersProperties.enabledUsers().isEmpty()) {
        logger.warn("no enabled users configured; nothing to do");
        return new SlotRunResult(0, 0, true, Map.of());
      }
      if (!request.noDelay()) {
        delayPlanner.awaitSlot(request.slot(), request.testMode());
      }
      final Instant started = Instant.now(clock);
      final NotificationState state = stateRepository.load();
      final Map<String, DispatchOutcome> outcomes = new LinkedHashMap<>();
      int successCount = 0;
      int totalUsers = 0;
      for (NotifierUser user : usersProperties.users()) {
        final DispatchOutcome outcome = dispatchSafely(user, request, state);
        outcomes.put(user.name(), outcome);
        if (!outcome.counted()) {
          continue;
        }
        totalUsers++;
        if (outcome.successful()) {
          successCount++;
        }
      }
      final boolean stateSaved = saveState(request, state);
      metrics.recordRunDuration(Duration.between(started, Instant.now(clock)));
      logger.info("Complete: {}/{} users successful", successCount, totalUsers);
      logger.info(
          "dispatch outcomes={} upstream retries={}",
          metrics.dispatchCounts(),
          metrics.retryCount());
      return new SlotRunResult(successCount, totalUsers, stateSaved, outcomes);
    } finally {
      MDC.remove(MDC_RUN_ID);
    }
  }

  private DispatchOutcome dispatchSafely(
      NotifierUser user, SlotRunRequest request, NotificationState state) {
    try {
      return dispatchService.dispatch(user, request, state);
    } catch (RuntimeException ex) {
      logger.error("unexpected failure while processing user={}", user.name(), ex);
      metrics.recordDispatchOutcome(DispatchOutcome.ERROR);
      return DispatchOutcome.ERROR;
    }
  }

  private boolean saveState(SlotRunRequest request, NotificationState state) {
    if (request.dryRun()) {
      logger.info("[DRY RUN] state not saved");
      return true;
    }
    try {
      stateRepository.save(state);
      return true;
    } catch (StateStoreException ex) {
      logger.error("state could not be saved", ex);
      return false;
    }
  }

  private void logSettings(SlotRunRequest request) {
    logger.info(
        "slot run slot={} date={} test={} dryRun={} force={} noDelay={}",
        request.slot(),
        request.targetDate(),
        request.testMode(),
        request.dryRun(),
        request.force(),
        request.noDelay());
  }
}
