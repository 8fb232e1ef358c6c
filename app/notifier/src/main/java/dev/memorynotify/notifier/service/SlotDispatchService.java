/*
 * Where: Notifier dispatch layer
 * What: Runs one user through eligibility, fetch, selection, delivery and recording for a slot
 * Why: Each user ends in exactly one outcome so the run can report and exit accordingly
 */
package dev.memorynotify.notifier.service;

import dev.memorynotify.notifier.config.NotifierUser;
import dev.memorynotify.notifier.model.DispatchOutcome;
import dev.memorynotify.notifier.model.MemoryDigest;
import dev.memorynotify.notifier.model.NotificationContent;
import dev.memorynotify.notifier.model.NotificationState;
import dev.memorynotify.notifier.model.SlotRunRequest;
import dev.memorynotify.notifier.model.SlotSelectionRequest;
import dev.memorynotify.notifier.service.dto.MemoryResponse;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class SlotDispatchService {

  private static final Logger logger = LoggerFactory.getLogger(SlotDispatchService.class);
  static final String MDC_USER = "user";
  static final String MDC_SLOT = "slot";

  private final PhotoServiceClient photoServiceClient;
  private final RetryExecutor retryExecutor;
  private final NotificationContentSelector contentSelector;
  private final NotificationDeliveryService deliveryService;
  private final SlotStateTracker stateTracker;
  private final NotifierMetrics metrics;

  /** Mutates {@code state} in memory only when a notification was actually sent. */
  public DispatchOutcome dispatch(
      NotifierUser user, SlotRunRequest request, NotificationState state) {
    MDC.put(MDC_USER, user.name());
    MDC.put(MDC_SLOT, Integer.toString(request.slot()));
    try {
      final DispatchOutcome outcome = process(user, request, state);
      metrics.recordDispatchOutcome(outcome);
      logger.info("dispatch finished outcome={}", outcome);
      return outcome;
    } finally {
      MDC.remove(MDC_USER);
      MDC.remove(MDC_SLOT);
    }
  }

  private DispatchOutcome process(
      NotifierUser user, SlotRunRequest request, NotificationState state) {
    if (!user.isActive()) {
      logger.info("user is disabled; skipping");
      return DispatchOutcome.DISABLED;
    }
    if (!user.hasApiKey()) {
      logger.error("no photo service api key configured for user={}", user.name());
      return DispatchOutcome.NO_CREDENTIAL;
    }
    final LocalDate date = request.targetDate();
    if (!stateTracker.isSlotEligible(
        state, user.name(), date, request.slot(), request.force(), request.testMode())) {
      logger.info("slot={} already sent on {}; skipping", request.slot(), date);
      return DispatchOutcome.SLOT_ALREADY_SENT;
    }

    final List<MemoryResponse> memories;
    try {
      memories =
          retryExecutor.withRetry(
              "fetch memories", () -> photoServiceClient.fetchMemories(user.apiKey()));
    } catch (PhotoServiceIntegrationException ex) {
      logger.error("memories unavailable reason={}: {}", ex.reason(), ex.getMessage());
      return DispatchOutcome.FETCH_FAILED;
    }
    final LocalDate memoryDate = resolveMemoryDate(memories, date, request.testMode());
    final MemoryDigest digest =
        MemoryDigests.parse(MemoryDigests.filterForDate(memories, memoryDate));
    logger.info(
        "memories for {}: {} assets ({} images, {} videos) across years {}",
        memoryDate,
        digest.totalAssets(),
        digest.imageCount(),
        digest.videoCount(),
        digest.years());

    final Set<String> sentAssetIds = stateTracker.sentAssetIds(state, user.name(), date);
    final Optional<NotificationContent> content;
    try {
      content =
          contentSelector.select(
              new SlotSelectionRequest(
                  user.apiKey(),
                  request.slot(),
                  digest,
                  sentAssetIds,
                  memoryDate,
                  request.testMode()));
    } catch (PhotoServiceIntegrationException ex) {
      logger.error("content selection failed reason={}: {}", ex.reason(), ex.getMessage());
      return DispatchOutcome.FETCH_FAILED;
    }
    if (content.isEmpty()) {
      logger.info("nothing to send for slot={}", request.slot());
      return DispatchOutcome.EMPTY;
    }

    final NotificationContent notification = content.get();
    if (request.dryRun()) {
      logger.info(
          "[DRY RUN] Would send: {} - {} (asset id={})",
          notification.title(),
          notification.message(),
          notification.assetId());
      return DispatchOutcome.DRY_RUN;
    }
    try {
      deliveryService.deliver(user, notification);
    } catch (PushServiceIntegrationException ex) {
      logger.error("notification delivery failed reason={}: {}", ex.reason(), ex.getMessage());
      return DispatchOutcome.SEND_FAILED;
    }
    stateTracker.recordSend(
        state, user.name(), date, request.slot(), notification.assetId(), request.testMode());
    return DispatchOutcome.SENT;
  }

  /** Test runs borrow the first nearby date with memories when the requested one has none. */
  private LocalDate resolveMemoryDate(
      List<MemoryResponse> memories, LocalDate date, boolean testMode) {
    if (!testMode || !MemoryDigests.filterForDate(memories, date).isEmpty()) {
      return date;
    }
    final Optional<LocalDate> alternate = MemoryDigests.findAlternateDate(memories);
    alternate.ifPresent(
        found -> logger.info("[TEST] no memories for {}; using {} instead", date, found));
    return alternate.orElse(date);
  }
}
