/*
 * Where: Notifier selection layer
 * What: Decides which kind of notification a slot carries and picks its asset and text
 * Why: Memory slots come first, person slots follow, and days without memories fall back to people
 */
package dev.memorynotify.notifier.service;

import dev.memorynotify.notifier.config.NotifierSettingsProperties;
import dev.memorynotify.notifier.model.MemoryDigest;
import dev.memorynotify.notifier.model.NotificationContent;
import dev.memorynotify.notifier.model.Person;
import dev.memorynotify.notifier.model.PhotoAsset;
import dev.memorynotify.notifier.model.SlotSelectionRequest;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationContentSelector {

  private static final Logger logger = LoggerFactory.getLogger(NotificationContentSelector.class);

  private final NotifierSettingsProperties settings;
  private final PersonRanker personRanker;
  private final FacePreferenceAssetSelector facePreferenceAssetSelector;
  private final PersonPhotoSelector personPhotoSelector;
  private final MessageRenderer messageRenderer;

  /**
   * Empty when the slot is beyond the configured layout or no candidate asset exists.
   *
   * @throws PhotoServiceIntegrationException when the people listing for a person slot fails
   */
  public Optional<NotificationContent> select(SlotSelectionRequest request) {
    final MemoryDigest digest = request.digest();
    final int slot = request.slot();
    if (digest.hasMemories()) {
      final int memorySlots = settings.memoryNotifications();
      final int personSlots = settings.personNotifications();
      if (slot <= memorySlots) {
        return selectMemory(request);
      }
      if (slot <= memorySlots + personSlots) {
        return selectPerson(request);
      }
      logger.info(
          "slot={} is beyond {} memory and {} person slots; nothing to send",
          slot,
          memorySlots,
          personSlots);
      return Optional.empty();
    }
    if (slot <= settings.fallbackNotifications()) {
      logger.info("no memories for {}; using a person notification", request.targetDate());
      return selectPerson(request);
    }
    logger.info(
        "no memories for {} and slot={} is beyond {} fallback slots; nothing to send",
        request.targetDate(),
        slot,
        settings.fallbackNotifications());
    return Optional.empty();
  }

  private Optional<NotificationContent> selectMemory(SlotSelectionRequest request) {
    final int year = request.digest().yearForSlot(request.slot());
    final List<PhotoAsset> assets = request.digest().memoriesFor(year).assets();
    final Optional<PhotoAsset> asset =
        facePreferenceAssetSelector.select(
            request.apiKey(), assets, request.sentAssetIds(), topPersonIds(request.apiKey()));
    if (asset.isEmpty()) {
      logger.info("no asset available for year={}", year);
      return Optional.empty();
    }
    logger.info("selected memory year={} asset id={}", year, asset.get().id());
    return Optional.of(
        messageRenderer.renderMemory(
            year, request.targetDate().getYear(), asset.get(), request.testMode()));
  }

  private Optional<NotificationContent> selectPerson(SlotSelectionRequest request) {
    final List<Person> ranked =
        personRanker.rankTopPersons(request.apiKey(), settings.topPersonsLimit());
    if (ranked.isEmpty()) {
      logger.info("no named people to choose from");
      return Optional.empty();
    }
    return personPhotoSelector
        .select(request.apiKey(), ranked, request.sentAssetIds())
        .map(
            photo -> {
              logger.info(
                  "selected person name={} asset id={}",
                  photo.person().name(),
                  photo.asset().id());
              return messageRenderer.renderPerson(photo, request.testMode());
            });
  }

  private Set<String> topPersonIds(String apiKey) {
    try {
      return personRanker.rankTopPersons(apiKey, settings.topPersonsLimit()).stream()
          .map(Person::id)
          .collect(Collectors.toSet());
    } catch (PhotoServiceIntegrationException ex) {
      logger.warn("people listing unavailable; selecting without top-person preference");
      return Set.of();
    }
  }
}
