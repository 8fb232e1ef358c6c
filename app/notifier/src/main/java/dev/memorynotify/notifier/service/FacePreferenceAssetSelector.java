/*
 * Where: Notifier selection layer
 * What: Picks a memory asset, preferring photos of top people, then of any named person
 * Why: Photos with familiar faces make better notifications than landscapes or receipts
 */
package dev.memorynotify.notifier.service;

import dev.memorynotify.notifier.model.Person;
import dev.memorynotify.notifier.model.PhotoAsset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class FacePreferenceAssetSelector {

  private static final Logger logger = LoggerFactory.getLogger(FacePreferenceAssetSelector.class);

  private final PhotoServiceClient photoServiceClient;
  private final RetryExecutor retryExecutor;
  private final Random random;

  /**
   * Chooses uniformly from the best non-empty tier among assets not yet sent today:
   * top-person face, any named face, no named face. When every asset was already sent the
   * choice falls back to the full list, so a memory slot is never left empty.
   */
  public Optional<PhotoAsset> select(
      String apiKey, List<PhotoAsset> assets, Set<String> sentAssetIds, Set<String> topPersonIds) {
    if (assets == null || assets.isEmpty()) {
      return Optional.empty();
    }
    final List<PhotoAsset> withTopPerson = new ArrayList<>();
    final List<PhotoAsset> withNamedFace = new ArrayList<>();
    final List<PhotoAsset> withoutFace = new ArrayList<>();
    for (PhotoAsset asset : assets) {
      if (sentAssetIds.contains(asset.id())) {
        continue;
      }
      final List<Person> faces = facesOf(apiKey, asset);
      if (faces.stream().anyMatch(face -> topPersonIds.contains(face.id()))) {
        withTopPerson.add(asset);
      } else if (faces.stream().anyMatch(Person::isNamed)) {
        withNamedFace.add(asset);
      } else {
        withoutFace.add(asset);
      }
    }
    logger.debug(
        "face tiers top={} named={} other={} (of {} assets)",
        withTopPerson.size(),
        withNamedFace.size(),
        withoutFace.size(),
        assets.size());
    for (List<PhotoAsset> tier : List.of(withTopPerson, withNamedFace, withoutFace)) {
      if (!tier.isEmpty()) {
        return Optional.of(pick(tier));
      }
    }
    logger.info("every memory asset was already sent today; reusing one");
    return Optional.of(pick(assets));
  }

  private List<Person> facesOf(String apiKey, PhotoAsset asset) {
    try {
      return retryExecutor.withRetry(
          "fetch asset people", () -> photoServiceClient.fetchAssetPeople(apiKey, asset.id()));
    } catch (PhotoServiceIntegrationException ex) {
      logger.warn("face lookup failed for asset id={}; treating as no faces", asset.id());
      return List.of();
    }
  }

  private PhotoAsset pick(List<PhotoAsset> candidates) {
    return candidates.get(random.nextInt(candidates.size()));
  }
}
