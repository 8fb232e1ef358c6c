/*
 * Where: Notifier selection layer
 * What: Picks a photo of one of the top people that was neither sent today nor taken recently
 * Why: Person slots surface older photos of familiar faces
 */
package dev.memorynotify.notifier.service;

import dev.memorynotify.notifier.config.NotifierSettingsProperties;
import dev.memorynotify.notifier.config.PhotoServiceProperties;
import dev.memorynotify.notifier.model.Person;
import dev.memorynotify.notifier.model.PersonPhoto;
import dev.memorynotify.notifier.model.PhotoAsset;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
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
public class PersonPhotoSelector {

  private static final Logger logger = LoggerFactory.getLogger(PersonPhotoSelector.class);

  private final PhotoServiceClient photoServiceClient;
  private final RetryExecutor retryExecutor;
  private final NotifierSettingsProperties settings;
  private final PhotoServiceProperties photoServiceProperties;
  private final Clock clock;
  private final Random random;

  /** The first person, in shuffled order, with at least one eligible photo wins. */
  public Optional<PersonPhoto> select(
      String apiKey, List<Person> rankedPersons, Set<String> sentAssetIds) {
    final List<Person> shuffled = new ArrayList<>(rankedPersons);
    Collections.shuffle(shuffled, random);
    final Instant cutoff =
        Instant.now(clock).minus(Duration.ofDays(settings.excludeRecentDays()));
    for (Person person : shuffled) {
      final List<PhotoAsset> candidates =
          assetsOf(apiKey, person).stream()
              .filter(asset -> !sentAssetIds.contains(asset.id()))
              .filter(asset -> asset.createdAt() == null || !asset.createdAt().isAfter(cutoff))
              .toList();
      if (candidates.isEmpty()) {
        logger.debug("no eligible photo for person id={} name={}", person.id(), person.name());
        continue;
      }
      final PhotoAsset asset = candidates.get(random.nextInt(candidates.size()));
      return Optional.of(new PersonPhoto(person, asset));
    }
    return Optional.empty();
  }

  private List<PhotoAsset> assetsOf(String apiKey, Person person) {
    try {
      return retryExecutor.withRetry(
          "fetch person assets",
          () ->
              photoServiceClient.fetchPersonAssets(
                  apiKey, person.id(), photoServiceProperties.personAssetPageSize()));
    } catch (PhotoServiceIntegrationException ex) {
      logger.warn("asset lookup failed for person id={}; skipping", person.id());
      return List.of();
    }
  }
}
