/*
 * Where: Notifier service layer
 * What: Orders named people by approximate photo count and keeps the top N
 * Why: Person slots and face preference favour the most-photographed people
 */
package dev.memorynotify.notifier.service;

import dev.memorynotify.notifier.model.Person;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class PersonRanker {

  private static final Logger logger = LoggerFactory.getLogger(PersonRanker.class);

  private final PhotoServiceClient photoServiceClient;
  private final RetryExecutor retryExecutor;

  /**
   * Fails with {@link PhotoServiceIntegrationException} only when the people listing itself
   * cannot be fetched; a failed count keeps the person with count 0.
   */
  public List<Person> rankTopPersons(String apiKey, int limit) {
    if (limit <= 0) {
      return List.of();
    }
    final List<Person> people =
        retryExecutor.withRetry("fetch people", () -> photoServiceClient.fetchPeople(apiKey));
    final List<Person> counted = new ArrayList<>();
    for (Person person : people) {
      if (!person.isNamed()) {
        continue;
      }
      counted.add(person.withAssetCount(countAssets(apiKey, person)));
    }
    counted.sort(Comparator.comparingLong(Person::assetCount).reversed());
    final List<Person> top = List.copyOf(counted.subList(0, Math.min(limit, counted.size())));
    logger.info(
        "ranked {} named people, top={}",
        counted.size(),
        top.stream().map(person -> person.name() + "(" + person.assetCount() + ")").toList());
    return top;
  }

  private long countAssets(String apiKey, Person person) {
    try {
      return retryExecutor.withRetry(
          "count person assets",
          () -> photoServiceClient.countPersonAssets(apiKey, person.id()));
    } catch (PhotoServiceIntegrationException ex) {
      logger.warn(
          "asset count unavailable for person id={} name={}; ranking with 0",
          person.id(),
          person.name());
      return 0L;
    }
  }
}
