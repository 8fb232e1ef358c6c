package dev.memorynotify.notifier.service;

import dev.memorynotify.notifier.model.AssetType;
import dev.memorynotify.notifier.model.Person;
import dev.memorynotify.notifier.model.PhotoAsset;
import dev.memorynotify.notifier.service.dto.AssetResponse;
import dev.memorynotify.notifier.service.dto.PersonResponse;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

final class AssetMapper {

  private AssetMapper() {}

  /** Returns null for assets without an id; callers drop those. */
  static PhotoAsset toAsset(AssetResponse response) {
    if (response == null || response.id() == null || response.id().isBlank()) {
      return null;
    }
    Instant createdAt = parseTimestamp(response.fileCreatedAt());
    if (createdAt == null) {
      createdAt = parseTimestamp(response.localDateTime());
    }
    return new PhotoAsset(response.id(), AssetType.fromValue(response.type()), createdAt);
  }

  static List<PhotoAsset> toAssets(List<AssetResponse> responses) {
    if (responses == null) {
      return List.of();
    }
    return responses.stream().map(AssetMapper::toAsset).filter(Objects::nonNull).toList();
  }

  static List<Person> toPeople(List<PersonResponse> responses) {
    if (responses == null) {
      return List.of();
    }
    final List<Person> people = new ArrayList<>(responses.size());
    for (PersonResponse response : responses) {
      if (response != null && response.id() != null && !response.id().isBlank()) {
        people.add(new Person(response.id(), response.name(), 0L));
      }
    }
    return people;
  }

  static Instant parseTimestamp(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      return OffsetDateTime.parse(value).toInstant();
    } catch (DateTimeParseException ex) {
      return null;
    }
  }
}
