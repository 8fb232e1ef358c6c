package dev.memorynotify.notifier.service.dto;

import java.util.List;

public record SearchMetadataRequest(List<String> personIds, int size) {

  public static SearchMetadataRequest forPerson(String personId, int size) {
    return new SearchMetadataRequest(List.of(personId), size);
  }
}
