/*
 * Where: Notifier domain model
 * What: A recognized person with an approximate asset count
 * Why: Ranking and face preference both key on person id and name
 */
package dev.memorynotify.notifier.model;

public record Person(String id, String name, long assetCount) {

  public boolean isNamed() {
    return name != null && !name.isBlank();
  }

  public Person withAssetCount(long count) {
    return new Person(id, name, count);
  }
}
