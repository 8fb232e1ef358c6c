/*
 * Where: Notifier domain model
 * What: A photo or video known to the photo service
 * Why: Selection only needs identity, media type and capture time
 */
package dev.memorynotify.notifier.model;

import java.time.Instant;

public record PhotoAsset(String id, AssetType type, Instant createdAt) {

  public boolean isVideo() {
    return type == AssetType.VIDEO;
  }
}
