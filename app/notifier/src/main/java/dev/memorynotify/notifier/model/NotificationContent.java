/*
 * Where: Notifier domain model
 * What: A rendered notification ready for delivery
 * Why: Selection and delivery are separate steps; dry runs stop after rendering
 */
package dev.memorynotify.notifier.model;

public record NotificationContent(
    NotificationKind kind,
    String title,
    String message,
    PhotoAsset asset,
    Integer year,
    String personName) {

  public String assetId() {
    return asset == null ? null : asset.id();
  }
}
