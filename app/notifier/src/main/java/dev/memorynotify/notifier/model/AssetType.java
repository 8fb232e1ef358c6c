package dev.memorynotify.notifier.model;

public enum AssetType {
  IMAGE,
  VIDEO;

  /** Unknown or missing types are treated as images. */
  public static AssetType fromValue(String value) {
    if (value != null && "VIDEO".equalsIgnoreCase(value.trim())) {
      return VIDEO;
    }
    return IMAGE;
  }
}
