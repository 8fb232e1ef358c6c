package dev.memorynotify.notifier.model;

public enum NotificationKind {
  MEMORY,
  PERSON
}
