package dev.memorynotify.notifier.service;

/** Headers and body of one push notification; blank optional fields are not sent. */
public record PushMessage(
    String title, String body, String tags, String priority, String clickUrl, String attachUrl) {}
