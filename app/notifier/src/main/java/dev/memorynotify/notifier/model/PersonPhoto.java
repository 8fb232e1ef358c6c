package dev.memorynotify.notifier.model;

public record PersonPhoto(Person person, PhotoAsset asset) {}
