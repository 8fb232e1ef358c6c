/*
 * Where: Notifier selection layer
 * What: Turns a selected asset into notification title and body text
 * Why: Operators configure several phrasings per kind; one is picked at random per send
 */
package dev.memorynotify.notifier.service;

import dev.memorynotify.notifier.config.MessageTemplateProperties;
import dev.memorynotify.notifier.config.NotifierSettingsProperties;
import dev.memorynotify.notifier.model.NotificationContent;
import dev.memorynotify.notifier.model.NotificationKind;
import dev.memorynotify.notifier.model.PersonPhoto;
import dev.memorynotify.notifier.model.PhotoAsset;
import java.util.List;
import java.util.Random;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class MessageRenderer {

  static final String DEFAULT_MEMORY_MESSAGE = "You have memories from {year}!";
  static final String DEFAULT_PERSON_MESSAGE = "Here's a photo of {person_name}!";
  static final String TEST_PREFIX = "[TEST] ";
  static final String VIDEO_PREFIX = "🎬 ";

  private final MessageTemplateProperties templates;
  private final NotifierSettingsProperties settings;
  private final Random random;

  public NotificationContent renderMemory(
      int year, int targetYear, PhotoAsset asset, boolean testMode) {
    final List<String> candidates =
        asset.isVideo() && !templates.videoMemory().isEmpty()
            ? templates.videoMemory()
            : templates.memory();
    final String message =
        pick(candidates, DEFAULT_MEMORY_MESSAGE)
            .replace("{year}", Integer.toString(year))
            .replace("{years_ago}", Integer.toString(targetYear - year));
    final String title = decorate("Memories from " + year, asset, testMode);
    return new NotificationContent(NotificationKind.MEMORY, title, message, asset, year, null);
  }

  public NotificationContent renderPerson(PersonPhoto photo, boolean testMode) {
    final PhotoAsset asset = photo.asset();
    final String name = photo.person().name();
    final List<String> candidates =
        asset.isVideo() && !templates.videoPerson().isEmpty()
            ? templates.videoPerson()
            : templates.person();
    final String message = pick(candidates, DEFAULT_PERSON_MESSAGE).replace("{person_name}", name);
    final String title = decorate("Photo of " + name, asset, testMode);
    return new NotificationContent(NotificationKind.PERSON, title, message, asset, null, name);
  }

  private String decorate(String title, PhotoAsset asset, boolean testMode) {
    String decorated = title;
    if (asset.isVideo() && settings.videoEmoji()) {
      decorated = VIDEO_PREFIX + decorated;
    }
    if (testMode) {
      decorated = TEST_PREFIX + decorated;
    }
    return decorated;
  }

  private String pick(List<String> candidates, String fallback) {
    if (candidates.isEmpty()) {
      return fallback;
    }
    return candidates.get(random.nextInt(candidates.size()));
  }
}
