/*
 * Where: Notifier configuration binding
 * What: Holds message template sets for memory and person notifications
 * Why: Wording is user-facing and localised by operators, not by code
 */
package dev.memorynotify.notifier.config;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "notifier.messages")
public record MessageTemplateProperties(
    List<String> memory, List<String> person, List<String> videoMemory, List<String> videoPerson) {

  public MessageTemplateProperties {
    memory = memory == null ? List.of() : List.copyOf(memory);
    person = person == null ? List.of() : List.copyOf(person);
    videoMemory = videoMemory == null ? List.of() : List.copyOf(videoMemory);
    videoPerson = videoPerson == null ? List.of() : List.copyOf(videoPerson);
  }
}
