/*
 * Where: Notifier configuration binding
 * What: One notification recipient with photo service credential and push topic
 * Why: Credentials come from the environment, so a missing key is a per-user failure, not a startup error
 */
package dev.memorynotify.notifier.config;

import jakarta.validation.constraints.NotBlank;

public record NotifierUser(
    @NotBlank String name,
    String apiKey,
    @NotBlank String pushTopic,
    String pushUsername,
    String pushPassword,
    Boolean enabled) {

  public NotifierUser {
    enabled = enabled == null ? Boolean.TRUE : enabled;
  }

  public boolean isActive() {
    return Boolean.TRUE.equals(enabled);
  }

  public boolean hasApiKey() {
    return apiKey != null && !apiKey.isBlank();
  }

  public boolean hasPushCredentials() {
    return pushUsername != null
        && !pushUsername.isBlank()
        && pushPassword != null
        && !pushPassword.isBlank();
  }

  @Override
  public String toString() {
    // credentials stay out of logs
    return "NotifierUser[name=" + name + ", pushTopic=" + pushTopic + ", enabled=" + enabled + "]";
  }
}
