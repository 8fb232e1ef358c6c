/*
 * Where: Notifier configuration binding
 * What: Holds push service endpoint, headers and timeouts
 * Why: Notification presentation (tags, priority, click target) differs per installation
 */
package dev.memorynotify.notifier.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "push-service")
public record PushServiceProperties(
    String baseUrl,
    Duration connectTimeout,
    Duration readTimeout,
    String clickUrl,
    String memoryTags,
    String personTags,
    String priority,
    String uploadFilename,
    String uploadTopicPrefix) {

  public PushServiceProperties {
    baseUrl = baseUrl == null || baseUrl.isBlank() ? "https://ntfy.sh" : stripSlash(baseUrl);
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(5) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(30) : readTimeout;
    // blank means "send no Click header"
    clickUrl = clickUrl == null ? "https://my.immich.app/" : clickUrl;
    memoryTags = memoryTags == null || memoryTags.isBlank() ? "camera,calendar" : memoryTags;
    personTags = personTags == null || personTags.isBlank() ? "camera,bust_in_silhouette" : personTags;
    priority = priority == null || priority.isBlank() ? "default" : priority;
    uploadFilename =
        uploadFilename == null || uploadFilename.isBlank() ? "memory.jpg" : uploadFilename;
    uploadTopicPrefix =
        uploadTopicPrefix == null || uploadTopicPrefix.isBlank() ? "upload" : uploadTopicPrefix;
  }

  private static String stripSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }
}
