/*
 * Where: Notifier delivery layer
 * What: Sends one rendered notification with its thumbnail attached when possible
 * Why: A missing image degrades the notification; only a failed publish fails the send
 */
package dev.memorynotify.notifier.service;

import dev.memorynotify.notifier.config.NotifierUser;
import dev.memorynotify.notifier.config.PushServiceProperties;
import dev.memorynotify.notifier.model.NotificationContent;
import dev.memorynotify.notifier.model.NotificationKind;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationDeliveryService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationDeliveryService.class);

  private final PhotoServiceClient photoServiceClient;
  private final PushServiceClient pushServiceClient;
  private final RetryExecutor retryExecutor;
  private final PushServiceProperties pushServiceProperties;

  /**
   * @throws PushServiceIntegrationException when publishing fails after all attempts
   */
  public void deliver(NotifierUser user, NotificationContent content) {
    final String attachUrl = uploadThumbnail(user, content);
    final PushMessage message =
        new PushMessage(
            content.title(),
            content.message(),
            content.kind() == NotificationKind.PERSON
                ? pushServiceProperties.personTags()
                : pushServiceProperties.memoryTags(),
            pushServiceProperties.priority(),
            pushServiceProperties.clickUrl(),
            attachUrl);
    retryExecutor.runWithRetry(
        "publish notification", () -> pushServiceClient.publish(user, message));
    logger.info("notification sent title={} attached={}", content.title(), attachUrl != null);
  }

  private String uploadThumbnail(NotifierUser user, NotificationContent content) {
    final String assetId = content.assetId();
    if (assetId == null) {
      return null;
    }
    final byte[] thumbnail;
    try {
      thumbnail =
          retryExecutor.withRetry(
              "fetch thumbnail", () -> photoServiceClient.fetchThumbnail(user.apiKey(), assetId));
    } catch (PhotoServiceIntegrationException ex) {
      logger.warn("thumbnail unavailable for asset id={}; sending without image", assetId);
      return null;
    }
    try {
      return retryExecutor.withRetry(
          "upload thumbnail", () -> pushServiceClient.uploadAttachment(user, thumbnail));
    } catch (PushServiceIntegrationException ex) {
      logger.warn("thumbnail upload failed for asset id={}; sending without image", assetId);
      return null;
    }
  }
}
