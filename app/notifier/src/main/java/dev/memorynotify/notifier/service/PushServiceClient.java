/*
 * Where: Notifier integration layer
 * What: Uploads thumbnails and publishes notifications to the push service
 * Why: Keep header encoding, basic auth and error mapping in one place
 */
package dev.memorynotify.notifier.service;

import dev.memorynotify.notifier.config.NotifierUser;
import dev.memorynotify.notifier.config.PushServiceProperties;
import dev.memorynotify.notifier.service.dto.AttachmentUploadResponse;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Service
public class PushServiceClient {

  private static final Logger logger = LoggerFactory.getLogger(PushServiceClient.class);

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient is a shared Spring-managed component")
  private final RestClient pushRestClient;

  private final PushServiceProperties properties;

  public PushServiceClient(RestClient pushRestClient, PushServiceProperties properties) {
    this.pushRestClient = pushRestClient;
    this.properties = properties;
  }

  /** Uploads an image to a throwaway topic and returns the hosted attachment URL. */
  public String uploadAttachment(NotifierUser user, byte[] image) {
    validateUser(user);
    if (image == null || image.length == 0) {
      throw new IllegalArgumentException("image is required");
    }
    final String topic = properties.uploadTopicPrefix() + "-" + UUID.randomUUID();
    try {
      final AttachmentUploadResponse response =
          pushRestClient
              .put()
              .uri("/{topic}", topic)
              .headers(headers -> applyAuth(headers, user))
              .header("Filename", properties.uploadFilename())
              .contentType(MediaType.APPLICATION_OCTET_STREAM)
              .body(image)
              .retrieve()
              .body(AttachmentUploadResponse.class);
      if (response == null
          || response.attachment() == null
          || isBlank(response.attachment().url())) {
        throw new PushServiceIntegrationException(
            PushServiceIntegrationException.Reason.INVALID_RESPONSE,
            "push service upload response has no attachment url");
      }
      return response.attachment().url();
    } catch (RestClientResponseException ex) {
      throw mapResponseException(ex, "uploadAttachment");
    } catch (ResourceAccessException ex) {
      throw mapResourceException(ex, "uploadAttachment");
    } catch (PushServiceIntegrationException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      logger.warn("push service uploadAttachment response parse failed", ex);
      throw new PushServiceIntegrationException(
          PushServiceIntegrationException.Reason.INVALID_RESPONSE,
          "push service response parse failed",
          ex);
    }
  }

  public void publish(NotifierUser user, PushMessage message) {
    validateUser(user);
    if (message == null || isBlank(message.body())) {
      throw new IllegalArgumentException("message body is required");
    }
    try {
      final RestClient.RequestBodySpec request =
          pushRestClient
              .post()
              .uri("/{topic}", user.pushTopic())
              .headers(headers -> applyAuth(headers, user))
              .contentType(new MediaType(MediaType.TEXT_PLAIN, StandardCharsets.UTF_8));
      putIfPresent(request, "Title", encodeHeaderValue(message.title()));
      putIfPresent(request, "Tags", message.tags());
      putIfPresent(request, "Priority", message.priority());
      putIfPresent(request, "Click", message.clickUrl());
      putIfPresent(request, "Attach", message.attachUrl());
      request.body(message.body().getBytes(StandardCharsets.UTF_8)).retrieve().toBodilessEntity();
    } catch (RestClientResponseException ex) {
      throw mapResponseException(ex, "publish");
    } catch (ResourceAccessException ex) {
      throw mapResourceException(ex, "publish");
    }
  }

  /** HTTP header values must be ASCII; anything else is percent-encoded as UTF-8. */
  static String encodeHeaderValue(String value) {
    if (value == null) {
      return null;
    }
    if (StandardCharsets.US_ASCII.newEncoder().canEncode(value)) {
      return value;
    }
    return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
  }

  private void applyAuth(HttpHeaders headers, NotifierUser user) {
    if (user.hasPushCredentials()) {
      headers.setBasicAuth(user.pushUsername(), user.pushPassword(), StandardCharsets.UTF_8);
    }
  }

  private void putIfPresent(RestClient.RequestBodySpec request, String name, String value) {
    if (!isBlank(value)) {
      request.header(name, value);
    }
  }

  private PushServiceIntegrationException mapResponseException(
      RestClientResponseException ex, String operation) {
    logger.warn(
        "push service {} failed with http status={} statusText={}",
        operation,
        ex.getStatusCode().value(),
        ex.getStatusText());
    if (ex.getStatusCode().value() == 401) {
      return new PushServiceIntegrationException(
          PushServiceIntegrationException.Reason.UNAUTHORIZED, "push service rejected credentials", ex);
    }
    if (ex.getStatusCode().value() == 403) {
      return new PushServiceIntegrationException(
          PushServiceIntegrationException.Reason.FORBIDDEN, "push service denied topic access", ex);
    }
    if (ex.getStatusCode().is5xxServerError()) {
      return new PushServiceIntegrationException(
          PushServiceIntegrationException.Reason.BAD_GATEWAY, "push service server error", ex);
    }
    return new PushServiceIntegrationException(
        PushServiceIntegrationException.Reason.BAD_GATEWAY, "push service request failed", ex);
  }

  private PushServiceIntegrationException mapResourceException(
      ResourceAccessException ex, String operation) {
    if (isTimeout(ex)) {
      logger.warn("push service {} timed out", operation);
      return new PushServiceIntegrationException(
          PushServiceIntegrationException.Reason.TIMEOUT, "push service request timeout", ex);
    }
    logger.warn("push service {} connection failed", operation, ex);
    return new PushServiceIntegrationException(
        PushServiceIntegrationException.Reason.BAD_GATEWAY, "push service connection failed", ex);
  }

  private void validateUser(NotifierUser user) {
    if (user == null || isBlank(user.pushTopic())) {
      throw new IllegalArgumentException("push topic is required");
    }
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
