/*
 * Where: Notifier integration layer
 * What: Read-only queries against the photo service (memories, people, assets, thumbnails)
 * Why: Keep HTTP details and response-shape variants out of the selection logic
 */
package dev.memorynotify.notifier.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.memorynotify.notifier.config.PhotoServiceProperties;
import dev.memorynotify.notifier.model.Person;
import dev.memorynotify.notifier.model.PhotoAsset;
import dev.memorynotify.notifier.service.dto.AssetResponse;
import dev.memorynotify.notifier.service.dto.MemoryResponse;
import dev.memorynotify.notifier.service.dto.PersonResponse;
import dev.memorynotify.notifier.service.dto.SearchMetadataRequest;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import java.util.Arrays;
import java.util.List;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Service
public class PhotoServiceClient {

  private static final Logger logger = LoggerFactory.getLogger(PhotoServiceClient.class);
  private static final TypeReference<List<PersonResponse>> PEOPLE = new TypeReference<>() {};
  private static final TypeReference<List<AssetResponse>> ASSETS = new TypeReference<>() {};

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient is a shared Spring-managed component")
  private final RestClient photoRestClient;

  private final PhotoServiceProperties properties;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper is a shared Spring-managed component")
  private final ObjectMapper objectMapper;

  public PhotoServiceClient(
      RestClient photoRestClient, PhotoServiceProperties properties, ObjectMapper objectMapper) {
    this.photoRestClient = photoRestClient;
    this.properties = properties;
    this.objectMapper = objectMapper;
  }

  public List<MemoryResponse> fetchMemories(String apiKey) {
    validateApiKey(apiKey);
    return call(
        "fetchMemories",
        () -> {
          final MemoryResponse[] body =
              photoRestClient
                  .get()
                  .uri(properties.memoriesPath())
                  .header(properties.apiKeyHeaderName(), apiKey)
                  .accept(MediaType.APPLICATION_JSON)
                  .retrieve()
                  .body(MemoryResponse[].class);
          if (body == null) {
            throw invalid("memories response is empty");
          }
          return Arrays.asList(body);
        });
  }

  public List<Person> fetchPeople(String apiKey) {
    validateApiKey(apiKey);
    return call(
        "fetchPeople",
        () -> {
          final JsonNode body =
              photoRestClient
                  .get()
                  .uri(properties.peoplePath())
                  .header(properties.apiKeyHeaderName(), apiKey)
                  .accept(MediaType.APPLICATION_JSON)
                  .retrieve()
                  .body(JsonNode.class);
          return AssetMapper.toPeople(decodePeople(body));
        });
  }

  public List<PhotoAsset> fetchPersonAssets(String apiKey, String personId, int pageSize) {
    validateApiKey(apiKey);
    validateId(personId, "personId");
    return call(
        "fetchPersonAssets",
        () -> AssetMapper.toAssets(decodeSearchItems(search(apiKey, personId, pageSize))));
  }

  /** Approximate asset count of one person, using a size-1 search. */
  public long countPersonAssets(String apiKey, String personId) {
    validateApiKey(apiKey);
    validateId(personId, "personId");
    return call("countPersonAssets", () -> decodeSearchTotal(search(apiKey, personId, 1)));
  }

  public List<Person> fetchAssetPeople(String apiKey, String assetId) {
    validateApiKey(apiKey);
    validateId(assetId, "assetId");
    return call(
        "fetchAssetPeople",
        () -> {
          final AssetResponse body =
              photoRestClient
                  .get()
                  .uri(properties.assetPath(), assetId)
                  .header(properties.apiKeyHeaderName(), apiKey)
                  .accept(MediaType.APPLICATION_JSON)
                  .retrieve()
                  .body(AssetResponse.class);
          if (body == null) {
            throw invalid("asset response is empty");
          }
          return AssetMapper.toPeople(body.people());
        });
  }

  public byte[] fetchThumbnail(String apiKey, String assetId) {
    validateApiKey(apiKey);
    validateId(assetId, "assetId");
    return call(
        "fetchThumbnail",
        () -> {
          final byte[] body =
              photoRestClient
                  .get()
                  .uri(properties.thumbnailPath(), assetId, properties.thumbnailSize())
                  .header(properties.apiKeyHeaderName(), apiKey)
                  .retrieve()
                  .body(byte[].class);
          if (body == null || body.length == 0) {
            throw invalid("thumbnail is empty");
          }
          return body;
        });
  }

  private JsonNode search(String apiKey, String personId, int size) {
    final JsonNode body =
        photoRestClient
            .post()
            .uri(properties.searchMetadataPath())
            .header(properties.apiKeyHeaderName(), apiKey)
            .contentType(MediaType.APPLICATION_JSON)
            .accept(MediaType.APPLICATION_JSON)
            .body(SearchMetadataRequest.forPerson(personId, size))
            .retrieve()
            .body(JsonNode.class);
    if (body == null) {
      throw invalid("search response is empty");
    }
    return body;
  }

  // GET /api/people answers either [...] or {"people": [...]}
  private List<PersonResponse> decodePeople(JsonNode body) {
    if (body == null) {
      throw invalid("people response is empty");
    }
    if (body.isArray()) {
      return objectMapper.convertValue(body, PEOPLE);
    }
    final JsonNode people = body.get("people");
    if (people != null && people.isArray()) {
      return objectMapper.convertValue(people, PEOPLE);
    }
    throw invalid("people response has unexpected shape");
  }

  // search answers either {"assets": {"items": [...], "total": n}} or {"assets": [...]}
  private List<AssetResponse> decodeSearchItems(JsonNode body) {
    final JsonNode assets = body.get("assets");
    if (assets == null || assets.isNull()) {
      throw invalid("search response has no assets");
    }
    if (assets.isArray()) {
      return objectMapper.convertValue(assets, ASSETS);
    }
    final JsonNode items = assets.get("items");
    if (items != null && items.isArray()) {
      return objectMapper.convertValue(items, ASSETS);
    }
    throw invalid("search response has unexpected shape");
  }

  private long decodeSearchTotal(JsonNode body) {
    final JsonNode assets = body.get("assets");
    if (assets != null && assets.isObject()) {
      final JsonNode total = assets.get("total");
      if (total != null && total.canConvertToLong()) {
        return total.asLong();
      }
    }
    return decodeSearchItems(body).size();
  }

  private <T> T call(String operation, Supplier<T> action) {
    try {
      return action.get();
    } catch (RestClientResponseException ex) {
      throw mapResponseException(ex, operation);
    } catch (ResourceAccessException ex) {
      throw mapResourceException(ex, operation);
    } catch (PhotoServiceIntegrationException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      logger.warn("photo service {} response parse failed", operation, ex);
      throw new PhotoServiceIntegrationException(
          PhotoServiceIntegrationException.Reason.INVALID_RESPONSE,
          "photo service response parse failed",
          ex);
    }
  }

  private PhotoServiceIntegrationException mapResponseException(
      RestClientResponseException ex, String operation) {
    logger.warn(
        "photo service {} failed with http status={} statusText={}",
        operation,
        ex.getStatusCode().value(),
        ex.getStatusText());
    final int status = ex.getStatusCode().value();
    if (status == 401 || status == 403) {
      return new PhotoServiceIntegrationException(
          PhotoServiceIntegrationException.Reason.UNAUTHORIZED, "photo service rejected api key", ex);
    }
    if (status == 404) {
      return new PhotoServiceIntegrationException(
          PhotoServiceIntegrationException.Reason.NOT_FOUND, "photo service resource not found", ex);
    }
    if (ex.getStatusCode().is5xxServerError()) {
      return new PhotoServiceIntegrationException(
          PhotoServiceIntegrationException.Reason.BAD_GATEWAY, "photo service server error", ex);
    }
    return new PhotoServiceIntegrationException(
        PhotoServiceIntegrationException.Reason.BAD_GATEWAY, "photo service request failed", ex);
  }

  private PhotoServiceIntegrationException mapResourceException(
      ResourceAccessException ex, String operation) {
    if (isTimeout(ex)) {
      logger.warn("photo service {} timed out", operation);
      return new PhotoServiceIntegrationException(
          PhotoServiceIntegrationException.Reason.TIMEOUT, "photo service request timeout", ex);
    }
    logger.warn("photo service {} connection failed", operation, ex);
    return new PhotoServiceIntegrationException(
        PhotoServiceIntegrationException.Reason.BAD_GATEWAY, "photo service connection failed", ex);
  }

  private PhotoServiceIntegrationException invalid(String message) {
    return new PhotoServiceIntegrationException(
        PhotoServiceIntegrationException.Reason.INVALID_RESPONSE, message);
  }

  private void validateApiKey(String apiKey) {
    if (apiKey == null || apiKey.isBlank()) {
      throw new IllegalArgumentException("apiKey is required");
    }
  }

  private void validateId(String id, String name) {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException(name + " is required");
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
}
