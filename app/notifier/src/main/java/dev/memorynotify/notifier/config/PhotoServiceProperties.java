/*
 * Where: Notifier configuration binding
 * What: Holds photo service endpoints, auth header and timeouts
 * Why: Keep upstream URLs and per-call timeouts tunable per deployment
 */
package dev.memorynotify.notifier.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "photo-service")
public record PhotoServiceProperties(
    String baseUrl,
    String apiKeyHeaderName,
    Duration connectTimeout,
    Duration readTimeout,
    String memoriesPath,
    String peoplePath,
    String searchMetadataPath,
    String assetPath,
    String thumbnailPath,
    String thumbnailSize,
    Integer personAssetPageSize) {

  public PhotoServiceProperties {
    baseUrl = baseUrl == null || baseUrl.isBlank() ? "http://immich-server:2283" : stripSlash(baseUrl);
    apiKeyHeaderName =
        apiKeyHeaderName == null || apiKeyHeaderName.isBlank() ? "x-api-key" : apiKeyHeaderName;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(5) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(30) : readTimeout;
    memoriesPath = memoriesPath == null || memoriesPath.isBlank() ? "/api/memories" : memoriesPath;
    peoplePath = peoplePath == null || peoplePath.isBlank() ? "/api/people" : peoplePath;
    searchMetadataPath =
        searchMetadataPath == null || searchMetadataPath.isBlank()
            ? "/api/search/metadata"
            : searchMetadataPath;
    assetPath = assetPath == null || assetPath.isBlank() ? "/api/assets/{assetId}" : assetPath;
    thumbnailPath =
        thumbnailPath == null || thumbnailPath.isBlank()
            ? "/api/assets/{assetId}/thumbnail?size={size}"
            : thumbnailPath;
    thumbnailSize = thumbnailSize == null || thumbnailSize.isBlank() ? "thumbnail" : thumbnailSize;
    personAssetPageSize =
        personAssetPageSize == null || personAssetPageSize <= 0 ? 100 : personAssetPageSize;
  }

  private static String stripSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }
}
