/*
 * Where: Photo service DTO
 * What: Asset as returned in memories, search results and asset detail
 * Why: The detail endpoint adds recognized people; listings leave it empty
 */
package dev.memorynotify.notifier.service.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "downstream DTO records only carry data")
public record AssetResponse(
    String id,
    String type,
    String fileCreatedAt,
    String localDateTime,
    List<PersonResponse> people) {}
