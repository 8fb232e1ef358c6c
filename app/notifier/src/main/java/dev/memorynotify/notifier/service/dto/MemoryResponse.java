/*
 * Where: Photo service DTO
 * What: One entry of GET /api/memories
 * Why: showAt decides the calendar day, data.year the memory year
 */
package dev.memorynotify.notifier.service.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "downstream DTO records only carry data")
public record MemoryResponse(
    String id, String showAt, MemoryDataResponse data, List<AssetResponse> assets) {}
