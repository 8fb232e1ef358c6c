package dev.memorynotify.notifier.service.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MemoryDataResponse(Integer year) {}
