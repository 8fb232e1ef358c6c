package dev.memorynotify.notifier.repository;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Map;

/** On-disk shape of the state file: {@code {"users": {"<name>": {...}}}}. */
@JsonIgnoreProperties(ignoreUnknown = true)
record StateFileDocument(Map<String, UserSlotStateDocument> users) {}
