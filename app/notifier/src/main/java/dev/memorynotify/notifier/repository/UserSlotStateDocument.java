package dev.memorynotify.notifier.repository;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
record UserSlotStateDocument(
    @JsonProperty("slots_date") String slotsDate,
    @JsonProperty("slots_sent") List<Integer> slotsSent,
    @JsonProperty("assets_sent_today") List<String> assetsSentToday,
    @JsonProperty("last_slot_time") String lastSlotTime) {}
