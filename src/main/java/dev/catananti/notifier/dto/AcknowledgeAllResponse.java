package dev.catananti.notifier.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AcknowledgeAllResponse(
        @JsonProperty("acknowledged_count") int acknowledgedCount
) {}
