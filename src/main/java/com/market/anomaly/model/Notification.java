package com.market.anomaly.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
@JsonPropertyOrder({"notification_id", "timestamp", "format", "title", "lines", "related_events"})
@Schema(description = "A message synthesized from one or more events for the delivery collaborator")
public class Notification {

    @JsonProperty("notification_id")
    @Schema(description = "Identifier, timestamp plus per-process sequence", example = "ntf-1739886764000-000001")
    String notificationId;

    @Schema(description = "Emission time in epoch milliseconds", example = "1739886764000")
    long timestamp;

    @Schema(description = "flash, card or alert", example = "card")
    NotificationFormat format;

    @Schema(description = "Headline", example = "Multi-indicator resonance")
    String title;

    @Singular
    @Schema(description = "Body lines in display order")
    List<String> lines;

    @Singular
    @JsonProperty("related_events")
    @Schema(description = "Ids of the events this notification reports")
    List<String> relatedEvents;
}
