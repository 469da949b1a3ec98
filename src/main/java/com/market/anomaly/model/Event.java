package com.market.anomaly.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@Value
@Builder
@JsonPropertyOrder({"event_id", "timestamp", "type", "subtype", "level", "instrument", "data", "description"})
@Schema(description = "An anomaly detected by one rule for one instrument")
public class Event {

    @JsonProperty("event_id")
    @Schema(description = "Content-derived identifier", example = "evt-1739886764000-SSE-sentiment_turning_up")
    String eventId;

    @Schema(description = "Detection time in epoch milliseconds", example = "1739886764000")
    long timestamp;

    @Schema(description = "Event category", example = "ANOMALY_DETECTION")
    EventType type;

    @Schema(description = "Anomaly pattern", example = "sentiment_turning_up")
    EventSubtype subtype;

    @Schema(description = "Severity", example = "medium")
    EventLevel level;

    @Schema(description = "Instrument the rule fired for", example = "SSE")
    String instrument;

    @Schema(description = "Snapshot of the metrics that triggered the event")
    Map<String, Object> data;

    @Schema(description = "Human-readable explanation",
            example = "Volume 1.60B is 1.60x the 30m baseline 1.00B with index +0.60% and limit-ups 25 (was 20)")
    String description;

    /**
     * Builds an event whose id is derived from timestamp, instrument and subtype,
     * so re-evaluating the same input yields the same id.
     */
    public static Event detected(long timestamp, String instrument, EventSubtype subtype,
                                 EventLevel level, Map<String, Object> data, String description) {
        return Event.builder()
                .eventId(idFor(timestamp, instrument, subtype))
                .timestamp(timestamp)
                .type(EventType.ANOMALY_DETECTION)
                .subtype(subtype)
                .level(level)
                .instrument(instrument)
                .data(Collections.unmodifiableMap(new LinkedHashMap<>(data)))
                .description(description)
                .build();
    }

    public static String idFor(long timestamp, String instrument, EventSubtype subtype) {
        return "evt-" + timestamp + "-" + instrument + "-" + subtype.code();
    }
}
