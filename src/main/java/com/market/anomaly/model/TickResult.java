package com.market.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@Schema(description = "Outcome of processing one tick")
public class TickResult {

    @Schema(description = "Tick time in epoch milliseconds", example = "1739886764000")
    long timestamp;

    @Schema(description = "Events detected in this tick, in priority order")
    List<Event> events;

    @Schema(description = "Notifications emitted for this tick")
    List<Notification> notifications;

    @Schema(description = "Market state after this tick")
    MarketState state;

    @Schema(description = "Samples rejected as malformed or out of order, with the reason")
    List<String> rejected;

    @Schema(description = "Instruments skipped because this timestamp was already processed")
    List<String> skipped;
}
