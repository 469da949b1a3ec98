package com.market.anomaly.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
@JsonPropertyOrder({"timestamp", "status", "sentiment_score", "main_driver", "summary"})
@Schema(description = "Aggregated market signal")
public class MarketState {

    @Schema(description = "Time of the last update in epoch milliseconds", example = "1739886764000")
    long timestamp;

    @Schema(description = "red (overheated/risk), yellow (oscillating), green", example = "yellow")
    MarketStatus status;

    @JsonProperty("sentiment_score")
    @Schema(description = "Bounded sentiment accumulator in [0, 100], mean-reverting to 50", example = "65.0")
    double sentimentScore;

    @JsonProperty("main_driver")
    @Schema(description = "Description of the highest-priority recent event",
            example = "Northbound withdrawal: 1.20B net outflow over 10m")
    String mainDriver;

    @Schema(description = "Short textual summary of the current state")
    String summary;

    public static MarketState initial(long timestamp) {
        return MarketState.builder()
                .timestamp(timestamp)
                .status(MarketStatus.YELLOW)
                .sentimentScore(50.0)
                .mainDriver("Initialization")
                .summary("System starting up")
                .build();
    }
}
