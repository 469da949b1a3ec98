package com.market.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "One ingestion cycle delivering one or more samples")
public class Tick {

    @Schema(description = "Tick time in epoch milliseconds", example = "1739886764000")
    private long timestamp;

    @Schema(description = "Samples delivered in this cycle")
    @Builder.Default
    private List<Sample> samples = new ArrayList<>();

    /**
     * Sample timestamp, falling back to the tick timestamp when the sample carries none.
     */
    public long effectiveTimestamp(Sample sample) {
        return sample.getTimestamp() > 0 ? sample.getTimestamp() : timestamp;
    }
}
