package com.market.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A timestamped observation of one metric for one instrument")
public class Sample {

    @Schema(description = "Instrument or market segment the metric belongs to", example = "SSE")
    private String instrument;

    @Schema(description = "Metric name", example = "VOLUME")
    private Metric metric;

    @Schema(description = "Observation time in epoch milliseconds. Inherits the tick timestamp when 0.",
            example = "1739886764000")
    private long timestamp;

    @Schema(description = "Scalar value. Ignored for SECTOR_RANKING.", example = "1.6E9")
    private double value;

    @Schema(description = "Ranked labels for vector metrics (SECTOR_RANKING), best first",
            example = "[\"Semiconductor\", \"Banking\", \"Liquor\"]")
    private List<String> labels;

    public MetricKey key() {
        return MetricKey.of(instrument, metric);
    }
}
