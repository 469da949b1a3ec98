package com.market.anomaly.model;

import lombok.Value;

/**
 * Window key: one metric of one instrument.
 */
@Value
public class MetricKey {

    String instrument;
    Metric metric;

    public static MetricKey of(String instrument, Metric metric) {
        return new MetricKey(instrument, metric);
    }

    @Override
    public String toString() {
        return instrument + "/" + metric;
    }
}
