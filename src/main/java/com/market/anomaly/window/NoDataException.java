package com.market.anomaly.window;

import com.market.anomaly.model.MetricKey;

public class NoDataException extends WindowQueryException {

    public NoDataException(MetricKey key) {
        super(key, "No samples for " + key);
    }
}
