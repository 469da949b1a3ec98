package com.market.anomaly.window;

import com.market.anomaly.model.MetricKey;

public class InsufficientDataException extends WindowQueryException {

    public InsufficientDataException(MetricKey key, String message) {
        super(key, message);
    }
}
