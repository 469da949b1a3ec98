package com.market.anomaly.window;

import com.market.anomaly.model.MetricKey;

/**
 * A window query that cannot produce a real reading. Not an error: rules treat it
 * as "does not fire".
 */
public abstract class WindowQueryException extends Exception {

    private final MetricKey key;

    protected WindowQueryException(MetricKey key, String message) {
        super(message);
        this.key = key;
    }

    public MetricKey getKey() {
        return key;
    }
}
