package com.market.anomaly.exception;

import com.market.anomaly.model.MetricKey;
import lombok.Getter;

/**
 * A sample that is malformed or arrives out of order for its key. The sample is
 * rejected; other keys keep flowing.
 */
@Getter
public class InvalidSampleException extends RuntimeException {

    private final MetricKey key;
    private final String reason;

    public InvalidSampleException(MetricKey key, String reason, String message) {
        super(message);
        this.key = key;
        this.reason = reason;
    }
}
