package com.market.anomaly.exception;

/**
 * Invalid threshold or window configuration. Raised at startup, before any traffic is accepted.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }
}
