package com.market.anomaly.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum EventLevel {
    LOW,
    MEDIUM,
    HIGH;

    public boolean isHigherThan(EventLevel other) {
        return other == null || compareTo(other) > 0;
    }

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
