package com.market.anomaly.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum MarketStatus {
    // overheated / risk
    RED,
    // oscillating, observing
    YELLOW,
    GREEN;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
