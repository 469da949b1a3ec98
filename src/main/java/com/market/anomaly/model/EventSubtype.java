package com.market.anomaly.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * The six anomaly patterns. Priority 1 is the most urgent; {@code strengthening}
 * tells whether the pattern pushes the sentiment score up or down.
 */
public enum EventSubtype {
    SENTIMENT_TURNING_DOWN(1, false, "Sentiment turning down"),
    FLOW_WITHDRAWAL(1, false, "Northbound withdrawal"),
    THEME_EXHAUSTION(2, false, "Theme exhaustion"),
    FLOW_REVERSAL(2, true, "Northbound flow reversal"),
    SENTIMENT_TURNING_UP(3, true, "Sentiment turning up"),
    THEME_EMERGENCE(3, true, "Theme emergence");

    private final int priority;
    private final boolean strengthening;
    private final String displayName;

    EventSubtype(int priority, boolean strengthening, String displayName) {
        this.priority = priority;
        this.strengthening = strengthening;
        this.displayName = displayName;
    }

    public int getPriority() {
        return priority;
    }

    public String getDisplayName() {
        return displayName;
    }

    public int direction() {
        return strengthening ? 1 : -1;
    }

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
