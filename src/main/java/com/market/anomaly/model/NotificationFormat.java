package com.market.anomaly.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum NotificationFormat {
    // one line
    FLASH,
    // up to three event lines plus state
    CARD,
    // strong signal
    ALERT;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
