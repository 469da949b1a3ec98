package com.market.anomaly.model;

public enum EventType {
    ANOMALY_DETECTION
}
