package com.market.anomaly.model;

public enum IngestOutcome {
    ACCEPTED,
    // same key and timestamp as the latest stored sample, replayed input
    DUPLICATE
}
