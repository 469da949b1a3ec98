package com.market.anomaly.model;

/**
 * Metrics the ingestion collaborator delivers. {@link #SECTOR_RANKING} is a vector metric:
 * its labels carry the sector names ordered by rank and its value is ignored.
 */
public enum Metric {
    VOLUME,
    INDEX_CHANGE,
    LIMIT_UP_COUNT,
    LIMIT_DOWN_COUNT,
    BOMB_RATE,
    NORTHBOUND_FLOW,
    LEADER_PRICE,
    LEADER_VWAP,
    SECTOR_INDEX,
    SECTOR_VOLUME,
    SECTOR_RANKING
}
