package com.market.anomaly.model;

import lombok.Value;

/**
 * Market state before and after one applied batch.
 */
@Value
public class StateTransition {

    MarketState previous;
    MarketState current;

    public boolean isStatusChanged() {
        return previous.getStatus() != current.getStatus();
    }

    /**
     * True when the status moved into RED or out of it.
     */
    public boolean isRedCrossing() {
        return isStatusChanged()
                && (previous.getStatus() == MarketStatus.RED || current.getStatus() == MarketStatus.RED);
    }

    public double scoreDelta() {
        return current.getSentimentScore() - previous.getSentimentScore();
    }
}
