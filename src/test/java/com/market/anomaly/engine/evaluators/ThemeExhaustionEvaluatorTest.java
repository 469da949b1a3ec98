package com.market.anomaly.engine.evaluators;

import com.market.anomaly.config.AnomalyProperties;
import com.market.anomaly.engine.RuleMemory;
import com.market.anomaly.engine.RuleResult;
import com.market.anomaly.model.EventLevel;
import com.market.anomaly.model.Metric;
import com.market.anomaly.window.WindowStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.market.anomaly.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;

class ThemeExhaustionEvaluatorTest {

    private AnomalyProperties properties;
    private WindowStore store;
    private ThemeExhaustionEvaluator evaluator;

    @BeforeEach
    void setUp() {
        properties = createProperties();
        store = new WindowStore(properties);
        evaluator = new ThemeExhaustionEvaluator(properties);
    }

    private RuleResult evaluate(double price, double vwap, double sectorStep) throws Exception {
        for (int i = 0; i <= 15; i++) {
            store.ingest(createSample("SEMI", Metric.SECTOR_INDEX, minute(i), 1000 + sectorStep * i));
        }
        store.ingest(createSample("SEMI", Metric.LEADER_PRICE, minute(15), price));
        store.ingest(createSample("SEMI", Metric.LEADER_VWAP, minute(15), vwap));
        return evaluator.evaluate(createContext(store, "SEMI", minute(15), new RuleMemory(), properties));
    }

    @Test
    void evaluate_leaderFarBelowVwapWithFallingSector_firesMedium() throws Exception {
        RuleResult result = evaluate(97.0, 100.0, -1.0);

        assertThat(result.isTriggered()).isTrue();
        assertThat(result.getLevel()).isEqualTo(EventLevel.MEDIUM);
        assertThat(result.getReason()).contains("3.00% below VWAP", "falling");
    }

    @Test
    void evaluate_leaderSlightlyBelowVwapWithFlatSector_firesLow() throws Exception {
        RuleResult result = evaluate(99.0, 100.0, 0.0);

        assertThat(result.getLevel()).isEqualTo(EventLevel.LOW);
        assertThat(result.getReason()).contains("flat");
    }

    @Test
    void evaluate_sectorStillRising_doesNotFire() throws Exception {
        assertThat(evaluate(97.0, 100.0, 1.0).isTriggered()).isFalse();
    }

    @Test
    void evaluate_leaderAboveVwap_doesNotFire() throws Exception {
        assertThat(evaluate(101.0, 100.0, -1.0).isTriggered()).isFalse();
    }
}
