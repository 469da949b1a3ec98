package com.market.anomaly.engine.evaluators;

import com.market.anomaly.config.AnomalyProperties;
import com.market.anomaly.engine.Amounts;
import com.market.anomaly.engine.EvaluationContext;
import com.market.anomaly.engine.RuleEvaluator;
import com.market.anomaly.engine.RuleResult;
import com.market.anomaly.model.EventLevel;
import com.market.anomaly.model.EventSubtype;
import com.market.anomaly.model.Metric;
import com.market.anomaly.window.WindowQueryException;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Detects an exhausted theme: the leading stock trades below its VWAP while the
 * sector index trend over 15 minutes is flat or falling.
 *
 * A leader 2% or more below VWAP fires at MEDIUM, otherwise LOW.
 */
@Component
public class ThemeExhaustionEvaluator implements RuleEvaluator {

    private final AnomalyProperties properties;

    public ThemeExhaustionEvaluator(AnomalyProperties properties) {
        this.properties = properties;
    }

    @Override
    public EventSubtype getSubtype() {
        return EventSubtype.THEME_EXHAUSTION;
    }

    @Override
    public RuleResult evaluate(EvaluationContext context) throws WindowQueryException {
        AnomalyProperties.Rules rules = properties.getRules();

        double price = context.latestValue(Metric.LEADER_PRICE);
        double vwap = context.latestValue(Metric.LEADER_VWAP);
        if (vwap <= 0 || price >= vwap) {
            return RuleResult.notTriggered(getSubtype(), "Leader holding above VWAP");
        }

        context.latest(Metric.SECTOR_INDEX);
        double sectorSlope = context.slope(Metric.SECTOR_INDEX, rules.getSectorTrendWindow());
        if (sectorSlope > rules.getSectorFlatSlope()) {
            return RuleResult.notTriggered(getSubtype(), "Sector index still rising");
        }

        double belowPct = (vwap - price) / vwap * 100.0;
        EventLevel level = belowPct >= rules.getLeaderBelowVwapMediumPct() ? EventLevel.MEDIUM : EventLevel.LOW;

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("metric", "leader_below_vwap");
        data.put("leader_price", price);
        data.put("leader_vwap", vwap);
        data.put("below_vwap_pct", Amounts.round(belowPct, 4));
        data.put("sector_slope_per_minute", Amounts.round(sectorSlope, 6));

        String reason = String.format(Locale.ROOT,
                "Theme exhaustion: leader %.2f is %.2f%% below VWAP %.2f while the sector index is %s over %dm",
                price, belowPct, vwap, sectorSlope < rules.getSectorFlatSlope() ? "falling" : "flat",
                rules.getSectorTrendWindow().toMinutes());

        return RuleResult.builder()
                .subtype(getSubtype())
                .triggered(true)
                .level(level)
                .data(data)
                .reason(reason)
                .build();
    }
}
