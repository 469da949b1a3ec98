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
 * Detects a volume-led upturn in market sentiment.
 *
 * Logic: current volume exceeds the 30m volume baseline by the spike ratio (default
 * 1.3x), the index is up, and the limit-up count is above its value 15 minutes ago.
 *
 * Example: baseline 1.0B, current 1.6B (1.6x), index +0.6%, limit-ups 20 -> 25 fires
 * at MEDIUM. A ratio of 2.0x or more fires at HIGH.
 */
@Component
public class SentimentTurningUpEvaluator implements RuleEvaluator {

    private final AnomalyProperties properties;

    public SentimentTurningUpEvaluator(AnomalyProperties properties) {
        this.properties = properties;
    }

    @Override
    public EventSubtype getSubtype() {
        return EventSubtype.SENTIMENT_TURNING_UP;
    }

    @Override
    public RuleResult evaluate(EvaluationContext context) throws WindowQueryException {
        AnomalyProperties.Rules rules = properties.getRules();

        double volume = context.latestValue(Metric.VOLUME);
        double baseline = context.baseline(Metric.VOLUME, rules.getVolumeBaselineWindow());
        if (baseline <= 0) {
            return RuleResult.notTriggered(getSubtype(), "Volume baseline is not positive");
        }
        double ratio = volume / baseline;
        if (ratio <= rules.getVolumeSpikeRatio()) {
            return RuleResult.notTriggered(getSubtype(),
                    String.format(Locale.ROOT, "Volume ratio %s within %s", Amounts.ratio(ratio), Amounts.ratio(rules.getVolumeSpikeRatio())));
        }

        double indexChange = context.latestValue(Metric.INDEX_CHANGE);
        if (indexChange <= 0) {
            return RuleResult.notTriggered(getSubtype(), "Index not rising");
        }

        double limitUp = context.latestValue(Metric.LIMIT_UP_COUNT);
        double limitUpBefore = context.valueAt(Metric.LIMIT_UP_COUNT, rules.getLimitUpLookback()).getValue();
        if (limitUp <= limitUpBefore) {
            return RuleResult.notTriggered(getSubtype(), "Limit-up count not expanding");
        }

        EventLevel level = ratio >= rules.getVolumeHighRatio() ? EventLevel.HIGH : EventLevel.MEDIUM;

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("metric", "volume_spike");
        data.put("volume", volume);
        data.put("baseline", Amounts.round(baseline, 2));
        data.put("ratio", Amounts.round(ratio, 4));
        data.put("index_change_pct", indexChange);
        data.put("limit_up_count", limitUp);
        data.put("limit_up_count_before", limitUpBefore);

        String reason = String.format(Locale.ROOT,
                "Sentiment turning up: volume %s is %s the %dm baseline %s, index %s, limit-ups %.0f (was %.0f)",
                Amounts.compact(volume), Amounts.ratio(ratio), rules.getVolumeBaselineWindow().toMinutes(),
                Amounts.compact(baseline), Amounts.signedPct(indexChange), limitUp, limitUpBefore);

        return RuleResult.builder()
                .subtype(getSubtype())
                .triggered(true)
                .level(level)
                .data(data)
                .reason(reason)
                .build();
    }
}
