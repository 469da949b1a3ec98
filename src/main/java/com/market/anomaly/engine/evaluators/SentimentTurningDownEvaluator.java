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
 * Detects deteriorating sentiment: the index is down, more than 3 stocks are limit-down
 * and more than 30% of limit-up attempts fail to hold (bomb rate).
 *
 * Level is HIGH once the bomb rate reaches 50% or limit-downs reach 10, MEDIUM otherwise.
 */
@Component
public class SentimentTurningDownEvaluator implements RuleEvaluator {

    private final AnomalyProperties properties;

    public SentimentTurningDownEvaluator(AnomalyProperties properties) {
        this.properties = properties;
    }

    @Override
    public EventSubtype getSubtype() {
        return EventSubtype.SENTIMENT_TURNING_DOWN;
    }

    @Override
    public RuleResult evaluate(EvaluationContext context) throws WindowQueryException {
        AnomalyProperties.Rules rules = properties.getRules();

        double indexChange = context.latestValue(Metric.INDEX_CHANGE);
        double limitDown = context.latestValue(Metric.LIMIT_DOWN_COUNT);
        double bombRate = context.latestValue(Metric.BOMB_RATE);

        if (indexChange >= 0 || limitDown <= rules.getLimitDownThreshold()
                || bombRate <= rules.getBombRateThreshold()) {
            return RuleResult.notTriggered(getSubtype(), String.format(Locale.ROOT,
                    "index %s, limit-downs %.0f, bomb rate %.2f", Amounts.signedPct(indexChange), limitDown, bombRate));
        }

        EventLevel level = bombRate >= rules.getBombRateHigh() || limitDown >= rules.getLimitDownHigh()
                ? EventLevel.HIGH
                : EventLevel.MEDIUM;

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("metric", "sentiment_drop");
        data.put("index_change_pct", indexChange);
        data.put("limit_down_count", limitDown);
        data.put("bomb_rate", bombRate);

        String reason = String.format(Locale.ROOT,
                "Sentiment turning down: index %s, %.0f limit-downs, %.0f%% of limit-ups failing",
                Amounts.signedPct(indexChange), limitDown, bombRate * 100.0);

        return RuleResult.builder()
                .subtype(getSubtype())
                .triggered(true)
                .level(level)
                .data(data)
                .reason(reason)
                .build();
    }
}
