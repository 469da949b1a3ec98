package com.market.anomaly.engine.evaluators;

import com.market.anomaly.config.AnomalyProperties;
import com.market.anomaly.engine.Amounts;
import com.market.anomaly.engine.EvaluationContext;
import com.market.anomaly.engine.RuleEvaluator;
import com.market.anomaly.engine.RuleMemory;
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
 * Detects a northbound flow reversal: the flow trend (least-squares slope over the
 * trailing 3 minutes) was negative and has since stayed positive for 3 consecutive ticks.
 *
 * Memory per instrument: {@code primed} records that a negative slope was seen,
 * {@code streak} counts the consecutive positive ticks since. Firing consumes both, so
 * the next reversal needs a new negative phase. A gap in the data breaks the streak.
 */
@Component
public class FlowReversalEvaluator implements RuleEvaluator {

    private final AnomalyProperties properties;

    public FlowReversalEvaluator(AnomalyProperties properties) {
        this.properties = properties;
    }

    @Override
    public EventSubtype getSubtype() {
        return EventSubtype.FLOW_REVERSAL;
    }

    @Override
    public RuleResult evaluate(EvaluationContext context) throws WindowQueryException {
        AnomalyProperties.Rules rules = properties.getRules();
        RuleMemory memory = context.getMemory();

        double slope;
        try {
            context.latest(Metric.NORTHBOUND_FLOW);
            slope = context.slope(Metric.NORTHBOUND_FLOW, rules.getReversalSlopeWindow());
        } catch (WindowQueryException e) {
            memory.setStreak(0);
            throw e;
        }

        if (slope < 0) {
            memory.setPrimed(true);
            memory.setStreak(0);
            return RuleResult.notTriggered(getSubtype(), "Flow trend negative");
        }
        if (slope == 0 || !memory.isPrimed()) {
            memory.setStreak(0);
            return RuleResult.notTriggered(getSubtype(), "No preceding negative flow trend");
        }

        int streak = memory.getStreak() + 1;
        if (streak < rules.getReversalConfirmTicks()) {
            memory.setStreak(streak);
            return RuleResult.notTriggered(getSubtype(),
                    String.format(Locale.ROOT, "Positive flow trend %d/%d ticks", streak, rules.getReversalConfirmTicks()));
        }

        memory.setStreak(0);
        memory.setPrimed(false);

        double latestFlow = context.latestValue(Metric.NORTHBOUND_FLOW);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("metric", "flow_reversal");
        data.put("slope_per_minute", Amounts.round(slope, 2));
        data.put("confirm_ticks", rules.getReversalConfirmTicks());
        data.put("latest_flow", latestFlow);

        String reason = String.format(Locale.ROOT,
                "Northbound flow reversal: trend turned positive (%s/min) for %d consecutive ticks, latest flow %s",
                Amounts.compact(slope), rules.getReversalConfirmTicks(), Amounts.compact(latestFlow));

        return RuleResult.builder()
                .subtype(getSubtype())
                .triggered(true)
                .level(EventLevel.MEDIUM)
                .data(data)
                .reason(reason)
                .build();
    }
}
