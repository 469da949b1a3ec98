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
 * Detects rapid northbound capital withdrawal: the net flow summed over the trailing
 * 10 minutes is an outflow larger than the threshold (default 1.0B). Always HIGH.
 */
@Component
public class FlowWithdrawalEvaluator implements RuleEvaluator {

    private final AnomalyProperties properties;

    public FlowWithdrawalEvaluator(AnomalyProperties properties) {
        this.properties = properties;
    }

    @Override
    public EventSubtype getSubtype() {
        return EventSubtype.FLOW_WITHDRAWAL;
    }

    @Override
    public RuleResult evaluate(EvaluationContext context) throws WindowQueryException {
        AnomalyProperties.Rules rules = properties.getRules();

        // make sure the flow series is current before summing it
        context.latest(Metric.NORTHBOUND_FLOW);
        double netFlow = context.sum(Metric.NORTHBOUND_FLOW, rules.getWithdrawalWindow());
        double outflow = -netFlow;

        if (outflow <= rules.getWithdrawalOutflow()) {
            return RuleResult.notTriggered(getSubtype(),
                    "Net northbound flow " + Amounts.compact(netFlow) + " within limits");
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("metric", "rapid_outflow");
        data.put("net_flow", netFlow);
        data.put("window_minutes", rules.getWithdrawalWindow().toMinutes());
        data.put("threshold", rules.getWithdrawalOutflow());

        String reason = String.format(Locale.ROOT, "Northbound withdrawal: %s net outflow over %dm exceeds %s",
                Amounts.compact(outflow), rules.getWithdrawalWindow().toMinutes(),
                Amounts.compact(rules.getWithdrawalOutflow()));

        return RuleResult.builder()
                .subtype(getSubtype())
                .triggered(true)
                .level(EventLevel.HIGH)
                .data(data)
                .reason(reason)
                .build();
    }
}
