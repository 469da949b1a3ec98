package com.market.anomaly.engine.evaluators;

import com.market.anomaly.config.AnomalyProperties;
import com.market.anomaly.engine.Amounts;
import com.market.anomaly.engine.EvaluationContext;
import com.market.anomaly.engine.RuleEvaluator;
import com.market.anomaly.engine.RuleResult;
import com.market.anomaly.model.EventLevel;
import com.market.anomaly.model.EventSubtype;
import com.market.anomaly.model.Metric;
import com.market.anomaly.model.Sample;
import com.market.anomaly.window.WindowQueryException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Detects a new market theme: the set of top-3 sectors differs from the set 15 minutes
 * ago and sector volume spikes above its 15m baseline (default 1.5x).
 *
 * Re-ordering inside the top 3 is not a new theme. Two or more newcomers fire at
 * MEDIUM, a single newcomer at LOW.
 */
@Component
public class ThemeEmergenceEvaluator implements RuleEvaluator {

    private final AnomalyProperties properties;

    public ThemeEmergenceEvaluator(AnomalyProperties properties) {
        this.properties = properties;
    }

    @Override
    public EventSubtype getSubtype() {
        return EventSubtype.THEME_EMERGENCE;
    }

    @Override
    public RuleResult evaluate(EvaluationContext context) throws WindowQueryException {
        AnomalyProperties.Rules rules = properties.getRules();

        Sample current = context.latest(Metric.SECTOR_RANKING);
        Sample before = context.valueAt(Metric.SECTOR_RANKING, rules.getThemeLookback());
        Set<String> topNow = top(current.getLabels(), rules.getThemeTopN());
        Set<String> topBefore = top(before.getLabels(), rules.getThemeTopN());

        List<String> newcomers = new ArrayList<>();
        for (String sector : topNow) {
            if (!topBefore.contains(sector)) {
                newcomers.add(sector);
            }
        }
        if (newcomers.isEmpty()) {
            return RuleResult.notTriggered(getSubtype(), "Top sectors unchanged: " + topNow);
        }

        double sectorVolume = context.latestValue(Metric.SECTOR_VOLUME);
        double baseline = context.baseline(Metric.SECTOR_VOLUME, rules.getThemeLookback());
        if (baseline <= 0) {
            return RuleResult.notTriggered(getSubtype(), "Sector volume baseline is not positive");
        }
        double ratio = sectorVolume / baseline;
        if (ratio <= rules.getSectorVolumeSpikeRatio()) {
            return RuleResult.notTriggered(getSubtype(),
                    "Leadership changed without a sector volume spike (" + Amounts.ratio(ratio) + ")");
        }

        EventLevel level = newcomers.size() >= 2 ? EventLevel.MEDIUM : EventLevel.LOW;

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("metric", "new_leader");
        data.put("top_sectors", new ArrayList<>(topNow));
        data.put("previous_top_sectors", new ArrayList<>(topBefore));
        data.put("newcomers", newcomers);
        data.put("sector_volume_ratio", Amounts.round(ratio, 4));

        String reason = String.format(Locale.ROOT, "Theme emergence: %s entered the top %d (was %s), sector volume %s baseline",
                String.join(", ", newcomers), rules.getThemeTopN(), String.join(", ", topBefore),
                Amounts.ratio(ratio));

        return RuleResult.builder()
                .subtype(getSubtype())
                .triggered(true)
                .level(level)
                .data(data)
                .reason(reason)
                .build();
    }

    private static Set<String> top(List<String> ranking, int n) {
        Set<String> top = new LinkedHashSet<>();
        if (ranking == null) {
            return top;
        }
        for (String sector : ranking) {
            if (top.size() >= n) {
                break;
            }
            top.add(sector);
        }
        return top;
    }
}
