package com.market.anomaly.engine;

import com.market.anomaly.model.Metric;
import com.market.anomaly.model.MetricKey;
import com.market.anomaly.model.Sample;
import com.market.anomaly.window.InsufficientDataException;
import com.market.anomaly.window.WindowQueryException;
import com.market.anomaly.window.WindowStore;
import lombok.Builder;
import lombok.Getter;

import java.time.Duration;
import java.util.Locale;

/**
 * Runtime context handed to rule evaluators: one instrument at one evaluation time,
 * the shared window store and the rule's own memory for that instrument.
 */
@Getter
@Builder
public class EvaluationContext {

    private final String instrument;

    // newest sample timestamp of the instrument in the current tick
    private final long timestamp;

    private final WindowStore windowStore;

    private final RuleMemory memory;

    // a latest reading older than this relative to the evaluation time is stale
    private final Duration maxStaleness;

    public MetricKey key(Metric metric) {
        return MetricKey.of(instrument, metric);
    }

    /**
     * Latest reading of a metric for this instrument; stale readings count as missing.
     */
    public Sample latest(Metric metric) throws WindowQueryException {
        Sample sample = windowStore.latest(key(metric));
        if (maxStaleness != null && timestamp - sample.getTimestamp() > maxStaleness.toMillis()) {
            throw new InsufficientDataException(key(metric), String.format(Locale.ROOT,
                    "latest %s sample at %d is stale at %d", metric, sample.getTimestamp(), timestamp));
        }
        return sample;
    }

    public double latestValue(Metric metric) throws WindowQueryException {
        return latest(metric).getValue();
    }

    public double baseline(Metric metric, Duration span) throws WindowQueryException {
        return windowStore.baseline(key(metric), span);
    }

    public double sum(Metric metric, Duration span) throws WindowQueryException {
        return windowStore.sum(key(metric), span);
    }

    public double slope(Metric metric, Duration span) throws WindowQueryException {
        return windowStore.slope(key(metric), span);
    }

    public Sample valueAt(Metric metric, Duration ago) throws WindowQueryException {
        return windowStore.valueAt(key(metric), ago);
    }
}
