package com.market.anomaly.window;

import com.market.anomaly.config.AnomalyProperties;
import com.market.anomaly.exception.InvalidSampleException;
import com.market.anomaly.model.IngestOutcome;
import com.market.anomaly.model.Metric;
import com.market.anomaly.model.MetricKey;
import com.market.anomaly.model.Sample;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns the rolling window of every (instrument, metric) key.
 *
 * Samples of one key must arrive in timestamp order: an older timestamp is rejected,
 * an equal one is treated as a replay and ignored. Aggregate queries never fall back
 * to a default value; too few samples raise {@link InsufficientDataException}.
 */
@Component
public class WindowStore {

    private final AnomalyProperties properties;
    private final Map<MetricKey, SlidingWindow> windows = new ConcurrentHashMap<>();

    public WindowStore(AnomalyProperties properties) {
        this.properties = properties;
    }

    public IngestOutcome ingest(Sample sample) {
        validate(sample);
        if (sample.getMetric() == Metric.SECTOR_RANKING && !Double.isFinite(sample.getValue())) {
            // ranking samples carry labels only, keep the prefix sums finite
            sample = sample.toBuilder().value(0.0).build();
        }
        MetricKey key = sample.key();
        SlidingWindow window = windows.computeIfAbsent(key,
                k -> new SlidingWindow(k, properties.getWindow().getSpan().toMillis()));

        synchronized (window) {
            Sample latest = window.latest();
            if (latest != null) {
                if (sample.getTimestamp() == latest.getTimestamp()) {
                    return IngestOutcome.DUPLICATE;
                }
                if (sample.getTimestamp() < latest.getTimestamp()) {
                    throw new InvalidSampleException(key, "out_of_order", String.format(Locale.ROOT,
                            "Sample for %s at %d is older than the latest accepted sample at %d",
                            key, sample.getTimestamp(), latest.getTimestamp()));
                }
            }
            window.append(sample);
        }
        return IngestOutcome.ACCEPTED;
    }

    /**
     * Mean over the trailing span ending at the latest sample.
     */
    public double average(MetricKey key, Duration span) throws WindowQueryException {
        SlidingWindow.RangeStats stats = trailing(key, span, false);
        requireSamples(key, stats, "average");
        return stats.mean();
    }

    /**
     * Mean over the trailing span, leaving out the latest sample: the reference level
     * the latest reading is compared against.
     */
    public double baseline(MetricKey key, Duration span) throws WindowQueryException {
        SlidingWindow.RangeStats stats = trailing(key, span, true);
        requireSamples(key, stats, "baseline");
        return stats.mean();
    }

    public double sum(MetricKey key, Duration span) throws WindowQueryException {
        SlidingWindow.RangeStats stats = trailing(key, span, false);
        requireSamples(key, stats, "sum");
        return stats.sum();
    }

    /**
     * Least-squares trend over the trailing span, in value units per minute.
     */
    public double slope(MetricKey key, Duration lastMinutes) throws WindowQueryException {
        SlidingWindow.RangeStats stats = trailing(key, lastMinutes, false);
        if (stats.count() < Math.max(2, properties.getWindow().getMinSamples())) {
            throw new InsufficientDataException(key, String.format(Locale.ROOT,
                    "slope over %s needs %d samples, have %d",
                    lastMinutes, Math.max(2, properties.getWindow().getMinSamples()), stats.count()));
        }
        double slope = stats.slope();
        if (Double.isNaN(slope)) {
            throw new InsufficientDataException(key, "slope undefined, samples share one timestamp");
        }
        return slope;
    }

    /**
     * The newest sample at or before {@code latest - ago}.
     */
    public Sample valueAt(MetricKey key, Duration ago) throws WindowQueryException {
        SlidingWindow window = require(key);
        Sample latest = window.latest();
        Sample past = window.atOrBefore(latest.getTimestamp() - ago.toMillis());
        if (past == null) {
            throw new InsufficientDataException(key, String.format(Locale.ROOT,
                    "window does not reach back %s (earliest sample at %d)", ago, window.earliest().getTimestamp()));
        }
        return past;
    }

    public Sample latest(MetricKey key) throws NoDataException {
        SlidingWindow window = windows.get(key);
        Sample latest = window == null ? null : window.latest();
        if (latest == null) {
            throw new NoDataException(key);
        }
        return latest;
    }

    public int windowCount() {
        return windows.size();
    }

    public void clear() {
        windows.clear();
    }

    private SlidingWindow.RangeStats trailing(MetricKey key, Duration span, boolean excludeLatest)
            throws NoDataException {
        SlidingWindow window = require(key);
        long from = window.latest().getTimestamp() - span.toMillis();
        return window.range(from, excludeLatest);
    }

    private SlidingWindow require(MetricKey key) throws NoDataException {
        SlidingWindow window = windows.get(key);
        if (window == null || window.isEmpty()) {
            throw new NoDataException(key);
        }
        return window;
    }

    private void requireSamples(MetricKey key, SlidingWindow.RangeStats stats, String query)
            throws InsufficientDataException {
        int min = properties.getWindow().getMinSamples();
        if (stats.count() < min) {
            throw new InsufficientDataException(key, String.format(Locale.ROOT,
                    "%s needs %d samples, have %d", query, min, stats.count()));
        }
    }

    private void validate(Sample sample) {
        MetricKey key = sample.key();
        if (sample.getInstrument() == null || sample.getInstrument().isBlank()) {
            throw new InvalidSampleException(key, "missing_instrument", "Sample has no instrument");
        }
        if (sample.getMetric() == null) {
            throw new InvalidSampleException(key, "missing_metric",
                    "Sample for " + sample.getInstrument() + " has no metric");
        }
        if (sample.getTimestamp() <= 0) {
            throw new InvalidSampleException(key, "missing_timestamp", "Sample for " + key + " has no timestamp");
        }
        if (sample.getMetric() == Metric.SECTOR_RANKING) {
            List<String> labels = sample.getLabels();
            if (labels == null || labels.isEmpty()) {
                throw new InvalidSampleException(key, "missing_labels", "Ranking sample for " + key + " has no labels");
            }
        } else if (!Double.isFinite(sample.getValue())) {
            throw new InvalidSampleException(key, "non_finite_value",
                    "Sample for " + key + " has non-finite value " + sample.getValue());
        }
    }
}
