package com.market.anomaly.window;

import com.market.anomaly.model.MetricKey;
import com.market.anomaly.model.Sample;

import java.util.ArrayList;
import java.util.List;

/**
 * Time-bounded buffer of samples for one key.
 *
 * Every entry carries cumulative sums (count, value, time, time*value, time^2) from the
 * start of the buffer, so the sum over any trailing range is the difference of two
 * prefix entries. Time is measured in minutes from {@code origin}, the timestamp of the
 * first buffered entry, which keeps the least-squares terms small.
 *
 * Evicted entries stay in the backing list until they make up half of it; compaction
 * then drops them and rebuilds the prefix sums against the new origin, so append and
 * evict are amortized O(1) and range queries cost one binary search.
 */
public class SlidingWindow {

    private static final double MILLIS_PER_MINUTE = 60_000.0;
    private static final int MIN_COMPACT_SIZE = 32;

    private final MetricKey key;
    private final long spanMillis;

    private final List<Entry> entries = new ArrayList<>();
    // index of the first live entry
    private int head;
    private long origin;

    public SlidingWindow(MetricKey key, long spanMillis) {
        this.key = key;
        this.spanMillis = spanMillis;
    }

    public MetricKey getKey() {
        return key;
    }

    public synchronized int size() {
        return entries.size() - head;
    }

    public synchronized boolean isEmpty() {
        return size() == 0;
    }

    public synchronized Sample latest() {
        return isEmpty() ? null : entries.get(entries.size() - 1).sample;
    }

    public synchronized Sample earliest() {
        return isEmpty() ? null : entries.get(head).sample;
    }

    /**
     * Appends a sample whose timestamp is not older than the latest one, then evicts
     * everything older than {@code timestamp - span}.
     */
    public synchronized void append(Sample sample) {
        if (isEmpty()) {
            entries.clear();
            head = 0;
            origin = sample.getTimestamp();
        }
        Entry previous = entries.isEmpty() ? null : entries.get(entries.size() - 1);
        entries.add(new Entry(sample, previous, minutes(sample.getTimestamp())));
        evictBefore(sample.getTimestamp() - spanMillis);
    }

    /**
     * Sums over live entries with timestamp >= {@code fromInclusive}. When
     * {@code excludeLatest} is set the newest entry is left out of the range.
     */
    public synchronized RangeStats range(long fromInclusive, boolean excludeLatest) {
        int last = entries.size() - 1 - (excludeLatest ? 1 : 0);
        int first = firstIndexAtOrAfter(fromInclusive);
        if (isEmpty() || first > last) {
            return RangeStats.EMPTY;
        }
        Entry end = entries.get(last);
        Entry before = first > 0 ? entries.get(first - 1) : null;
        return new RangeStats(
                end.count - (before == null ? 0 : before.count),
                end.sumV - (before == null ? 0.0 : before.sumV),
                end.sumT - (before == null ? 0.0 : before.sumT),
                end.sumTV - (before == null ? 0.0 : before.sumTV),
                end.sumTT - (before == null ? 0.0 : before.sumTT));
    }

    /**
     * Newest live sample with timestamp <= {@code timestamp}, or null when the live
     * entries do not reach back that far.
     */
    public synchronized Sample atOrBefore(long timestamp) {
        int idx = firstIndexAtOrAfter(timestamp + 1) - 1;
        if (idx < head) {
            return null;
        }
        return entries.get(idx).sample;
    }

    private void evictBefore(long cutoff) {
        while (head < entries.size() && entries.get(head).sample.getTimestamp() < cutoff) {
            head++;
        }
        if (head >= MIN_COMPACT_SIZE && head * 2 >= entries.size()) {
            compact();
        }
    }

    private void compact() {
        List<Entry> live = new ArrayList<>(entries.subList(head, entries.size()));
        entries.clear();
        head = 0;
        if (live.isEmpty()) {
            return;
        }
        origin = live.get(0).sample.getTimestamp();
        Entry previous = null;
        for (Entry entry : live) {
            Entry rebuilt = new Entry(entry.sample, previous, minutes(entry.sample.getTimestamp()));
            entries.add(rebuilt);
            previous = rebuilt;
        }
    }

    // first live index whose timestamp >= ts; entries.size() when none
    private int firstIndexAtOrAfter(long ts) {
        int lo = head;
        int hi = entries.size();
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (entries.get(mid).sample.getTimestamp() < ts) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }

    private double minutes(long timestamp) {
        return (timestamp - origin) / MILLIS_PER_MINUTE;
    }

    private static final class Entry {
        final Sample sample;
        final long count;
        final double sumV;
        final double sumT;
        final double sumTV;
        final double sumTT;

        Entry(Sample sample, Entry previous, double t) {
            double v = sample.getValue();
            this.sample = sample;
            this.count = (previous == null ? 0 : previous.count) + 1;
            this.sumV = (previous == null ? 0.0 : previous.sumV) + v;
            this.sumT = (previous == null ? 0.0 : previous.sumT) + t;
            this.sumTV = (previous == null ? 0.0 : previous.sumTV) + t * v;
            this.sumTT = (previous == null ? 0.0 : previous.sumTT) + t * t;
        }
    }

    /**
     * Aggregates of one contiguous range of a window.
     */
    public static final class RangeStats {

        static final RangeStats EMPTY = new RangeStats(0, 0.0, 0.0, 0.0, 0.0);

        private final long count;
        private final double sumV;
        private final double sumT;
        private final double sumTV;
        private final double sumTT;

        RangeStats(long count, double sumV, double sumT, double sumTV, double sumTT) {
            this.count = count;
            this.sumV = sumV;
            this.sumT = sumT;
            this.sumTV = sumTV;
            this.sumTT = sumTT;
        }

        public long count() {
            return count;
        }

        public double sum() {
            return sumV;
        }

        public double mean() {
            return count == 0 ? Double.NaN : sumV / count;
        }

        /**
         * Least-squares slope in value units per minute; NaN when all points share one timestamp.
         */
        public double slope() {
            double denominator = count * sumTT - sumT * sumT;
            if (count < 2 || Math.abs(denominator) < 1e-12) {
                return Double.NaN;
            }
            return (count * sumTV - sumT * sumV) / denominator;
        }
    }
}
