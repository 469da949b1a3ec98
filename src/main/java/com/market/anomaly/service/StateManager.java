package com.market.anomaly.service;

import com.market.anomaly.config.AnomalyProperties;
import com.market.anomaly.config.MetricsConfig;
import com.market.anomaly.model.Event;
import com.market.anomaly.model.EventLevel;
import com.market.anomaly.model.MarketState;
import com.market.anomaly.model.MarketStatus;
import com.market.anomaly.model.StateTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;

/**
 * Folds detected events into a single market state.
 *
 * The sentiment score is a bounded accumulator in [0, 100]: it decays toward 50 as
 * time passes and every event pushes it by the weight of its level, up for
 * strengthening subtypes and down for weakening ones. Status follows the score alone.
 *
 * Mutated by the pipeline's single writer. {@link #current()} reads a volatile
 * immutable snapshot and never blocks.
 */
@Service
public class StateManager {

    private static final Logger log = LoggerFactory.getLogger(StateManager.class);

    static final double NEUTRAL_SCORE = 50.0;

    // highest priority first, then most severe, then newest
    private static final Comparator<Event> DRIVER_ORDER = Comparator
            .comparingInt((Event e) -> e.getSubtype().getPriority())
            .thenComparing(Event::getLevel, Comparator.reverseOrder())
            .thenComparing(Event::getTimestamp, Comparator.reverseOrder());

    private final AnomalyProperties properties;
    private final MetricsConfig metricsConfig;

    private volatile MarketState current = MarketState.initial(0L);
    private boolean started;

    // event id -> event, in arrival order
    private final Map<String, Event> history = new LinkedHashMap<>();
    private final Deque<MarketState> stateHistory = new ArrayDeque<>();

    public StateManager(AnomalyProperties properties, MetricsConfig metricsConfig) {
        this.properties = properties;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Applies one batch of events observed at {@code timestamp}. Events already in the
     * history are ignored, so replaying a batch leaves the score unchanged. The new state
     * is stamped no earlier than the newest fresh event.
     */
    public synchronized StateTransition apply(Collection<Event> events, long timestamp) {
        MarketState previous = current;
        long now = started ? Math.max(previous.getTimestamp(), timestamp) : timestamp;

        List<Event> fresh = new ArrayList<>();
        if (events != null) {
            for (Event event : events) {
                if (event != null && !history.containsKey(event.getEventId())) {
                    history.put(event.getEventId(), event);
                    fresh.add(event);
                    // the clock never trails an event it has seen
                    now = Math.max(now, event.getTimestamp());
                }
            }
        }

        double score = decay(previous.getSentimentScore(), started ? now - previous.getTimestamp() : 0L);
        for (Event event : fresh) {
            score += weight(event.getLevel()) * event.getSubtype().direction();
        }
        score = Math.max(0.0, Math.min(100.0, score));

        prune(now);

        MarketStatus status = statusFor(score);
        List<Event> window = eventsWithin(properties.getNotification().getCorrelationWindow(), now);
        String driver = window.isEmpty()
                ? previous.getMainDriver()
                : window.stream().min(DRIVER_ORDER).map(Event::getDescription).orElse(previous.getMainDriver());

        MarketState next = MarketState.builder()
                .timestamp(now)
                .status(status)
                .sentimentScore(score)
                .mainDriver(driver)
                .summary(summarize(score, status, window))
                .build();

        stateHistory.addLast(previous);
        while (stateHistory.size() > properties.getHistory().getStateHistorySize()) {
            stateHistory.removeFirst();
        }

        current = next;
        started = true;
        metricsConfig.updateSentimentScore(score);

        if (status != previous.getStatus()) {
            if (status == MarketStatus.RED) {
                log.warn("Market status {} -> {} at {}, score={}, driver={}",
                        previous.getStatus(), status, now, score, driver);
            } else {
                log.info("Market status {} -> {} at {}, score={}",
                        previous.getStatus(), status, now, score);
            }
        }
        if (!fresh.isEmpty()) {
            log.debug("Applied {} event(s) at {}, score {} -> {}",
                    fresh.size(), now, previous.getSentimentScore(), score);
        }

        return new StateTransition(previous, next);
    }

    public MarketState current() {
        return current;
    }

    /**
     * Retained events no older than {@code within} before the latest state timestamp,
     * ascending by timestamp.
     */
    public synchronized List<Event> recentEvents(Duration within) {
        return eventsWithin(within, current.getTimestamp());
    }

    /**
     * Prior states, oldest first.
     */
    public synchronized List<MarketState> stateHistory() {
        return new ArrayList<>(stateHistory);
    }

    /**
     * True when at least two distinct subtypes occurred within the window.
     */
    public synchronized boolean isResonant(Duration within) {
        return distinctSubtypes(eventsWithin(within, current.getTimestamp())).size() >= 2;
    }

    public synchronized void reset() {
        history.clear();
        stateHistory.clear();
        current = MarketState.initial(0L);
        started = false;
        metricsConfig.updateSentimentScore(NEUTRAL_SCORE);
    }

    double decay(double score, long elapsedMillis) {
        if (elapsedMillis <= 0) {
            return score;
        }
        double step = properties.getScoring().getDecayRatePerMinute() * (elapsedMillis / 60_000.0);
        if (score > NEUTRAL_SCORE) {
            return Math.max(NEUTRAL_SCORE, score - step);
        }
        return Math.min(NEUTRAL_SCORE, score + step);
    }

    MarketStatus statusFor(double score) {
        AnomalyProperties.Scoring scoring = properties.getScoring();
        if (score >= scoring.getRedThreshold()) {
            return MarketStatus.RED;
        }
        if (score <= scoring.getGreenThreshold()) {
            return MarketStatus.GREEN;
        }
        return MarketStatus.YELLOW;
    }

    private double weight(EventLevel level) {
        AnomalyProperties.Weights weights = properties.getScoring().getWeights();
        switch (level) {
            case HIGH:
                return weights.getHigh();
            case MEDIUM:
                return weights.getMedium();
            default:
                return weights.getLow();
        }
    }

    private List<Event> eventsWithin(Duration within, long now) {
        long from = now - within.toMillis();
        List<Event> result = new ArrayList<>();
        for (Event event : history.values()) {
            if (event.getTimestamp() >= from && event.getTimestamp() <= now) {
                result.add(event);
            }
        }
        result.sort(Comparator.comparingLong(Event::getTimestamp));
        return result;
    }

    private void prune(long now) {
        long horizon = now - properties.getHistory().getRetention().toMillis();
        history.values().removeIf(event -> event.getTimestamp() < horizon);

        int excess = history.size() - properties.getHistory().getMaxEvents();
        Iterator<Event> it = history.values().iterator();
        while (excess > 0 && it.hasNext()) {
            it.next();
            it.remove();
            excess--;
        }
    }

    private String summarize(double score, MarketStatus status, List<Event> window) {
        String head = String.format(Locale.ROOT, "Sentiment score %.1f, status %s.", score, status.code());
        if (window.isEmpty()) {
            return head + " No active signals";
        }
        TreeSet<String> subtypes = distinctSubtypes(window);
        String summary = head + " Signals in the last "
                + properties.getNotification().getCorrelationWindow().toMinutes() + "m: "
                + String.join(", ", subtypes);
        return subtypes.size() >= 2 ? summary + " (multi-indicator resonance)" : summary;
    }

    private static TreeSet<String> distinctSubtypes(List<Event> events) {
        TreeSet<String> subtypes = new TreeSet<>();
        for (Event event : events) {
            subtypes.add(event.getSubtype().code());
        }
        return subtypes;
    }
}
