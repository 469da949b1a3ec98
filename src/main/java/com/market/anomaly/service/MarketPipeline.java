package com.market.anomaly.service;

import com.market.anomaly.config.AnomalyProperties;
import com.market.anomaly.config.MetricsConfig;
import com.market.anomaly.engine.RuleEngine;
import com.market.anomaly.exception.InvalidSampleException;
import com.market.anomaly.model.Event;
import com.market.anomaly.model.IngestOutcome;
import com.market.anomaly.model.Notification;
import com.market.anomaly.model.Sample;
import com.market.anomaly.model.StateTransition;
import com.market.anomaly.model.Tick;
import com.market.anomaly.model.TickResult;
import com.market.anomaly.window.WindowStore;
import io.micrometer.observation.annotation.Observed;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Main orchestrator of the tick pipeline.
 *
 * Flow per tick:
 * 1. Skip instruments whose timestamp was already evaluated (replay)
 * 2. Ingest samples into the window store; a rejected sample pauses its instrument
 * 3. Run all rules for the remaining instruments via the RuleEngine
 * 4. Fold the events into the market state
 * 5. Turn events into notifications and hand them to every sink
 *
 * Ticks are processed one at a time under a lock, which makes this the single writer
 * of the state manager and the notification service.
 */
@Service
public class MarketPipeline {

    private static final Logger log = LoggerFactory.getLogger(MarketPipeline.class);

    private static final String MISSING_SAMPLE = "missing_sample";

    private final WindowStore windowStore;
    private final RuleEngine ruleEngine;
    private final StateManager stateManager;
    private final NotificationService notificationService;
    private final NotificationLog notificationLog;
    private final List<NotificationSink> sinks;
    private final MetricsConfig metricsConfig;
    private final AnomalyProperties properties;
    private final ThreadPoolTaskExecutor ingestExecutor;

    private final ReentrantLock lock = new ReentrantLock();
    // instrument -> newest evaluated timestamp
    private final Map<String, Long> lastEvaluated = new ConcurrentHashMap<>();
    private volatile boolean accepting = true;

    public MarketPipeline(WindowStore windowStore,
                          RuleEngine ruleEngine,
                          StateManager stateManager,
                          NotificationService notificationService,
                          NotificationLog notificationLog,
                          List<NotificationSink> sinks,
                          MetricsConfig metricsConfig,
                          AnomalyProperties properties,
                          @Qualifier("ingestExecutor") ThreadPoolTaskExecutor ingestExecutor) {
        this.windowStore = windowStore;
        this.ruleEngine = ruleEngine;
        this.stateManager = stateManager;
        this.notificationService = notificationService;
        this.notificationLog = notificationLog;
        this.sinks = sinks;
        this.metricsConfig = metricsConfig;
        this.properties = properties;
        this.ingestExecutor = ingestExecutor;
    }

    /**
     * Processes one tick synchronously and returns what it produced.
     */
    @Observed(name = "pipeline.process", contextualName = "process-tick")
    public TickResult process(Tick tick) {
        if (tick == null) {
            throw new IllegalArgumentException("Tick must not be null");
        }
        lock.lock();
        try {
            return doProcess(tick);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Enqueues a tick on the ingestion lane. Ticks submitted from one thread are
     * processed in submission order.
     */
    public CompletableFuture<TickResult> submit(Tick tick) {
        if (tick == null) {
            throw new IllegalArgumentException("Tick must not be null");
        }
        if (!accepting) {
            throw new IllegalStateException("Pipeline is shutting down, tick at " + tick.getTimestamp() + " refused");
        }
        return CompletableFuture.supplyAsync(() -> process(tick), ingestExecutor);
    }

    /**
     * Processes a backlog of ticks in the given order, e.g. to rebuild state after a
     * restart. Ticks already processed are skipped per instrument.
     */
    @Observed(name = "pipeline.replay", contextualName = "replay-ticks")
    public List<TickResult> replay(List<Tick> ticks) {
        int missing = ticks.indexOf(null);
        if (missing >= 0) {
            throw new IllegalArgumentException("Replay backlog has no tick at index " + missing);
        }
        List<TickResult> results = new ArrayList<>();
        lock.lock();
        try {
            for (Tick tick : ticks) {
                results.add(doProcess(tick));
            }
        } finally {
            lock.unlock();
        }
        log.info("Replayed {} tick(s)", ticks.size());
        return results;
    }

    /**
     * Cold start: drops windows, rule memory, market state and notification history.
     */
    public void reset() {
        lock.lock();
        try {
            windowStore.clear();
            ruleEngine.reset();
            stateManager.reset();
            notificationService.reset();
            notificationLog.clear();
            lastEvaluated.clear();
            log.info("Pipeline reset to cold start");
        } finally {
            lock.unlock();
        }
    }

    @PreDestroy
    public void shutdown() {
        accepting = false;
        long timeoutMillis = properties.getPipeline().getShutdownTimeout().toMillis();
        log.info("Shutting down tick pipeline, draining queued ticks (timeout {} ms)", timeoutMillis);

        ThreadPoolExecutor executor = ingestExecutor.getThreadPoolExecutor();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(timeoutMillis, TimeUnit.MILLISECONDS)) {
                log.warn("Tick pipeline did not drain within {} ms, {} tick(s) still queued",
                        timeoutMillis, executor.getQueue().size());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while draining the tick pipeline");
        }
    }

    private TickResult doProcess(Tick tick) {
        List<String> rejected = new ArrayList<>();
        List<Sample> samples = new ArrayList<>();
        if (tick.getSamples() != null) {
            for (int i = 0; i < tick.getSamples().size(); i++) {
                Sample sample = tick.getSamples().get(i);
                if (sample == null) {
                    metricsConfig.recordSampleRejected(MISSING_SAMPLE);
                    log.warn("Rejected sample #{} of tick {}: no sample", i, tick.getTimestamp());
                    rejected.add("samples[" + i + "]: " + MISSING_SAMPLE);
                } else {
                    samples.add(sample);
                }
            }
        }

        // 1. Replay guard
        Map<String, Long> instrumentTimes = new TreeMap<>();
        for (Sample sample : samples) {
            if (sample.getInstrument() != null) {
                instrumentTimes.merge(sample.getInstrument(), tick.effectiveTimestamp(sample), Math::max);
            }
        }
        Set<String> skipped = new TreeSet<>();
        instrumentTimes.forEach((instrument, ts) -> {
            Long last = lastEvaluated.get(instrument);
            if (last != null && ts <= last) {
                skipped.add(instrument);
            }
        });
        if (!skipped.isEmpty()) {
            log.debug("Tick {}: skipping already processed instruments {}", tick.getTimestamp(), skipped);
        }

        // 2. Ingest
        Set<String> paused = new TreeSet<>();
        for (Sample sample : samples) {
            if (sample.getInstrument() != null && skipped.contains(sample.getInstrument())) {
                continue;
            }
            Sample stamped = sample.getTimestamp() > 0
                    ? sample
                    : sample.toBuilder().timestamp(tick.getTimestamp()).build();
            try {
                IngestOutcome outcome = windowStore.ingest(stamped);
                if (outcome == IngestOutcome.ACCEPTED) {
                    metricsConfig.recordSampleIngested(stamped.getMetric().name());
                }
            } catch (InvalidSampleException e) {
                metricsConfig.recordSampleRejected(e.getReason());
                log.warn("Rejected sample {} ({}): {}", e.getKey(), e.getReason(), e.getMessage());
                rejected.add(e.getKey() + ": " + e.getReason());
                if (sample.getInstrument() != null) {
                    paused.add(sample.getInstrument());
                }
            }
        }

        // 3. Rules, over the samples of instruments neither skipped nor paused
        Map<String, Long> toEvaluate = new TreeMap<>();
        instrumentTimes.forEach((instrument, ts) -> {
            if (!skipped.contains(instrument) && !paused.contains(instrument)) {
                toEvaluate.put(instrument, ts);
            }
        });
        List<Event> events = Collections.emptyList();
        if (!toEvaluate.isEmpty()) {
            List<Sample> evaluated = new ArrayList<>();
            for (Sample sample : samples) {
                if (sample.getInstrument() != null && toEvaluate.containsKey(sample.getInstrument())) {
                    evaluated.add(sample);
                }
            }
            events = ruleEngine.evaluate(Tick.builder().timestamp(tick.getTimestamp()).samples(evaluated).build());
        }
        lastEvaluated.putAll(toEvaluate);

        // 4. State, clocked no earlier than the newest evaluated sample
        long stateTimestamp = Math.max(tick.getTimestamp(),
                toEvaluate.values().stream().mapToLong(Long::longValue).max().orElse(0L));
        StateTransition transition = stateManager.apply(events, stateTimestamp);

        // 5. Notifications
        List<Notification> notifications = notificationService.onEvents(events, transition);
        for (Notification notification : notifications) {
            for (NotificationSink sink : sinks) {
                try {
                    sink.deliver(notification);
                } catch (RuntimeException e) {
                    log.error("Sink {} failed to deliver {}: {}", sink.getClass().getSimpleName(),
                            notification.getNotificationId(), e.getMessage(), e);
                }
            }
        }
        notificationLog.addAll(notifications);

        if (!events.isEmpty()) {
            log.info("Tick {}: {} event(s), {} notification(s), status={}, score={}",
                    stateTimestamp, events.size(), notifications.size(),
                    transition.getCurrent().getStatus(), transition.getCurrent().getSentimentScore());
        }

        return TickResult.builder()
                .timestamp(stateTimestamp)
                .events(events)
                .notifications(notifications)
                .state(transition.getCurrent())
                .rejected(rejected)
                .skipped(new ArrayList<>(skipped))
                .build();
    }
}
