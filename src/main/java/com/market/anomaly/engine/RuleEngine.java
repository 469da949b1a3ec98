package com.market.anomaly.engine;

import com.market.anomaly.config.AnomalyProperties;
import com.market.anomaly.config.MetricsConfig;
import com.market.anomaly.model.Event;
import com.market.anomaly.model.EventSubtype;
import com.market.anomaly.model.Tick;
import com.market.anomaly.window.WindowQueryException;
import com.market.anomaly.window.WindowStore;
import io.micrometer.observation.annotation.Observed;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Evaluates every anomaly rule for every instrument touched by a tick.
 * Uses the Strategy pattern: each EventSubtype is handled by a registered RuleEvaluator.
 *
 * A rule fires on every evaluation where its predicate holds; repeats of a sustained
 * condition are deduplicated downstream by the notification cool-down. The returned
 * events are sorted by subtype priority, detection time, subtype name and instrument,
 * so the result does not depend on the order in which instruments finished evaluating.
 */
@Component
public class RuleEngine {

    private static final Logger log = LoggerFactory.getLogger(RuleEngine.class);

    public static final Comparator<Event> EVENT_ORDER = Comparator
            .comparingInt((Event e) -> e.getSubtype().getPriority())
            .thenComparingLong(Event::getTimestamp)
            .thenComparing(e -> e.getSubtype().code())
            .thenComparing(Event::getInstrument);

    private final WindowStore windowStore;
    private final Map<EventSubtype, RuleEvaluator> evaluatorMap;
    private final AnomalyProperties properties;
    private final Executor ruleExecutor;
    private final Tracer tracer;
    private final MetricsConfig metricsConfig;

    // multi-tick rule state, keyed by subtype + instrument
    private final Map<String, RuleMemory> memories = new ConcurrentHashMap<>();

    public RuleEngine(WindowStore windowStore, List<RuleEvaluator> evaluators, AnomalyProperties properties,
                      @Qualifier("ruleExecutor") Executor ruleExecutor, Tracer tracer,
                      MetricsConfig metricsConfig) {
        this.windowStore = windowStore;
        this.evaluatorMap = new EnumMap<>(EventSubtype.class);
        this.properties = properties;
        this.ruleExecutor = ruleExecutor;
        this.tracer = tracer;
        this.metricsConfig = metricsConfig;

        // Auto-register all evaluator implementations
        for (RuleEvaluator evaluator : evaluators) {
            evaluatorMap.put(evaluator.getSubtype(), evaluator);
            log.info("Registered rule evaluator: {} -> {}",
                    evaluator.getSubtype(), evaluator.getClass().getSimpleName());
        }
    }

    /**
     * Evaluate all rules for the instruments of a tick, each at the newest timestamp
     * it carries in the tick.
     */
    public List<Event> evaluate(Tick tick) {
        Map<String, Long> instrumentTimes = new TreeMap<>();
        tick.getSamples().forEach(sample -> {
            if (sample.getInstrument() != null) {
                instrumentTimes.merge(sample.getInstrument(), tick.effectiveTimestamp(sample), Math::max);
            }
        });
        return evaluate(instrumentTimes);
    }

    /**
     * Evaluate all rules for the given instruments.
     *
     * @param instrumentTimes instrument -> evaluation timestamp
     * @return detected events in deterministic priority order
     */
    @Observed(name = "rules.evaluate_all", contextualName = "evaluate-all-rules")
    public List<Event> evaluate(Map<String, Long> instrumentTimes) {
        List<Event> events = new ArrayList<>();
        if (instrumentTimes.size() == 1) {
            Map.Entry<String, Long> only = instrumentTimes.entrySet().iterator().next();
            events.addAll(evaluateInstrument(only.getKey(), only.getValue()));
        } else {
            List<CompletableFuture<List<Event>>> futures = new ArrayList<>();
            for (Map.Entry<String, Long> entry : instrumentTimes.entrySet()) {
                futures.add(CompletableFuture.supplyAsync(
                        () -> evaluateInstrument(entry.getKey(), entry.getValue()), ruleExecutor));
            }
            for (CompletableFuture<List<Event>> future : futures) {
                events.addAll(future.join());
            }
        }
        events.sort(EVENT_ORDER);
        return events;
    }

    private List<Event> evaluateInstrument(String instrument, long timestamp) {
        List<Event> events = new ArrayList<>();

        for (RuleEvaluator evaluator : evaluatorMap.values()) {
            EventSubtype subtype = evaluator.getSubtype();
            RuleMemory memory = memoryFor(subtype, instrument);
            EvaluationContext context = EvaluationContext.builder()
                    .instrument(instrument)
                    .timestamp(timestamp)
                    .windowStore(windowStore)
                    .memory(memory)
                    .maxStaleness(properties.getWindow().getSpan())
                    .build();

            Span ruleSpan = tracer.nextSpan()
                    .name("rule.evaluate." + subtype.code())
                    .tag("rule.subtype", subtype.code())
                    .tag("instrument", instrument)
                    .start();

            try (Tracer.SpanInScope ws = tracer.withSpan(ruleSpan)) {
                RuleResult result;
                try {
                    result = evaluator.evaluate(context);
                } catch (WindowQueryException e) {
                    // absence of data is not an anomaly
                    result = RuleResult.notTriggered(subtype, e.getMessage());
                }

                ruleSpan.tag("rule.triggered", String.valueOf(result.isTriggered()));

                if (!result.isTriggered()) {
                    continue;
                }

                Event event = Event.detected(timestamp, instrument, subtype, result.getLevel(),
                        result.getData(), result.getReason());
                events.add(event);
                metricsConfig.recordRuleTriggered(subtype.code(), result.getLevel().code());
                log.debug("Rule triggered: {} for {} at {}, level={}, reason={}",
                        subtype, instrument, timestamp, result.getLevel(), result.getReason());
            } catch (Exception e) {
                ruleSpan.error(e);
                log.error("Error evaluating rule {} for instrument {} at {}: {}",
                        subtype, instrument, timestamp, e.getMessage(), e);
                // Don't let one bad rule block the other rules of this tick
            } finally {
                ruleSpan.end();
            }
        }

        return events;
    }

    private RuleMemory memoryFor(EventSubtype subtype, String instrument) {
        return memories.computeIfAbsent(subtype.name() + "|" + instrument, k -> new RuleMemory());
    }

    /**
     * Drops all per-rule memory (cold start).
     */
    public void reset() {
        memories.clear();
    }
}
