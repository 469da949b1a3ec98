package com.market.anomaly.engine;

import com.market.anomaly.config.AnomalyProperties;
import com.market.anomaly.model.Event;
import com.market.anomaly.model.EventLevel;
import com.market.anomaly.model.EventSubtype;
import com.market.anomaly.model.Metric;
import com.market.anomaly.model.MetricKey;
import com.market.anomaly.window.InsufficientDataException;
import com.market.anomaly.window.WindowQueryException;
import com.market.anomaly.window.WindowStore;
import io.micrometer.tracing.Tracer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.market.anomaly.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;

class RuleEngineTest {

    private AnomalyProperties properties;
    private WindowStore store;
    private ExecutorService executor;

    private ScriptedEvaluator up;
    private ScriptedEvaluator withdrawal;
    private RuleEngine engine;

    @BeforeEach
    void setUp() {
        properties = createProperties();
        store = new WindowStore(properties);
        executor = Executors.newFixedThreadPool(4);
        up = new ScriptedEvaluator(EventSubtype.SENTIMENT_TURNING_UP);
        withdrawal = new ScriptedEvaluator(EventSubtype.FLOW_WITHDRAWAL);
        engine = new RuleEngine(store, List.of(up, withdrawal), properties, executor, Tracer.NOOP, createMetrics());
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void evaluate_sustainedCondition_firesEveryTick() {
        up.level = EventLevel.MEDIUM;

        assertThat(engine.evaluate(Map.of("SSE", minute(0)))).hasSize(1);
        assertThat(engine.evaluate(Map.of("SSE", minute(1))))
                .extracting(Event::getEventId)
                .containsExactly("evt-" + minute(1) + "-SSE-sentiment_turning_up");
        assertThat(engine.evaluate(Map.of("SSE", minute(2)))).hasSize(1);
    }

    @Test
    void evaluate_conditionClears_stopsFiring() {
        up.level = EventLevel.MEDIUM;
        engine.evaluate(Map.of("SSE", minute(0)));

        up.level = null;
        assertThat(engine.evaluate(Map.of("SSE", minute(1)))).isEmpty();
    }

    @Test
    void evaluate_missingData_doesNotFire() {
        up.missingData = true;

        assertThat(engine.evaluate(Map.of("SSE", minute(0)))).isEmpty();
    }

    @Test
    void evaluate_failingRule_doesNotBlockOtherRules() {
        up.failure = new IllegalStateException("boom");
        withdrawal.level = EventLevel.HIGH;

        List<Event> events = engine.evaluate(Map.of("NORTH", minute(0)));

        assertThat(events).extracting(Event::getSubtype).containsExactly(EventSubtype.FLOW_WITHDRAWAL);
    }

    @Test
    void evaluate_memoryIsPerInstrument() {
        up.level = EventLevel.MEDIUM;
        engine.evaluate(Map.of("SSE", minute(0)));
        engine.evaluate(Map.of("SSE", minute(1)));

        assertThat(engine.evaluate(Map.of("SZSE", minute(2))))
                .singleElement()
                .satisfies(e -> assertThat(e.getData()).containsEntry("streak", 1));
        assertThat(engine.evaluate(Map.of("SSE", minute(2))))
                .singleElement()
                .satisfies(e -> assertThat(e.getData()).containsEntry("streak", 3));
    }

    @Test
    void evaluate_manyInstruments_sortedByPriorityThenInstrument() {
        up.level = EventLevel.MEDIUM;
        withdrawal.level = EventLevel.HIGH;

        Map<String, Long> instruments = new TreeMap<>();
        for (String name : List.of("D", "B", "A", "C")) {
            instruments.put(name, minute(0));
        }
        List<Event> events = engine.evaluate(instruments);

        assertThat(events).hasSize(8);
        assertThat(events.subList(0, 4)).allMatch(e -> e.getSubtype() == EventSubtype.FLOW_WITHDRAWAL);
        assertThat(events.subList(0, 4)).extracting(Event::getInstrument).containsExactly("A", "B", "C", "D");
        assertThat(events.subList(4, 8)).allMatch(e -> e.getSubtype() == EventSubtype.SENTIMENT_TURNING_UP);
    }

    @Test
    void evaluate_tick_usesNewestSampleTimestampPerInstrument() {
        up.level = EventLevel.LOW;

        List<Event> events = engine.evaluate(createTick(minute(5),
                createSample("SSE", Metric.VOLUME, minute(3), 1.0),
                createSample("SSE", Metric.INDEX_CHANGE, minute(4), 1.0)));

        assertThat(events).singleElement().satisfies(e -> assertThat(e.getTimestamp()).isEqualTo(minute(4)));
    }

    @Test
    void reset_dropsRuleMemory() {
        up.level = EventLevel.MEDIUM;
        engine.evaluate(Map.of("SSE", minute(0)));
        engine.evaluate(Map.of("SSE", minute(1)));

        engine.reset();

        assertThat(engine.evaluate(Map.of("SSE", minute(2))))
                .singleElement()
                .satisfies(e -> assertThat(e.getData()).containsEntry("streak", 1));
    }

    /**
     * Evaluator whose outcome is set by the test. Counts its firings in its rule memory.
     */
    private static class ScriptedEvaluator implements RuleEvaluator {

        private final EventSubtype subtype;
        volatile EventLevel level;
        volatile boolean missingData;
        volatile RuntimeException failure;

        ScriptedEvaluator(EventSubtype subtype) {
            this.subtype = subtype;
        }

        @Override
        public EventSubtype getSubtype() {
            return subtype;
        }

        @Override
        public RuleResult evaluate(EvaluationContext context) throws WindowQueryException {
            if (failure != null) {
                throw failure;
            }
            if (missingData) {
                throw new InsufficientDataException(MetricKey.of(context.getInstrument(), Metric.VOLUME), "no data");
            }
            if (level == null) {
                return RuleResult.notTriggered(subtype, "quiet");
            }
            int streak = context.getMemory().getStreak() + 1;
            context.getMemory().setStreak(streak);
            return RuleResult.builder()
                    .subtype(subtype)
                    .triggered(true)
                    .level(level)
                    .data(Map.of("streak", streak))
                    .reason(subtype.getDisplayName() + " on " + context.getInstrument())
                    .build();
        }
    }
}
