package com.market.anomaly.service;

import com.market.anomaly.config.AnomalyProperties;
import com.market.anomaly.model.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.market.anomaly.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;

class NotificationServiceTest {

    private AnomalyProperties properties;
    private StateManager stateManager;
    private NotificationService notificationService;

    @BeforeEach
    void setUp() {
        properties = createProperties();
        stateManager = new StateManager(properties, createMetrics());
        notificationService = new NotificationService(properties, stateManager, new NotificationBuilder(), createMetrics());
    }

    /**
     * Runs a batch through the state manager and then the notification service, as the pipeline does.
     */
    private List<Notification> process(long timestamp, Event... events) {
        List<Event> batch = List.of(events);
        StateTransition transition = stateManager.apply(batch, timestamp);
        return notificationService.onEvents(batch, transition);
    }

    private static StateTransition transition(long timestamp, MarketStatus from, MarketStatus to) {
        return createTransition(createState(timestamp, from, 50.0), createState(timestamp, to, 50.0));
    }

    @Test
    void onEvents_noEvents_returnsNothing() {
        assertThat(notificationService.onEvents(List.of(), transition(minute(0), MarketStatus.YELLOW, MarketStatus.YELLOW)))
                .isEmpty();
    }

    @Test
    void onEvents_singleMediumEvent_emitsFlash() {
        Event event = createEvent(minute(0), "SSE", EventSubtype.SENTIMENT_TURNING_UP, EventLevel.MEDIUM);

        List<Notification> notifications = process(minute(0), event);

        assertThat(notifications).singleElement().satisfies(n -> {
            assertThat(n.getFormat()).isEqualTo(NotificationFormat.FLASH);
            assertThat(n.getLines()).containsExactly(event.getDescription());
            assertThat(n.getRelatedEvents()).containsExactly(event.getEventId());
            assertThat(n.getNotificationId()).isEqualTo("ntf-" + minute(0) + "-000001");
            assertThat(n.getTimestamp()).isEqualTo(minute(0));
        });
    }

    @Test
    void format_highWithoutRedCrossing_isCard() {
        Event event = createEvent(minute(0), "NORTH", EventSubtype.FLOW_WITHDRAWAL, EventLevel.HIGH);

        assertThat(process(minute(0), event)).singleElement()
                .satisfies(n -> assertThat(n.getFormat()).isEqualTo(NotificationFormat.CARD));
    }

    @Test
    void format_highWithRedCrossing_isAlert() {
        Event event = createEvent(minute(0), "SSE", EventSubtype.SENTIMENT_TURNING_UP, EventLevel.HIGH);

        List<Notification> notifications = notificationService.onEvents(List.of(event),
                transition(minute(0), MarketStatus.YELLOW, MarketStatus.RED));

        assertThat(notifications).singleElement().satisfies(n -> {
            assertThat(n.getFormat()).isEqualTo(NotificationFormat.ALERT);
            assertThat(n.getLines()).contains("Market status: YELLOW -> RED");
        });
    }

    @Test
    void format_leavingRed_isAlsoAlert() {
        Event event = createEvent(minute(0), "SSE", EventSubtype.SENTIMENT_TURNING_DOWN, EventLevel.HIGH);

        assertThat(notificationService.onEvents(List.of(event), transition(minute(0), MarketStatus.RED, MarketStatus.YELLOW)))
                .singleElement().satisfies(n -> assertThat(n.getFormat()).isEqualTo(NotificationFormat.ALERT));
    }

    @Test
    void format_mediumWithStatusChange_isCard() {
        Event event = createEvent(minute(0), "SSE", EventSubtype.SENTIMENT_TURNING_UP, EventLevel.MEDIUM);

        assertThat(notificationService.onEvents(List.of(event), transition(minute(0), MarketStatus.GREEN, MarketStatus.YELLOW)))
                .singleElement().satisfies(n -> assertThat(n.getFormat()).isEqualTo(NotificationFormat.CARD));
    }

    @Test
    void format_lowWithStatusChange_isFlash() {
        Event event = createEvent(minute(0), "SECTORS", EventSubtype.THEME_EMERGENCE, EventLevel.LOW);

        assertThat(notificationService.onEvents(List.of(event), transition(minute(0), MarketStatus.GREEN, MarketStatus.YELLOW)))
                .singleElement().satisfies(n -> assertThat(n.getFormat()).isEqualTo(NotificationFormat.FLASH));
    }

    @Test
    void dedup_sameSubtypeAndInstrumentWithinCooldown_suppressed() {
        process(minute(0), createEvent(minute(0), "SSE", EventSubtype.SENTIMENT_TURNING_UP, EventLevel.MEDIUM));

        List<Notification> second = process(minute(10),
                createEvent(minute(10), "SSE", EventSubtype.SENTIMENT_TURNING_UP, EventLevel.MEDIUM));

        assertThat(second).isEmpty();
    }

    @Test
    void dedup_lowerLevelWithinCooldown_suppressed() {
        process(minute(0), createEvent(minute(0), "SSE", EventSubtype.SENTIMENT_TURNING_UP, EventLevel.MEDIUM));

        assertThat(process(minute(10), createEvent(minute(10), "SSE", EventSubtype.SENTIMENT_TURNING_UP, EventLevel.LOW)))
                .isEmpty();
    }

    @Test
    void dedup_afterCooldown_emitsAgain() {
        process(minute(0), createEvent(minute(0), "SSE", EventSubtype.SENTIMENT_TURNING_UP, EventLevel.MEDIUM));

        assertThat(process(minute(31), createEvent(minute(31), "SSE", EventSubtype.SENTIMENT_TURNING_UP, EventLevel.MEDIUM)))
                .hasSize(1);
    }

    @Test
    void dedup_escalationBypassesCooldown() {
        process(minute(0), createEvent(minute(0), "SSE", EventSubtype.SENTIMENT_TURNING_UP, EventLevel.MEDIUM));

        Event escalated = createEvent(minute(5), "SSE", EventSubtype.SENTIMENT_TURNING_UP, EventLevel.HIGH);
        List<Notification> notifications = process(minute(5), escalated);

        // 65 decays to 62.5, +30 crosses into red
        assertThat(notifications).singleElement().satisfies(n -> {
            assertThat(n.getFormat()).isEqualTo(NotificationFormat.ALERT);
            assertThat(n.getRelatedEvents()).containsExactly(escalated.getEventId());
        });
    }

    @Test
    void dedup_isPerInstrument() {
        process(minute(0), createEvent(minute(0), "SSE", EventSubtype.SENTIMENT_TURNING_UP, EventLevel.MEDIUM));

        assertThat(process(minute(1), createEvent(minute(1), "SZSE", EventSubtype.SENTIMENT_TURNING_UP, EventLevel.MEDIUM)))
                .hasSize(1);
    }

    @Test
    void aggregation_reversalThenSentimentWithinFiveMinutes_emitsOneCard() {
        Event reversal = createEvent(minute(0), "NORTH", EventSubtype.FLOW_REVERSAL, EventLevel.MEDIUM);
        Event sentiment = createEvent(minute(5), "SSE", EventSubtype.SENTIMENT_TURNING_UP, EventLevel.MEDIUM);

        List<Notification> first = process(minute(0), reversal);
        List<Notification> second = process(minute(5), sentiment);

        assertThat(first).singleElement()
                .satisfies(n -> assertThat(n.getFormat()).isEqualTo(NotificationFormat.FLASH));
        assertThat(second).singleElement().satisfies(n -> {
            assertThat(n.getFormat()).isEqualTo(NotificationFormat.CARD);
            assertThat(n.getTitle()).isEqualTo("Multi-indicator resonance");
            assertThat(n.getRelatedEvents()).containsExactlyInAnyOrder(reversal.getEventId(), sentiment.getEventId());
        });
    }

    @Test
    void aggregation_outsideCorrelationWindow_doesNotAggregate() {
        process(minute(0), createEvent(minute(0), "NORTH", EventSubtype.FLOW_REVERSAL, EventLevel.MEDIUM));

        List<Notification> later = process(minute(11),
                createEvent(minute(11), "SSE", EventSubtype.SENTIMENT_TURNING_UP, EventLevel.MEDIUM));

        assertThat(later).singleElement()
                .satisfies(n -> assertThat(n.getRelatedEvents()).hasSize(1));
    }

    @Test
    void aggregation_twoSubtypesInOneBatch_emitsExactlyOneNotification() {
        Event withdrawal = createEvent(minute(0), "NORTH", EventSubtype.FLOW_WITHDRAWAL, EventLevel.HIGH);
        Event down = createEvent(minute(0), "SSE", EventSubtype.SENTIMENT_TURNING_DOWN, EventLevel.MEDIUM);

        List<Notification> notifications = process(minute(0), down, withdrawal);

        assertThat(notifications).singleElement().satisfies(n -> {
            assertThat(n.getFormat()).isEqualTo(NotificationFormat.CARD);
            assertThat(n.getRelatedEvents()).hasSize(2);
        });
    }

    @Test
    void aggregation_highEventWithRedCrossing_isAlert() {
        Event up = createEvent(minute(0), "SSE", EventSubtype.SENTIMENT_TURNING_UP, EventLevel.HIGH);
        Event theme = createEvent(minute(0), "SECTORS", EventSubtype.THEME_EMERGENCE, EventLevel.MEDIUM);

        List<Notification> notifications = process(minute(0), up, theme);

        assertThat(notifications).singleElement().satisfies(n -> {
            assertThat(n.getFormat()).isEqualTo(NotificationFormat.ALERT);
            assertThat(n.getTitle()).isEqualTo("Market alert: Multi-indicator resonance");
        });
    }

    @Test
    void aggregation_sameSubtypeOnTwoInstruments_notAggregated() {
        List<Notification> notifications = process(minute(0),
                createEvent(minute(0), "SSE", EventSubtype.THEME_EMERGENCE, EventLevel.LOW),
                createEvent(minute(0), "SZSE", EventSubtype.THEME_EMERGENCE, EventLevel.LOW));

        assertThat(notifications).hasSize(2).allMatch(n -> n.getFormat() == NotificationFormat.FLASH);
    }

    @Test
    void aggregation_sustainedSignal_listedOnceByNewestEvent() {
        Event reversal0 = createEvent(minute(0), "NORTH", EventSubtype.FLOW_REVERSAL, EventLevel.MEDIUM);
        Event reversal1 = createEvent(minute(1), "NORTH", EventSubtype.FLOW_REVERSAL, EventLevel.MEDIUM);
        Event reversal2 = createEvent(minute(2), "NORTH", EventSubtype.FLOW_REVERSAL, EventLevel.MEDIUM);
        process(minute(0), reversal0);
        assertThat(process(minute(1), reversal1)).isEmpty();
        assertThat(process(minute(2), reversal2)).isEmpty();

        Event sentiment = createEvent(minute(3), "SSE", EventSubtype.SENTIMENT_TURNING_UP, EventLevel.MEDIUM);
        List<Notification> notifications = process(minute(3), sentiment);

        assertThat(notifications).singleElement().satisfies(n -> {
            assertThat(n.getFormat()).isEqualTo(NotificationFormat.CARD);
            assertThat(n.getRelatedEvents()).containsExactly(sentiment.getEventId(), reversal2.getEventId());
        });
    }

    @Test
    void throttle_alertsBeyondHourlyBudget_downgradedToCard() {
        properties.getNotification().setMaxAlertsPerHour(2);

        for (int i = 0; i < 3; i++) {
            Event event = createEvent(minute(i), "I" + i, EventSubtype.SENTIMENT_TURNING_UP, EventLevel.HIGH);
            List<Notification> notifications = notificationService.onEvents(List.of(event),
                    transition(minute(i), MarketStatus.YELLOW, MarketStatus.RED));
            NotificationFormat expected = i < 2 ? NotificationFormat.ALERT : NotificationFormat.CARD;
            assertThat(notifications).singleElement().satisfies(n -> assertThat(n.getFormat()).isEqualTo(expected));
        }

        // the first alert leaves the rolling hour
        Event later = createEvent(minute(60), "I9", EventSubtype.SENTIMENT_TURNING_UP, EventLevel.HIGH);
        assertThat(notificationService.onEvents(List.of(later), transition(minute(60), MarketStatus.YELLOW, MarketStatus.RED)))
                .singleElement().satisfies(n -> assertThat(n.getFormat()).isEqualTo(NotificationFormat.ALERT));
    }

    @Test
    void throttle_zeroBudget_neverAlerts() {
        properties.getNotification().setMaxAlertsPerHour(0);
        Event event = createEvent(minute(0), "SSE", EventSubtype.SENTIMENT_TURNING_UP, EventLevel.HIGH);

        assertThat(notificationService.onEvents(List.of(event), transition(minute(0), MarketStatus.YELLOW, MarketStatus.RED)))
                .singleElement().satisfies(n -> assertThat(n.getFormat()).isEqualTo(NotificationFormat.CARD));
    }

    @Test
    void reset_clearsLedgerAndSequence() {
        process(minute(0), createEvent(minute(0), "SSE", EventSubtype.SENTIMENT_TURNING_UP, EventLevel.MEDIUM));
        notificationService.reset();
        stateManager.reset();

        List<Notification> again = process(minute(0),
                createEvent(minute(0), "SSE", EventSubtype.SENTIMENT_TURNING_UP, EventLevel.MEDIUM));

        assertThat(again).singleElement()
                .satisfies(n -> assertThat(n.getNotificationId()).isEqualTo("ntf-" + minute(0) + "-000001"));
    }
}
