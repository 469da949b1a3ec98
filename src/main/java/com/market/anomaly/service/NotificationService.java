package com.market.anomaly.service;

import com.market.anomaly.config.AnomalyProperties;
import com.market.anomaly.config.MetricsConfig;
import com.market.anomaly.engine.RuleEngine;
import com.market.anomaly.model.Event;
import com.market.anomaly.model.EventLevel;
import com.market.anomaly.model.EventSubtype;
import com.market.anomaly.model.Notification;
import com.market.anomaly.model.NotificationFormat;
import com.market.anomaly.model.StateTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Turns detected events into notifications.
 *
 * Order of decisions per batch: cool-down dedup per (subtype, instrument), aggregation
 * of corroborating signals into one card, format selection for the remaining single
 * events, then the hourly alert budget. Over-budget alerts are downgraded to cards.
 * A corroborating signal is listed once per (subtype, instrument), by its newest event.
 * Mutated by the pipeline's single writer only.
 */
@Service
public class NotificationService {

    private static final Logger log = LoggerFactory.getLogger(NotificationService.class);

    private static final long HOUR_MILLIS = 3_600_000L;

    private final AnomalyProperties properties;
    private final StateManager stateManager;
    private final NotificationBuilder notificationBuilder;
    private final MetricsConfig metricsConfig;

    // "subtype|instrument" -> last emission
    private final Map<String, LedgerEntry> ledger = new HashMap<>();
    private final Deque<Long> alertTimes = new ArrayDeque<>();
    private final AtomicLong sequence = new AtomicLong();

    public NotificationService(AnomalyProperties properties, StateManager stateManager,
                               NotificationBuilder notificationBuilder, MetricsConfig metricsConfig) {
        this.properties = properties;
        this.stateManager = stateManager;
        this.notificationBuilder = notificationBuilder;
        this.metricsConfig = metricsConfig;
    }

    /**
     * @param events     events of one batch, in priority order
     * @param transition the state change the batch caused
     * @return notifications to emit, possibly none
     */
    public synchronized List<Notification> onEvents(List<Event> events, StateTransition transition) {
        if (events == null || events.isEmpty()) {
            return Collections.emptyList();
        }
        AnomalyProperties.NotificationSettings settings = properties.getNotification();
        long now = transition.getCurrent().getTimestamp();
        pruneLedger(now);

        List<Event> surviving = new ArrayList<>();
        for (Event event : events) {
            if (isCoolingDown(event)) {
                metricsConfig.recordNotificationSuppressed("cooldown");
                log.debug("Suppressed {} for {} at {}: within cool-down of an equal or higher level",
                        event.getSubtype(), event.getInstrument(), event.getTimestamp());
                continue;
            }
            surviving.add(event);
            ledger.put(ledgerKey(event), new LedgerEntry(event.getTimestamp(), event.getLevel()));
        }
        if (surviving.isEmpty()) {
            return Collections.emptyList();
        }
        surviving.sort(RuleEngine.EVENT_ORDER);

        // newest retained event per (subtype, instrument) not already reported by this batch
        Set<String> batchIds = new HashSet<>();
        events.forEach(e -> batchIds.add(e.getEventId()));
        Set<String> survivingKeys = new HashSet<>();
        surviving.forEach(e -> survivingKeys.add(ledgerKey(e)));
        Map<String, Event> newestByKey = new LinkedHashMap<>();
        for (Event event : stateManager.recentEvents(settings.getCorrelationWindow())) {
            String key = ledgerKey(event);
            if (!batchIds.contains(event.getEventId()) && !survivingKeys.contains(key)) {
                newestByKey.put(key, event);
            }
        }
        List<Event> corroborating = new ArrayList<>(newestByKey.values());

        Set<EventSubtype> subtypes = EnumSet.noneOf(EventSubtype.class);
        surviving.forEach(e -> subtypes.add(e.getSubtype()));
        corroborating.forEach(e -> subtypes.add(e.getSubtype()));

        List<Notification> notifications = new ArrayList<>();
        if (subtypes.size() >= 2) {
            boolean high = surviving.stream().anyMatch(e -> e.getLevel() == EventLevel.HIGH);
            NotificationFormat format = high && transition.isRedCrossing()
                    ? NotificationFormat.ALERT : NotificationFormat.CARD;
            notifications.add(emit(throttle(format, now), surviving, corroborating, transition));
        } else {
            for (Event event : surviving) {
                NotificationFormat format = throttle(formatFor(event, transition), now);
                notifications.add(emit(format, List.of(event), Collections.emptyList(), transition));
            }
        }
        return notifications;
    }

    public synchronized void reset() {
        ledger.clear();
        alertTimes.clear();
        sequence.set(0);
    }

    NotificationFormat formatFor(Event event, StateTransition transition) {
        if (event.getLevel() == EventLevel.HIGH) {
            return transition.isRedCrossing() ? NotificationFormat.ALERT : NotificationFormat.CARD;
        }
        if (event.getLevel() == EventLevel.MEDIUM && transition.isStatusChanged()) {
            return NotificationFormat.CARD;
        }
        return NotificationFormat.FLASH;
    }

    private NotificationFormat throttle(NotificationFormat format, long now) {
        if (format != NotificationFormat.ALERT) {
            return format;
        }
        while (!alertTimes.isEmpty() && alertTimes.peekFirst() <= now - HOUR_MILLIS) {
            alertTimes.removeFirst();
        }
        if (alertTimes.size() >= properties.getNotification().getMaxAlertsPerHour()) {
            metricsConfig.recordNotificationSuppressed("alert_budget");
            log.info("Alert budget of {} per hour exhausted at {}, downgrading to card",
                    properties.getNotification().getMaxAlertsPerHour(), now);
            return NotificationFormat.CARD;
        }
        alertTimes.addLast(now);
        return format;
    }

    private Notification emit(NotificationFormat format, List<Event> primary, List<Event> supporting,
                              StateTransition transition) {
        String id = String.format(Locale.ROOT, "ntf-%d-%06d", transition.getCurrent().getTimestamp(), sequence.incrementAndGet());
        Notification notification = notificationBuilder.build(id, format, primary, supporting, transition);
        metricsConfig.recordNotificationEmitted(format.code());
        log.info("Emitting {} {} for {} event(s): {}", format, id,
                notification.getRelatedEvents().size(), notification.getTitle());
        return notification;
    }

    private boolean isCoolingDown(Event event) {
        LedgerEntry last = ledger.get(ledgerKey(event));
        if (last == null) {
            return false;
        }
        boolean withinCooldown = event.getTimestamp() - last.timestamp
                < properties.getNotification().getCooldown().toMillis();
        return withinCooldown && !event.getLevel().isHigherThan(last.level);
    }

    private void pruneLedger(long now) {
        long horizon = now - properties.getNotification().getCooldown().toMillis();
        ledger.values().removeIf(entry -> entry.timestamp <= horizon);
    }

    private static String ledgerKey(Event event) {
        return event.getSubtype().name() + "|" + event.getInstrument();
    }

    private static final class LedgerEntry {
        final long timestamp;
        final EventLevel level;

        LedgerEntry(long timestamp, EventLevel level) {
            this.timestamp = timestamp;
            this.level = level;
        }
    }
}
