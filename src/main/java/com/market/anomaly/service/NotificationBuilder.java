package com.market.anomaly.service;

import com.market.anomaly.engine.RuleEngine;
import com.market.anomaly.model.Event;
import com.market.anomaly.model.MarketState;
import com.market.anomaly.model.Notification;
import com.market.anomaly.model.NotificationFormat;
import com.market.anomaly.model.StateTransition;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Renders notifications. Each format populates its own fields:
 * <ul>
 *   <li>FLASH: the event description as the only line</li>
 *   <li>CARD: up to three event lines and one state line</li>
 *   <li>ALERT: the event lines, a status line and a score line</li>
 * </ul>
 */
@Component
public class NotificationBuilder {

    static final int CARD_EVENT_LINES = 3;
    static final String RESONANCE_TITLE = "Multi-indicator resonance";

    /**
     * @param primary    the events being reported, in priority order
     * @param supporting earlier events corroborating an aggregated notification, may be empty
     */
    public Notification build(String notificationId, NotificationFormat format, List<Event> primary,
                              List<Event> supporting, StateTransition transition) {
        MarketState state = transition.getCurrent();
        boolean aggregated = !supporting.isEmpty() || primary.size() > 1;

        List<Event> all = new ArrayList<>(primary);
        all.addAll(supporting);
        all.sort(RuleEngine.EVENT_ORDER);

        Notification.NotificationBuilder builder = Notification.builder()
                .notificationId(notificationId)
                .timestamp(state.getTimestamp())
                .format(format);
        primary.forEach(e -> builder.relatedEvent(e.getEventId()));
        supporting.forEach(e -> builder.relatedEvent(e.getEventId()));

        switch (format) {
            case FLASH:
                Event event = primary.get(0);
                builder.title(event.getSubtype().getDisplayName())
                        .line(event.getDescription());
                break;
            case CARD:
                builder.title(aggregated ? RESONANCE_TITLE : primary.get(0).getSubtype().getDisplayName());
                all.stream().limit(CARD_EVENT_LINES).forEach(e -> builder.line(e.getDescription()));
                builder.line(String.format(Locale.ROOT, "Market %s, sentiment score %.1f",
                        state.getStatus().code(), state.getSentimentScore()));
                break;
            case ALERT:
                builder.title("Market alert: " + (aggregated ? RESONANCE_TITLE : primary.get(0).getSubtype().getDisplayName()));
                all.forEach(e -> builder.line(e.getDescription()));
                builder.line("Market status: " + transition.getPrevious().getStatus().code().toUpperCase(Locale.ROOT)
                        + " -> " + state.getStatus().code().toUpperCase(Locale.ROOT));
                builder.line(String.format(Locale.ROOT, "Sentiment score: %.1f (%+.1f)",
                        state.getSentimentScore(), transition.scoreDelta()));
                break;
            default:
                throw new IllegalArgumentException("Unknown notification format: " + format);
        }
        return builder.build();
    }
}
