package com.market.anomaly.service;

import com.market.anomaly.config.AnomalyProperties;
import com.market.anomaly.model.Notification;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;

/**
 * The most recently emitted notifications, for introspection.
 */
@Component
public class NotificationLog {

    private final int capacity;
    private final Deque<Notification> entries = new ArrayDeque<>();

    public NotificationLog(AnomalyProperties properties) {
        this.capacity = properties.getNotification().getLogSize();
    }

    public synchronized void addAll(Collection<Notification> notifications) {
        for (Notification notification : notifications) {
            entries.addLast(notification);
            if (entries.size() > capacity) {
                entries.removeFirst();
            }
        }
    }

    /**
     * Up to {@code limit} of the newest notifications, in emission order.
     */
    public synchronized List<Notification> recent(int limit) {
        List<Notification> all = new ArrayList<>(entries);
        int from = Math.max(0, all.size() - Math.max(0, limit));
        return new ArrayList<>(all.subList(from, all.size()));
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized void clear() {
        entries.clear();
    }
}
