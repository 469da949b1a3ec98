package com.market.anomaly.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.market.anomaly.model.Notification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Default sink: writes each notification to the log as JSON.
 */
@Component
public class LoggingNotificationSink implements NotificationSink {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotificationSink.class);

    private final ObjectMapper objectMapper;

    public LoggingNotificationSink(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void deliver(Notification notification) {
        try {
            log.info("Notification {}: {}", notification.getFormat(), objectMapper.writeValueAsString(notification));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize notification {}: {}", notification.getNotificationId(), e.getMessage(), e);
        }
    }
}
