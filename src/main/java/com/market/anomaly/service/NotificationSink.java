package com.market.anomaly.service;

import com.market.anomaly.model.Notification;

/**
 * Delivery collaborator for emitted notifications. Every sink bean receives every
 * notification, in emission order, from the pipeline thread.
 */
public interface NotificationSink {

    void deliver(Notification notification);
}
