package com.market.anomaly.controller;

import com.market.anomaly.model.Notification;
import com.market.anomaly.service.NotificationLog;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/notifications")
@Tag(name = "Notifications", description = "Recently emitted flash, card and alert notifications")
public class NotificationController {

    private final NotificationLog notificationLog;

    public NotificationController(NotificationLog notificationLog) {
        this.notificationLog = notificationLog;
    }

    @GetMapping
    @Operation(summary = "List recent notifications", description = "Newest last")
    public ResponseEntity<List<Notification>> getNotifications(
            @Parameter(description = "Max number of notifications to return", example = "20")
            @RequestParam(defaultValue = "50") int limit) {
        if (limit <= 0) {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(notificationLog.recent(limit));
    }
}
