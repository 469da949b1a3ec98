package com.market.anomaly.controller;

import com.market.anomaly.model.Event;
import com.market.anomaly.service.StateManager;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/events")
@Tag(name = "Events", description = "Anomaly events retained by the state manager")
public class EventController {

    private final StateManager stateManager;

    public EventController(StateManager stateManager) {
        this.stateManager = stateManager;
    }

    @GetMapping
    @Operation(summary = "List retained events",
               description = "Returns events detected within the given number of minutes before the latest " +
                       "state update, oldest first, with a resonance flag (two or more distinct subtypes)")
    public ResponseEntity<Map<String, Object>> getEvents(
            @Parameter(description = "Look-back in minutes", example = "30")
            @RequestParam(defaultValue = "30") long withinMinutes) {
        if (withinMinutes <= 0) {
            return ResponseEntity.badRequest().body(Map.of(
                    "error", "withinMinutes must be > 0", "field", "withinMinutes"));
        }
        Duration within = Duration.ofMinutes(withinMinutes);
        List<Event> events = stateManager.recentEvents(within);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("withinMinutes", withinMinutes);
        response.put("eventCount", events.size());
        response.put("resonant", stateManager.isResonant(within));
        response.put("events", events);
        return ResponseEntity.ok(response);
    }
}
