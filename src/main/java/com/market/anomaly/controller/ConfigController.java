package com.market.anomaly.controller;

import com.market.anomaly.config.AnomalyProperties;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/config")
@Tag(name = "Config", description = "View the effective detection configuration (windows, thresholds, scoring, notification)")
public class ConfigController {

    private final AnomalyProperties properties;

    public ConfigController(AnomalyProperties properties) {
        this.properties = properties;
    }

    @Operation(summary = "Get the effective configuration",
            description = "Durations are reported in minutes, except the shutdown timeout in seconds.")
    @GetMapping
    public ResponseEntity<Map<String, Object>> getConfig() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("window", window());
        response.put("rules", rules());
        response.put("scoring", scoring());
        response.put("notification", notification());
        response.put("history", history());
        response.put("pipeline", pipeline());
        return ResponseEntity.ok(response);
    }

    // ── Sections ──

    private Map<String, Object> window() {
        AnomalyProperties.Window w = properties.getWindow();
        Map<String, Object> section = new LinkedHashMap<>();
        section.put("spanMinutes", minutes(w.getSpan()));
        section.put("minSamples", w.getMinSamples());
        return section;
    }

    private Map<String, Object> rules() {
        AnomalyProperties.Rules r = properties.getRules();
        Map<String, Object> section = new LinkedHashMap<>();
        section.put("volumeBaselineWindowMinutes", minutes(r.getVolumeBaselineWindow()));
        section.put("volumeSpikeRatio", r.getVolumeSpikeRatio());
        section.put("volumeHighRatio", r.getVolumeHighRatio());
        section.put("limitUpLookbackMinutes", minutes(r.getLimitUpLookback()));
        section.put("limitDownThreshold", r.getLimitDownThreshold());
        section.put("bombRateThreshold", r.getBombRateThreshold());
        section.put("bombRateHigh", r.getBombRateHigh());
        section.put("limitDownHigh", r.getLimitDownHigh());
        section.put("withdrawalWindowMinutes", minutes(r.getWithdrawalWindow()));
        section.put("withdrawalOutflow", r.getWithdrawalOutflow());
        section.put("reversalSlopeWindowMinutes", minutes(r.getReversalSlopeWindow()));
        section.put("reversalConfirmTicks", r.getReversalConfirmTicks());
        section.put("themeLookbackMinutes", minutes(r.getThemeLookback()));
        section.put("themeTopN", r.getThemeTopN());
        section.put("sectorVolumeSpikeRatio", r.getSectorVolumeSpikeRatio());
        section.put("sectorTrendWindowMinutes", minutes(r.getSectorTrendWindow()));
        section.put("sectorFlatSlope", r.getSectorFlatSlope());
        section.put("leaderBelowVwapMediumPct", r.getLeaderBelowVwapMediumPct());
        return section;
    }

    private Map<String, Object> scoring() {
        AnomalyProperties.Scoring s = properties.getScoring();
        Map<String, Object> weights = new LinkedHashMap<>();
        weights.put("low", s.getWeights().getLow());
        weights.put("medium", s.getWeights().getMedium());
        weights.put("high", s.getWeights().getHigh());

        Map<String, Object> section = new LinkedHashMap<>();
        section.put("decayRatePerMinute", s.getDecayRatePerMinute());
        section.put("redThreshold", s.getRedThreshold());
        section.put("greenThreshold", s.getGreenThreshold());
        section.put("weights", weights);
        return section;
    }

    private Map<String, Object> notification() {
        AnomalyProperties.NotificationSettings n = properties.getNotification();
        Map<String, Object> section = new LinkedHashMap<>();
        section.put("cooldownMinutes", minutes(n.getCooldown()));
        section.put("correlationWindowMinutes", minutes(n.getCorrelationWindow()));
        section.put("maxAlertsPerHour", n.getMaxAlertsPerHour());
        section.put("logSize", n.getLogSize());
        return section;
    }

    private Map<String, Object> history() {
        AnomalyProperties.History h = properties.getHistory();
        Map<String, Object> section = new LinkedHashMap<>();
        section.put("retentionMinutes", minutes(h.getRetention()));
        section.put("maxEvents", h.getMaxEvents());
        section.put("stateHistorySize", h.getStateHistorySize());
        return section;
    }

    private Map<String, Object> pipeline() {
        AnomalyProperties.Pipeline p = properties.getPipeline();
        Map<String, Object> section = new LinkedHashMap<>();
        section.put("ruleThreads", p.getRuleThreads());
        section.put("shutdownTimeoutSeconds", p.getShutdownTimeout().toSeconds());
        return section;
    }

    private static long minutes(Duration duration) {
        return duration.toMinutes();
    }
}
