package com.market.anomaly.config;

import com.market.anomaly.exception.ConfigurationException;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Fails startup on thresholds or windows the pipeline cannot run with.
 */
@Component
public class AnomalyPropertiesValidator {

    private static final Logger log = LoggerFactory.getLogger(AnomalyPropertiesValidator.class);

    private static final Duration MIN_WINDOW_SPAN = Duration.ofMinutes(15);
    private static final Duration MAX_WINDOW_SPAN = Duration.ofMinutes(30);

    private final AnomalyProperties properties;

    public AnomalyPropertiesValidator(AnomalyProperties properties) {
        this.properties = properties;
    }

    @PostConstruct
    public void validateOnStartup() {
        validate(properties);
        log.info("Anomaly configuration accepted: windowSpan={}, cooldown={}, correlationWindow={}, " +
                        "maxAlertsPerHour={}, decayRatePerMinute={}",
                properties.getWindow().getSpan(),
                properties.getNotification().getCooldown(),
                properties.getNotification().getCorrelationWindow(),
                properties.getNotification().getMaxAlertsPerHour(),
                properties.getScoring().getDecayRatePerMinute());
    }

    public static void validate(AnomalyProperties properties) {
        AnomalyProperties.Window window = properties.getWindow();
        requirePositive(window.getSpan(), "anomaly.window.span");
        if (window.getSpan().compareTo(MIN_WINDOW_SPAN) < 0 || window.getSpan().compareTo(MAX_WINDOW_SPAN) > 0) {
            throw new ConfigurationException("anomaly.window.span must be between 15 and 30 minutes, got "
                    + window.getSpan());
        }
        if (window.getMinSamples() < 1) {
            throw new ConfigurationException("anomaly.window.min-samples must be >= 1");
        }

        AnomalyProperties.Rules rules = properties.getRules();
        requireWithinSpan(rules.getVolumeBaselineWindow(), "anomaly.rules.volume-baseline-window", window.getSpan());
        requireWithinSpan(rules.getLimitUpLookback(), "anomaly.rules.limit-up-lookback", window.getSpan());
        requireWithinSpan(rules.getWithdrawalWindow(), "anomaly.rules.withdrawal-window", window.getSpan());
        requireWithinSpan(rules.getReversalSlopeWindow(), "anomaly.rules.reversal-slope-window", window.getSpan());
        requireWithinSpan(rules.getThemeLookback(), "anomaly.rules.theme-lookback", window.getSpan());
        requireWithinSpan(rules.getSectorTrendWindow(), "anomaly.rules.sector-trend-window", window.getSpan());
        requirePositive(rules.getVolumeSpikeRatio(), "anomaly.rules.volume-spike-ratio");
        if (rules.getVolumeHighRatio() < rules.getVolumeSpikeRatio()) {
            throw new ConfigurationException(
                    "anomaly.rules.volume-high-ratio must be >= anomaly.rules.volume-spike-ratio");
        }
        requirePositive(rules.getSectorVolumeSpikeRatio(), "anomaly.rules.sector-volume-spike-ratio");
        requirePositive(rules.getWithdrawalOutflow(), "anomaly.rules.withdrawal-outflow");
        if (rules.getBombRateThreshold() < 0 || rules.getBombRateThreshold() > 1) {
            throw new ConfigurationException("anomaly.rules.bomb-rate-threshold must be a ratio in [0, 1]");
        }
        if (rules.getReversalConfirmTicks() < 1) {
            throw new ConfigurationException("anomaly.rules.reversal-confirm-ticks must be >= 1");
        }
        if (rules.getThemeTopN() < 1) {
            throw new ConfigurationException("anomaly.rules.theme-top-n must be >= 1");
        }

        AnomalyProperties.Scoring scoring = properties.getScoring();
        if (scoring.getDecayRatePerMinute() < 0) {
            throw new ConfigurationException("anomaly.scoring.decay-rate-per-minute must be >= 0");
        }
        if (!(scoring.getGreenThreshold() < 50.0 && 50.0 < scoring.getRedThreshold())) {
            throw new ConfigurationException("anomaly.scoring thresholds must satisfy green < 50 < red");
        }
        if (scoring.getRedThreshold() > 100.0 || scoring.getGreenThreshold() < 0.0) {
            throw new ConfigurationException("anomaly.scoring thresholds must lie within [0, 100]");
        }
        AnomalyProperties.Weights weights = scoring.getWeights();
        if (weights.getLow() < 0 || weights.getLow() > weights.getMedium() || weights.getMedium() > weights.getHigh()) {
            throw new ConfigurationException("anomaly.scoring.weights must satisfy 0 <= low <= medium <= high");
        }

        AnomalyProperties.NotificationSettings notification = properties.getNotification();
        requirePositive(notification.getCooldown(), "anomaly.notification.cooldown");
        requirePositive(notification.getCorrelationWindow(), "anomaly.notification.correlation-window");
        if (notification.getMaxAlertsPerHour() < 0) {
            throw new ConfigurationException("anomaly.notification.max-alerts-per-hour must be >= 0");
        }
        if (notification.getLogSize() < 1) {
            throw new ConfigurationException("anomaly.notification.log-size must be >= 1");
        }

        AnomalyProperties.History history = properties.getHistory();
        requirePositive(history.getRetention(), "anomaly.history.retention");
        if (history.getRetention().compareTo(notification.getCorrelationWindow()) < 0) {
            throw new ConfigurationException(
                    "anomaly.history.retention must cover anomaly.notification.correlation-window");
        }
        if (history.getMaxEvents() < 1 || history.getStateHistorySize() < 1) {
            throw new ConfigurationException("anomaly.history sizes must be >= 1");
        }

        AnomalyProperties.Pipeline pipeline = properties.getPipeline();
        if (pipeline.getRuleThreads() < 1) {
            throw new ConfigurationException("anomaly.pipeline.rule-threads must be >= 1");
        }
        requirePositive(pipeline.getShutdownTimeout(), "anomaly.pipeline.shutdown-timeout");
    }

    private static void requirePositive(Duration value, String name) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new ConfigurationException(name + " must be a positive duration");
        }
    }

    private static void requirePositive(double value, String name) {
        if (!(value > 0)) {
            throw new ConfigurationException(name + " must be > 0");
        }
    }

    private static void requireWithinSpan(Duration value, String name, Duration span) {
        requirePositive(value, name);
        if (value.compareTo(span) > 0) {
            throw new ConfigurationException(name + " must not exceed anomaly.window.span (" + span + ")");
        }
    }
}
