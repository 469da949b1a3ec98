package com.market.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Data
@Configuration
@ConfigurationProperties(prefix = "anomaly")
public class AnomalyProperties {

    private Window window = new Window();

    private Rules rules = new Rules();

    private Scoring scoring = new Scoring();

    private NotificationSettings notification = new NotificationSettings();

    private History history = new History();

    private Pipeline pipeline = new Pipeline();

    @Data
    public static class Window {
        // Retention of every (instrument, metric) window. Must stay within 15-30 minutes.
        private Duration span = Duration.ofMinutes(30);
        // Fewer samples than this in a queried span means InsufficientData.
        private int minSamples = 3;
    }

    @Data
    public static class Rules {
        // sentiment_turning_up
        private Duration volumeBaselineWindow = Duration.ofMinutes(30);
        private double volumeSpikeRatio = 1.3;
        private double volumeHighRatio = 2.0;
        private Duration limitUpLookback = Duration.ofMinutes(15);

        // sentiment_turning_down, bomb rate as a ratio in [0, 1]
        private double limitDownThreshold = 3;
        private double bombRateThreshold = 0.30;
        private double bombRateHigh = 0.50;
        private double limitDownHigh = 10;

        // flow_withdrawal, outflow in the flow's currency units
        private Duration withdrawalWindow = Duration.ofMinutes(10);
        private double withdrawalOutflow = 1.0e9;

        // flow_reversal
        private Duration reversalSlopeWindow = Duration.ofMinutes(3);
        private int reversalConfirmTicks = 3;

        // theme_emergence
        private Duration themeLookback = Duration.ofMinutes(15);
        private int themeTopN = 3;
        private double sectorVolumeSpikeRatio = 1.5;

        // theme_exhaustion
        private Duration sectorTrendWindow = Duration.ofMinutes(15);
        private double sectorFlatSlope = 0.0;
        private double leaderBelowVwapMediumPct = 2.0;
    }

    @Data
    public static class Scoring {
        private double decayRatePerMinute = 0.5;
        private double redThreshold = 70.0;
        private double greenThreshold = 30.0;
        private Weights weights = new Weights();
    }

    @Data
    public static class Weights {
        private double low = 5.0;
        private double medium = 15.0;
        private double high = 30.0;
    }

    @Data
    public static class NotificationSettings {
        // Same (subtype, instrument) at equal or lower level is suppressed within this span.
        private Duration cooldown = Duration.ofMinutes(30);
        // Distinct subtypes inside this span are reported as one aggregated card.
        private Duration correlationWindow = Duration.ofMinutes(10);
        // Alerts beyond this count in a rolling hour are downgraded to cards.
        private int maxAlertsPerHour = 5;
        // Emitted notifications kept for the REST endpoint.
        private int logSize = 200;
    }

    @Data
    public static class History {
        private Duration retention = Duration.ofHours(24);
        private int maxEvents = 1000;
        private int stateHistorySize = 500;
    }

    @Data
    public static class Pipeline {
        private int ruleThreads = 4;
        private Duration shutdownTimeout = Duration.ofSeconds(30);
    }
}
