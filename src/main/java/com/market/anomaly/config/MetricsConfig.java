package com.market.anomaly.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    // score x 100, gauges need a number holder
    private final AtomicLong sentimentScoreCentis;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.sentimentScoreCentis = new AtomicLong(5000);
        registry.gauge("market.sentiment.score", sentimentScoreCentis, v -> v.get() / 100.0);
    }

    public void recordSampleIngested(String metric) {
        Counter.builder("sample.ingested.count")
                .tag("metric", metric)
                .register(registry)
                .increment();
    }

    public void recordSampleRejected(String reason) {
        Counter.builder("sample.rejected.count")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordRuleTriggered(String subtype, String level) {
        Counter.builder("rule.triggered.count")
                .tag("subtype", subtype)
                .tag("level", level)
                .register(registry)
                .increment();
    }

    public void recordNotificationEmitted(String format) {
        Counter.builder("notification.emitted.count")
                .tag("format", format)
                .register(registry)
                .increment();
    }

    public void recordNotificationSuppressed(String reason) {
        Counter.builder("notification.suppressed.count")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void updateSentimentScore(double score) {
        sentimentScoreCentis.set(Math.round(score * 100.0));
    }
}
