package com.finops.anomaly.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger trackedModelKeys;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.trackedModelKeys = registry.gauge("anomaly.model.keys", new AtomicInteger(0));
    }

    public void recordSampleEvaluated(String metricName) {
        Counter.builder("anomaly.samples.count")
                .tag("metric", metricName)
                .register(registry)
                .increment();
    }

    public void recordAnomaly(String metricName, String severity, double confidence) {
        Counter.builder("anomaly.detected.count")
                .tag("metric", metricName)
                .tag("severity", severity)
                .register(registry)
                .increment();

        DistributionSummary.builder("anomaly.confidence")
                .tag("metric", metricName)
                .register(registry)
                .record(confidence);
    }

    public void recordDelivery(String channel, String status) {
        Counter.builder("alert.delivery.count")
                .tag("channel", channel)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordAlertSend(Duration elapsed, boolean slaMet) {
        Timer.builder("alert.send.duration")
                .tag("sla_met", String.valueOf(slaMet))
                .register(registry)
                .record(elapsed);
    }

    public void updateTrackedModelKeys(int count) {
        trackedModelKeys.set(count);
    }
}
