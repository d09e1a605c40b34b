package com.civic.anomaly.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger pendingAnomalies;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.pendingAnomalies = registry.gauge("anomaly.pending.count", new AtomicInteger(0));
    }

    public void recordScan(String status, long durationMs) {
        Counter.builder("scan.count")
                .tag("status", status)
                .register(registry)
                .increment();

        Timer.builder("scan.duration")
                .tag("status", status)
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordCategory(String category, String status, long durationMs) {
        Timer.builder("detector.duration")
                .tag("category", category)
                .tag("status", status)
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordFinding(String ruleName) {
        Counter.builder("detector.finding.count")
                .tag("rule", ruleName)
                .register(registry)
                .increment();
    }

    public void recordAnomalyCreated(String category, String severity) {
        Counter.builder("anomaly.created.count")
                .tag("category", category)
                .tag("severity", severity)
                .register(registry)
                .increment();
    }

    public void recordDuplicateSkipped(String category) {
        Counter.builder("anomaly.duplicate.count")
                .tag("category", category)
                .register(registry)
                .increment();
    }

    public void recordTransition(String status) {
        Counter.builder("anomaly.transition.count")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordBaselineRefresh(String outcome) {
        Counter.builder("baseline.refresh.count")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordAlert(String kpi) {
        Counter.builder("alert.raised.count")
                .tag("kpi", kpi)
                .register(registry)
                .increment();
    }

    public void recordNotification(String channel, String status) {
        Counter.builder("notification.sent.count")
                .tag("channel", channel)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void updatePendingCount(int count) {
        pendingAnomalies.set(count);
    }
}
