package com.civic.anomaly.testutil;

import com.civic.anomaly.dataset.ActivityDataset;
import com.civic.anomaly.dataset.ActivityEvent;
import com.civic.anomaly.dataset.EntityRecord;
import com.civic.anomaly.dataset.MetricSample;
import com.civic.anomaly.engine.ScanContext;
import com.civic.anomaly.model.*;
import com.civic.anomaly.model.evidence.BehavioralEvidence;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Shared test data builders to avoid repeating construction boilerplate across test classes.
 */
public final class TestDataFactory {

    public static final long NOW = Instant.parse("2026-03-15T12:00:00Z").toEpochMilli();
    public static final long DAY = WindowSpec.DAY_MILLIS;
    public static final long HOUR = 60L * 60 * 1000;

    private TestDataFactory() {}

    /**
     * Rule with params given as alternating key/value pairs.
     */
    public static DetectionRule createRule(String name, DetectionMethod method, double threshold, String... params) {
        Map<String, String> paramMap = new HashMap<>();
        for (int i = 0; i + 1 < params.length; i += 2) {
            paramMap.put(params[i], params[i + 1]);
        }
        return DetectionRule.builder()
                .ruleId("R-" + name)
                .name(name)
                .description("Test rule: " + name)
                .category(method.getCategory())
                .method(method)
                .thresholdValue(threshold)
                .severity(Severity.MEDIUM)
                .active(true)
                .params(paramMap)
                .createdAt(NOW)
                .build();
    }

    public static StatisticalBaseline createBaseline(String metric, String entityType,
                                                     double mean, double stddev, double q1, double q3, long n) {
        return StatisticalBaseline.builder()
                .metricName(metric)
                .entityType(entityType)
                .timePeriod("daily")
                .mean(mean)
                .stddev(stddev)
                .median((q1 + q3) / 2)
                .q1(q1)
                .q3(q3)
                .sampleSize(n)
                .calculatedAt(NOW)
                .build();
    }

    public static MetricSample createSample(String metric, String entityType, String entityId,
                                            double value, long observedAt) {
        return new MetricSample(UUID.randomUUID().toString(), metric, entityType, entityId, value, observedAt);
    }

    public static ActivityEvent createEvent(String actorType, String actorId, String eventType, long occurredAt) {
        return new ActivityEvent(UUID.randomUUID().toString(), actorType, actorId, null, null,
                eventType, "web", null, occurredAt);
    }

    public static ActivityEvent createTargetedEvent(String actorId, String targetId, Double amount, long occurredAt) {
        return new ActivityEvent(UUID.randomUUID().toString(), "citizen", actorId, "merchant", targetId,
                "order", "web", amount, occurredAt);
    }

    public static EntityRecord createEntity(String entityType, String entityId, long createdAt, String... attributes) {
        Map<String, String> attributeMap = new HashMap<>();
        for (int i = 0; i + 1 < attributes.length; i += 2) {
            attributeMap.put(attributes[i], attributes[i + 1]);
        }
        return new EntityRecord(entityType, entityId, createdAt, attributeMap);
    }

    public static ScanContext createContext(ActivityDataset dataset, DetectionRule... rules) {
        return createContext(dataset, Map.of(), rules);
    }

    public static ScanContext createContext(ActivityDataset dataset, Map<String, StatisticalBaseline> baselines,
                                            DetectionRule... rules) {
        Map<RuleCategory, List<DetectionRule>> byCategory = new EnumMap<>(RuleCategory.class);
        for (DetectionRule rule : rules) {
            byCategory.computeIfAbsent(rule.getCategory(), c -> new ArrayList<>()).add(rule);
        }
        return ScanContext.builder()
                .scanId("scan-test")
                .scanTime(NOW)
                .dataset(dataset)
                .rules(byCategory)
                .baselines(baselines)
                .build();
    }

    public static Finding createFinding(DetectionRule rule, String entityId, double score) {
        BehavioralEvidence evidence = new BehavioralEvidence(rule.getMethod().getValue(), 30, null,
                (long) score, null, null, null, rule.getThresholdValue());
        return new Finding(rule, "citizen", entityId, score, evidence);
    }

    public static Anomaly createAnomaly(String anomalyId, String ruleName, Severity severity,
                                        ResolutionStatus status, long detectedAt) {
        return Anomaly.builder()
                .anomalyId(anomalyId)
                .ruleId("R-" + ruleName)
                .ruleName(ruleName)
                .category(RuleCategory.BEHAVIORAL)
                .severity(severity)
                .entityType("citizen")
                .entityId("C-" + anomalyId)
                .anomalyScore(5.0)
                .detectedAt(detectedAt)
                .status(status)
                .build();
    }
}
