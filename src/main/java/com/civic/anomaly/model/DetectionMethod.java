package com.civic.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

/**
 * The concrete heuristic a rule runs. Every method belongs to one category and
 * declares the rule params it cannot run without.
 */
public enum DetectionMethod {
    Z_SCORE_IQR(RuleCategory.STATISTICAL, "metric", "entityType"),

    ACTION_COUNT(RuleCategory.BEHAVIORAL, "entityType"),
    CUMULATIVE_VALUE(RuleCategory.BEHAVIORAL, "entityType"),
    FIRST_ACTION_LATENCY(RuleCategory.BEHAVIORAL, "entityType"),
    DISTINCT_CHANNELS(RuleCategory.BEHAVIORAL, "entityType"),

    HOURLY_DEVIATION(RuleCategory.TEMPORAL, "entityType"),
    RAPID_SEQUENCE(RuleCategory.TEMPORAL, "entityType"),

    ATTRIBUTE_CLUSTERING(RuleCategory.PATTERN, "entityType"),
    SELF_DEALING(RuleCategory.PATTERN, "entityType", "targetType"),
    BILATERAL_VOLUME(RuleCategory.PATTERN, "entityType", "targetType");

    private final RuleCategory category;
    private final List<String> requiredParams;

    DetectionMethod(RuleCategory category, String... requiredParams) {
        this.category = category;
        this.requiredParams = List.of(requiredParams);
    }

    public RuleCategory getCategory() {
        return category;
    }

    public List<String> getRequiredParams() {
        return requiredParams;
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static DetectionMethod fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Detection method is required");
        }
        for (DetectionMethod method : values()) {
            if (method.name().equalsIgnoreCase(value.trim())) {
                return method;
            }
        }
        throw new IllegalArgumentException("Unknown detection method: " + value);
    }
}
