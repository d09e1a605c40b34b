package com.civic.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Detection rule category. Each category is served by exactly one Detector.
 */
public enum RuleCategory {
    STATISTICAL("Statistical Outliers"),
    BEHAVIORAL("Behavioral Anomalies"),
    TEMPORAL("Temporal Patterns"),
    PATTERN("Network Analysis");

    private final String displayName;

    RuleCategory(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static RuleCategory fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Rule category is required");
        }
        for (RuleCategory category : values()) {
            if (category.name().equalsIgnoreCase(value.trim())) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown rule category: " + value);
    }
}
