package com.civic.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Configuration of a detection rule")
public class DetectionRule {

    @Schema(description = "Generated rule identifier", example = "0b6f1c1e-8a43-4c1e-9d57-2a0f4d3c9e11")
    private String ruleId;

    @Schema(description = "Globally unique rule name", example = "transaction_amount_outlier")
    private String name;

    @Schema(description = "What the rule detects", example = "Detects transactions with unusual amounts")
    private String description;

    @Schema(description = "Detector category that evaluates this rule", example = "statistical")
    private RuleCategory category;

    @Schema(description = "Heuristic within the category", example = "z_score_iqr")
    private DetectionMethod method;

    @Schema(description = "Method-specific threshold. z-score limit for outliers, minimum count for action counts, etc.",
            example = "3.0")
    private double thresholdValue;

    @Schema(description = "Severity assigned to anomalies raised by this rule", example = "medium")
    @Builder.Default
    private Severity severity = Severity.MEDIUM;

    @Schema(description = "Inactive rules are never evaluated", example = "true")
    @Builder.Default
    private boolean active = true;

    @Schema(description = "Method-specific parameters",
            example = "{\"metric\": \"transaction_amount\", \"entityType\": \"order\", \"period\": \"daily\"}")
    @Builder.Default
    private Map<String, String> params = new HashMap<>();

    @Schema(description = "Creation time in epoch milliseconds", example = "1739886764000")
    private long createdAt;

    public String getParam(String key) {
        if (params == null) return null;
        String val = params.get(key);
        return (val == null || val.isBlank()) ? null : val.trim();
    }

    public String getParam(String key, String defaultValue) {
        String val = getParam(key);
        return val != null ? val : defaultValue;
    }

    public double getParamAsDouble(String key, double defaultValue) {
        String val = getParam(key);
        if (val == null) return defaultValue;
        try {
            return Double.parseDouble(val);
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public long getParamAsLong(String key, long defaultValue) {
        String val = getParam(key);
        if (val == null) return defaultValue;
        try {
            return Long.parseLong(val);
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }
}
