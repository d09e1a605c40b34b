package com.civic.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.Map;

/**
 * Operator edit of an existing rule. Null fields are left unchanged; params, when
 * present, replace the whole map.
 */
@Schema(description = "Changes to an existing rule; omitted fields are unchanged")
public record RuleUpdate(
        @Schema(example = "Detects orders far above the usual amount") String description,
        @Schema(example = "3.5") Double thresholdValue,
        @Schema(example = "high") Severity severity,
        Map<String, String> params) {
}
