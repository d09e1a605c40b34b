package com.civic.anomaly.engine;

import com.civic.anomaly.model.CategoryStatus;
import com.civic.anomaly.model.Finding;
import com.civic.anomaly.model.RuleCategory;

import java.util.List;

/**
 * Result of running one detector category within a scan.
 */
public record CategoryOutcome(RuleCategory category,
                              List<Finding> findings,
                              CategoryStatus status,
                              List<String> errors,
                              long executionTimeMs) {

    public static CategoryOutcome skipped(RuleCategory category, String reason) {
        return new CategoryOutcome(category, List.of(), CategoryStatus.SKIPPED,
                reason != null ? List.of(reason) : List.of(), 0);
    }

    public static CategoryOutcome failed(RuleCategory category, String error, long executionTimeMs) {
        return new CategoryOutcome(category, List.of(), CategoryStatus.FAILED, List.of(error), executionTimeMs);
    }
}
