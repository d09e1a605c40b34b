package com.civic.anomaly.model;

import com.civic.anomaly.model.evidence.FindingEvidence;

/**
 * A candidate anomaly produced by a detector, before it is persisted.
 */
public record Finding(DetectionRule rule,
                      String entityType,
                      String entityId,
                      double score,
                      FindingEvidence evidence) {

    public Finding {
        if (rule == null) throw new IllegalArgumentException("Finding requires a rule");
        if (entityType == null || entityId == null) {
            throw new IllegalArgumentException("Finding requires an entity type and id");
        }
        // scores are non-negative by contract
        score = Double.isFinite(score) ? Math.max(0.0, score) : 0.0;
    }

    public RuleCategory category() {
        return rule.getCategory();
    }
}
