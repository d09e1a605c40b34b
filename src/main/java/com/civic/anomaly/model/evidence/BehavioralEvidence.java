package com.civic.anomaly.model.evidence;

import java.util.List;

/**
 * Aggregates over an entity's activity window. Fields irrelevant to the method
 * that produced the finding are null.
 */
public record BehavioralEvidence(String method,
                                 int windowDays,
                                 String eventType,
                                 Long eventCount,
                                 Double totalValue,
                                 Double latencyDays,
                                 List<String> channels,
                                 double threshold) implements FindingEvidence {
}
