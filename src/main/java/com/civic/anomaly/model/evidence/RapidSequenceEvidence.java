package com.civic.anomaly.model.evidence;

/**
 * Longest burst of closely spaced events between an actor and a single target.
 * Times are epoch milliseconds.
 */
public record RapidSequenceEvidence(String targetType,
                                    String targetId,
                                    int count,
                                    double minGapSeconds,
                                    double avgGapSeconds,
                                    long maxGapSeconds,
                                    long firstEventAt,
                                    long lastEventAt) implements FindingEvidence {
}
