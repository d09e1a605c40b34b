package com.civic.anomaly.model;

/**
 * Query filter for persisted anomalies. Null fields do not filter.
 * Detection time bounds are inclusive epoch milliseconds.
 */
public record AnomalyFilter(String entityType,
                            Severity severity,
                            ResolutionStatus status,
                            String ruleName,
                            Long detectedFrom,
                            Long detectedTo,
                            int limit) {

    public static final int DEFAULT_LIMIT = 100;

    public static AnomalyFilter all() {
        return new AnomalyFilter(null, null, null, null, null, null, Integer.MAX_VALUE);
    }

    public static AnomalyFilter detectedSince(long fromMillis) {
        return new AnomalyFilter(null, null, null, null, fromMillis, null, Integer.MAX_VALUE);
    }

    public boolean matches(Anomaly anomaly) {
        if (entityType != null && !entityType.equalsIgnoreCase(anomaly.getEntityType())) return false;
        if (severity != null && severity != anomaly.getSeverity()) return false;
        if (status != null && status != anomaly.getStatus()) return false;
        if (ruleName != null && !ruleName.equals(anomaly.getRuleName())) return false;
        if (detectedFrom != null && anomaly.getDetectedAt() < detectedFrom) return false;
        if (detectedTo != null && anomaly.getDetectedAt() > detectedTo) return false;
        return true;
    }

    public int effectiveLimit() {
        return limit > 0 ? limit : DEFAULT_LIMIT;
    }
}
