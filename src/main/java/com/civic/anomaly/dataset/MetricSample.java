package com.civic.anomaly.dataset;

/**
 * One observed value of a metric, e.g. the amount of a single order.
 */
public record MetricSample(String sampleId,
                           String metric,
                           String entityType,
                           String entityId,
                           double value,
                           long observedAt) {
}
