package com.civic.anomaly.model;

/**
 * Counters over a reporting window that alert thresholds can watch.
 */
public enum AlertKpi {
    TOTAL,
    PENDING,
    CRITICAL,
    HIGH,
    CONFIRMED
}
