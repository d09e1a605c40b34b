package com.civic.anomaly.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum CategoryStatus {
    ANOMALIES_FOUND,
    CLEAN,
    PARTIAL,
    FAILED,
    SKIPPED;

    public boolean isDegraded() {
        return this == PARTIAL || this == FAILED;
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
