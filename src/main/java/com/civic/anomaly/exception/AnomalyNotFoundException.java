package com.civic.anomaly.exception;

public class AnomalyNotFoundException extends RuntimeException {

    public AnomalyNotFoundException(String anomalyId) {
        super("Anomaly not found: " + anomalyId);
    }
}
