package com.civic.anomaly.exception;

/** Storage of anomalies, baselines or rules failed. */
public class AnomalyPersistenceException extends RuntimeException {

    public AnomalyPersistenceException(String message) {
        super(message);
    }

    public AnomalyPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
