package com.civic.anomaly.exception;

/**
 * A detector could not evaluate one entity or rule. Detectors skip the entity and continue.
 */
public class DetectionException extends RuntimeException {

    public DetectionException(String message) {
        super(message);
    }

    public DetectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
