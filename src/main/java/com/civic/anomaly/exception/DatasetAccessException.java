package com.civic.anomaly.exception;

/**
 * The activity dataset could not be read.
 */
public class DatasetAccessException extends RuntimeException {

    public DatasetAccessException(String message) {
        super(message);
    }

    public DatasetAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
