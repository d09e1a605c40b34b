package com.civic.anomaly.exception;

public class ScanInProgressException extends RuntimeException {

    public ScanInProgressException() {
        super("A scan is already running");
    }
}
