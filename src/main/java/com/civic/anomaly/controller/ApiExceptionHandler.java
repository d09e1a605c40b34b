package com.civic.anomaly.controller;

import com.civic.anomaly.controller.dto.ErrorResponse;
import com.civic.anomaly.exception.AnomalyNotFoundException;
import com.civic.anomaly.exception.AnomalyPersistenceException;
import com.civic.anomaly.exception.InvalidTransitionException;
import com.civic.anomaly.exception.RuleConfigurationException;
import com.civic.anomaly.exception.RuleNotFoundException;
import com.civic.anomaly.exception.ScanInProgressException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler({RuleConfigurationException.class, IllegalArgumentException.class})
    public ResponseEntity<ErrorResponse> handleInvalid(RuntimeException ex) {
        return build(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", ex.getMessage());
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleUnreadable(Exception ex) {
        Throwable root = ex;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return build(HttpStatus.BAD_REQUEST, "MALFORMED_REQUEST", root.getMessage());
    }

    @ExceptionHandler({AnomalyNotFoundException.class, RuleNotFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(RuntimeException ex) {
        return build(HttpStatus.NOT_FOUND, "NOT_FOUND", ex.getMessage());
    }

    @ExceptionHandler(InvalidTransitionException.class)
    public ResponseEntity<ErrorResponse> handleTransition(InvalidTransitionException ex) {
        return build(HttpStatus.CONFLICT, "INVALID_TRANSITION", ex.getMessage());
    }

    @ExceptionHandler(ScanInProgressException.class)
    public ResponseEntity<ErrorResponse> handleScanInProgress(ScanInProgressException ex) {
        return build(HttpStatus.CONFLICT, "SCAN_IN_PROGRESS", ex.getMessage());
    }

    @ExceptionHandler(AnomalyPersistenceException.class)
    public ResponseEntity<ErrorResponse> handlePersistence(AnomalyPersistenceException ex) {
        log.error("Storage failure: {}", ex.getMessage(), ex);
        return build(HttpStatus.SERVICE_UNAVAILABLE, "STORAGE_UNAVAILABLE", ex.getMessage());
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(new ErrorResponse(code, message));
    }
}
