package com.civic.anomaly.exception;

import com.civic.anomaly.model.ResolutionStatus;

public class InvalidTransitionException extends RuntimeException {

    private final ResolutionStatus from;
    private final ResolutionStatus to;

    public InvalidTransitionException(String anomalyId, ResolutionStatus from, ResolutionStatus to) {
        super("Anomaly " + anomalyId + " cannot move from " + from.getValue() + " to "
                + (to != null ? to.getValue() : "null"));
        this.from = from;
        this.to = to;
    }

    public ResolutionStatus getFrom() {
        return from;
    }

    public ResolutionStatus getTo() {
        return to;
    }
}
