package com.civic.anomaly.dataset;

/**
 * An action performed by an actor, optionally against a target record.
 * {@code targetType}, {@code targetId}, {@code channel} and {@code amount} may be null.
 */
public record ActivityEvent(String eventId,
                            String actorType,
                            String actorId,
                            String targetType,
                            String targetId,
                            String eventType,
                            String channel,
                            Double amount,
                            long occurredAt) {

    public double amountOrZero() {
        return amount != null ? amount : 0.0;
    }
}
