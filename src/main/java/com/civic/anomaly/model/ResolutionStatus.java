package com.civic.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Investigation lifecycle of a persisted anomaly.
 *
 * <pre>
 *   PENDING -> FALSE_POSITIVE            (terminal)
 *   PENDING -> CONFIRMED -> RESOLVED     (terminal)
 * </pre>
 */
public enum ResolutionStatus {
    PENDING,
    FALSE_POSITIVE,
    CONFIRMED,
    RESOLVED;

    public Set<ResolutionStatus> allowedTargets() {
        return switch (this) {
            case PENDING -> EnumSet.of(FALSE_POSITIVE, CONFIRMED);
            case CONFIRMED -> EnumSet.of(RESOLVED);
            case FALSE_POSITIVE, RESOLVED -> EnumSet.noneOf(ResolutionStatus.class);
        };
    }

    public boolean canTransitionTo(ResolutionStatus target) {
        return target != null && allowedTargets().contains(target);
    }

    public boolean isTerminal() {
        return allowedTargets().isEmpty();
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ResolutionStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Resolution status is required");
        }
        for (ResolutionStatus status : values()) {
            if (status.name().equalsIgnoreCase(value.trim())) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown resolution status: " + value);
    }
}
