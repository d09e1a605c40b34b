package com.civic.anomaly.dataset;

import java.util.Map;

public record EntityRecord(String entityType,
                           String entityId,
                           long createdAt,
                           Map<String, String> attributes) {

    public EntityRecord {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public String attribute(String name) {
        String value = attributes.get(name);
        return value == null || value.isBlank() ? null : value.trim();
    }
}
