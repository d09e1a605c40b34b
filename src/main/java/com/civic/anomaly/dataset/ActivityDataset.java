package com.civic.anomaly.dataset;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Read-only view of the business records the engine scans. Time ranges are
 * epoch milliseconds, inclusive at the start and exclusive at the end.
 * Implementations throw {@link com.civic.anomaly.exception.DatasetAccessException}
 * when the underlying store cannot be read.
 */
public interface ActivityDataset {

    List<MetricSample> fetchMetricValues(String metric, String entityType, long fromInclusive, long toExclusive);

    List<ActivityEvent> fetchEvents(String actorType, long fromInclusive, long toExclusive);

    List<EntityRecord> fetchEntities(String entityType);

    /**
     * Events of one actor type against one target type, ordered by actor, target, then time.
     * Events without an actor or target id are left out.
     */
    default List<ActivityEvent> fetchOrderedEvents(String actorType, String targetType,
                                                   long fromInclusive, long toExclusive) {
        return fetchEvents(actorType, fromInclusive, toExclusive).stream()
                .filter(e -> e.actorId() != null && e.targetId() != null)
                .filter(e -> targetType == null || targetType.equalsIgnoreCase(e.targetType()))
                .sorted(Comparator.comparing(ActivityEvent::actorId)
                        .thenComparing(ActivityEvent::targetId)
                        .thenComparingLong(ActivityEvent::occurredAt))
                .toList();
    }

    /**
     * Groups entities by {@code groupAttribute}. Entities without the attribute are ignored.
     */
    default List<AttributeGroup> fetchAttributeGroups(String entityType, String groupAttribute,
                                                      String contactAttribute) {
        Map<String, List<EntityRecord>> byValue = new LinkedHashMap<>();
        for (EntityRecord entity : fetchEntities(entityType)) {
            String value = entity.attribute(groupAttribute);
            if (value == null) continue;
            byValue.computeIfAbsent(value, k -> new ArrayList<>()).add(entity);
        }

        List<AttributeGroup> groups = new ArrayList<>();
        for (Map.Entry<String, List<EntityRecord>> entry : byValue.entrySet()) {
            List<String> members = entry.getValue().stream().map(EntityRecord::entityId).toList();
            long contacts = entry.getValue().stream()
                    .map(e -> e.attribute(contactAttribute))
                    .filter(Objects::nonNull)
                    .distinct()
                    .count();
            groups.add(new AttributeGroup(groupAttribute, entry.getKey(), members, contacts));
        }
        return groups;
    }
}
