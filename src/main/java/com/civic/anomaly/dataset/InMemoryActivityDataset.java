package com.civic.anomaly.dataset;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Dataset held in memory, used with {@code anomaly.storage=memory}. Loaders and tests
 * populate it through the {@code add*} methods.
 */
@Repository
@ConditionalOnProperty(name = "anomaly.storage", havingValue = "memory")
public class InMemoryActivityDataset implements ActivityDataset {

    private static final Logger log = LoggerFactory.getLogger(InMemoryActivityDataset.class);

    private final List<MetricSample> samples = new CopyOnWriteArrayList<>();
    private final List<ActivityEvent> events = new CopyOnWriteArrayList<>();
    private final List<EntityRecord> entities = new CopyOnWriteArrayList<>();

    public void addMetricSample(MetricSample sample) {
        samples.add(sample);
    }

    public void addEvent(ActivityEvent event) {
        events.add(event);
    }

    public void addEntity(EntityRecord entity) {
        entities.add(entity);
    }

    public void clear() {
        samples.clear();
        events.clear();
        entities.clear();
    }

    @Override
    public List<MetricSample> fetchMetricValues(String metric, String entityType, long fromInclusive, long toExclusive) {
        return samples.stream()
                .filter(s -> s.metric().equals(metric))
                .filter(s -> entityType == null || entityType.equalsIgnoreCase(s.entityType()))
                .filter(s -> s.observedAt() >= fromInclusive && s.observedAt() < toExclusive)
                .sorted(Comparator.comparingLong(MetricSample::observedAt))
                .toList();
    }

    @Override
    public List<ActivityEvent> fetchEvents(String actorType, long fromInclusive, long toExclusive) {
        return events.stream()
                .filter(e -> actorType == null || actorType.equalsIgnoreCase(e.actorType()))
                .filter(e -> e.occurredAt() >= fromInclusive && e.occurredAt() < toExclusive)
                .filter(InMemoryActivityDataset::hasActor)
                .sorted(Comparator.comparingLong(ActivityEvent::occurredAt))
                .toList();
    }

    @Override
    public List<EntityRecord> fetchEntities(String entityType) {
        return entities.stream()
                .filter(e -> entityType == null || entityType.equalsIgnoreCase(e.entityType()))
                .toList();
    }

    private static boolean hasActor(ActivityEvent event) {
        if (event.actorId() != null) return true;
        log.warn("Dropping event {} without actorId", event.eventId());
        return false;
    }
}
