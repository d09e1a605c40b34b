package com.civic.anomaly.dataset;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Record;
import com.aerospike.client.policy.ScanPolicy;
import com.civic.anomaly.config.AerospikeConfig;
import com.civic.anomaly.config.AnomalyEngineConfig;
import com.civic.anomaly.exception.DatasetAccessException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Reads the activity sets populated by upstream systems. Never writes.
 */
@Repository
@ConditionalOnProperty(name = "anomaly.storage", havingValue = "aerospike", matchIfMissing = true)
public class AerospikeActivityDataset implements ActivityDataset {

    private static final Logger log = LoggerFactory.getLogger(AerospikeActivityDataset.class);

    private final AerospikeClient client;
    private final String namespace;
    private final int queryTimeoutMs;
    private final ObjectMapper objectMapper;

    public AerospikeActivityDataset(AerospikeClient client,
                                    @Qualifier("aerospikeNamespace") String namespace,
                                    AnomalyEngineConfig config) {
        this.client = client;
        this.namespace = namespace;
        this.queryTimeoutMs = config.getDataset().getQueryTimeoutMs();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public List<MetricSample> fetchMetricValues(String metric, String entityType, long fromInclusive, long toExclusive) {
        List<MetricSample> results = new ArrayList<>();
        scan(AerospikeConfig.SET_METRIC_SAMPLES, "metric samples for " + metric, record -> {
            if (!metric.equals(record.getString("metric"))) return;
            if (entityType != null && !entityType.equalsIgnoreCase(record.getString("entityType"))) return;
            long observedAt = record.getLong("observedAt");
            if (observedAt < fromInclusive || observedAt >= toExclusive) return;

            MetricSample sample = new MetricSample(
                    record.getString("sampleId"),
                    metric,
                    record.getString("entityType"),
                    record.getString("entityId"),
                    record.getDouble("value"),
                    observedAt);
            synchronized (results) {
                results.add(sample);
            }
        });
        results.sort(Comparator.comparingLong(MetricSample::observedAt));
        return results;
    }

    @Override
    public List<ActivityEvent> fetchEvents(String actorType, long fromInclusive, long toExclusive) {
        List<ActivityEvent> results = new ArrayList<>();
        scan(AerospikeConfig.SET_ACTIVITY_EVENTS, "events for " + actorType, record -> {
            if (actorType != null && !actorType.equalsIgnoreCase(record.getString("actorType"))) return;
            long occurredAt = record.getLong("occurredAt");
            if (occurredAt < fromInclusive || occurredAt >= toExclusive) return;
            String actorId = emptyToNull(record.getString("actorId"));
            if (actorId == null) {
                log.warn("Dropping event {} without actorId", record.getString("eventId"));
                return;
            }

            Object amount = record.getValue("amount");
            ActivityEvent event = new ActivityEvent(
                    record.getString("eventId"),
                    record.getString("actorType"),
                    actorId,
                    emptyToNull(record.getString("targetType")),
                    emptyToNull(record.getString("targetId")),
                    emptyToNull(record.getString("eventType")),
                    emptyToNull(record.getString("channel")),
                    amount instanceof Number n ? n.doubleValue() : null,
                    occurredAt);
            synchronized (results) {
                results.add(event);
            }
        });
        results.sort(Comparator.comparingLong(ActivityEvent::occurredAt));
        return results;
    }

    @Override
    public List<EntityRecord> fetchEntities(String entityType) {
        List<EntityRecord> results = new ArrayList<>();
        scan(AerospikeConfig.SET_ENTITY_RECORDS, "entities of type " + entityType, record -> {
            if (entityType != null && !entityType.equalsIgnoreCase(record.getString("entityType"))) return;
            EntityRecord entity = new EntityRecord(
                    record.getString("entityType"),
                    record.getString("entityId"),
                    record.getLong("createdAt"),
                    deserializeMap(record.getString("attributes")));
            synchronized (results) {
                results.add(entity);
            }
        });
        return results;
    }

    private void scan(String set, String description, Consumer<Record> consumer) {
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        scanPolicy.totalTimeout = queryTimeoutMs;

        try {
            client.scanAll(scanPolicy, namespace, set, (key, record) -> {
                try {
                    consumer.accept(record);
                } catch (RuntimeException e) {
                    log.warn("Skipping unreadable record in {}: {}", set, e.getMessage());
                }
            });
        } catch (AerospikeException e) {
            throw new DatasetAccessException("Failed to read " + description + ": " + e.getMessage(), e);
        }
    }

    private Map<String, String> deserializeMap(String json) {
        if (json == null || json.isEmpty()) return Map.of();
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, String>>() {});
        } catch (Exception e) {
            log.warn("Failed to deserialize entity attributes: {}", e.getMessage());
            return Map.of();
        }
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
