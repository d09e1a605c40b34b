package com.civic.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.exp.Exp;
import com.aerospike.client.policy.GenerationPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.civic.anomaly.config.AerospikeConfig;
import com.civic.anomaly.exception.AnomalyPersistenceException;
import com.civic.anomaly.model.Anomaly;
import com.civic.anomaly.model.AnomalyFilter;
import com.civic.anomaly.model.ResolutionStatus;
import com.civic.anomaly.model.RuleCategory;
import com.civic.anomaly.model.Severity;
import com.civic.anomaly.model.evidence.FindingEvidence;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Anomalies live in {@code anomalies}. A pending anomaly also owns a record in
 * {@code anomaly_open_keys} keyed by rule|entityType|entityId, created with
 * CREATE_ONLY so concurrent detections of the same key store at most one anomaly.
 * A key whose anomaly has left pending is treated as free.
 */
@Repository
@ConditionalOnProperty(name = "anomaly.storage", havingValue = "aerospike", matchIfMissing = true)
public class AerospikeAnomalyRepository implements AnomalyRepository {

    private static final Logger log = LoggerFactory.getLogger(AerospikeAnomalyRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    public AerospikeAnomalyRepository(AerospikeClient client,
                                      @Qualifier("aerospikeNamespace") String namespace,
                                      @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                      @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public boolean insertIfNoneOpen(Anomaly anomaly) {
        Key openKey = openKey(anomaly.openKey());
        if (!claim(openKey, anomaly)) {
            if (!releaseIfStale(openKey)) {
                log.debug("Pending anomaly already open for {}", anomaly.openKey());
                return false;
            }
            if (!claim(openKey, anomaly)) {
                log.debug("Open key {} reclaimed concurrently", anomaly.openKey());
                return false;
            }
        }

        try {
            client.put(writePolicy, anomalyKey(anomaly.getAnomalyId()), bins(anomaly));
            return true;
        } catch (AerospikeException e) {
            // release the claim so the next scan can retry
            client.delete(writePolicy, openKey);
            throw new AnomalyPersistenceException("Failed to store anomaly " + anomaly.getAnomalyId(), e);
        }
    }

    private boolean claim(Key openKey, Anomaly anomaly) {
        WritePolicy createOnly = new WritePolicy(writePolicy);
        createOnly.recordExistsAction = RecordExistsAction.CREATE_ONLY;
        try {
            client.put(createOnly, openKey, new Bin("anomalyId", anomaly.getAnomalyId()));
            return true;
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.KEY_EXISTS_ERROR) {
                return false;
            }
            throw new AnomalyPersistenceException("Failed to claim open key " + anomaly.openKey(), e);
        }
    }

    /**
     * Deletes an open key whose anomaly is gone or no longer pending, which is left
     * behind when a transition stored its status but failed to release the key.
     * The delete only matches the stale holder, never a fresh claim.
     *
     * @return true if the key is free to claim again
     */
    private boolean releaseIfStale(Key openKey) {
        try {
            Record held = client.get(readPolicy, openKey);
            if (held == null) return true;

            String heldId = held.getString("anomalyId");
            Record holder = client.get(readPolicy, anomalyKey(heldId), "status");
            if (holder != null && ResolutionStatus.PENDING.name().equals(holder.getString("status"))) {
                return false;
            }

            WritePolicy matchHolder = new WritePolicy(writePolicy);
            matchHolder.filterExp = Exp.build(Exp.eq(Exp.stringBin("anomalyId"), Exp.val(heldId)));
            client.delete(matchHolder, openKey);
            log.warn("Released stale open key {} held by anomaly {}", openKey.userKey, heldId);
            return true;
        } catch (AerospikeException e) {
            throw new AnomalyPersistenceException("Failed to check open key " + openKey.userKey, e);
        }
    }

    @Override
    public Anomaly findById(String anomalyId) {
        try {
            Record record = client.get(readPolicy, anomalyKey(anomalyId));
            return record != null ? mapRecord(record) : null;
        } catch (AerospikeException e) {
            throw new AnomalyPersistenceException("Failed to read anomaly " + anomalyId, e);
        }
    }

    @Override
    public boolean updateIfStatus(Anomaly updated, ResolutionStatus expected) {
        Key key = anomalyKey(updated.getAnomalyId());
        try {
            Record current = client.get(readPolicy, key);
            if (current == null || !expected.name().equals(current.getString("status"))) {
                return false;
            }

            WritePolicy guarded = new WritePolicy(writePolicy);
            guarded.generationPolicy = GenerationPolicy.EXPECT_GEN_EQUAL;
            guarded.generation = current.generation;
            client.put(guarded, key, bins(updated));
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.GENERATION_ERROR) {
                log.debug("Anomaly {} changed concurrently, update skipped", updated.getAnomalyId());
                return false;
            }
            throw new AnomalyPersistenceException("Failed to update anomaly " + updated.getAnomalyId(), e);
        }

        if (expected == ResolutionStatus.PENDING && updated.getStatus() != ResolutionStatus.PENDING) {
            try {
                client.delete(writePolicy, openKey(updated.openKey()));
            } catch (AerospikeException e) {
                // the transition is stored; the next insert for this key clears the stale claim
                log.warn("Failed to release open key {} after anomaly {} left pending: {}",
                        updated.openKey(), updated.getAnomalyId(), e.getMessage());
            }
        }
        return true;
    }

    @Override
    public List<Anomaly> query(AnomalyFilter filter) {
        List<Anomaly> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        try {
            client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_ANOMALIES,
                    (key, record) -> {
                        try {
                            Anomaly anomaly = mapRecord(record);
                            if (!filter.matches(anomaly)) return;
                            synchronized (results) {
                                results.add(anomaly);
                            }
                        } catch (Exception e) {
                            log.warn("Failed to read anomaly record: {}", e.getMessage());
                        }
                    });
        } catch (AerospikeException e) {
            throw new AnomalyPersistenceException("Failed to scan anomalies", e);
        }

        results.sort(Comparator.comparingLong(Anomaly::getDetectedAt).reversed());
        int limit = filter.effectiveLimit();
        return results.size() > limit ? new ArrayList<>(results.subList(0, limit)) : results;
    }

    private Key anomalyKey(String anomalyId) {
        return new Key(namespace, AerospikeConfig.SET_ANOMALIES, anomalyId);
    }

    private Key openKey(String openKey) {
        return new Key(namespace, AerospikeConfig.SET_OPEN_KEYS, openKey);
    }

    private Bin[] bins(Anomaly anomaly) {
        return new Bin[]{
                new Bin("anomalyId", anomaly.getAnomalyId()),
                new Bin("ruleId", anomaly.getRuleId()),
                new Bin("ruleName", anomaly.getRuleName()),
                new Bin("category", anomaly.getCategory() != null ? anomaly.getCategory().name() : ""),
                new Bin("severity", anomaly.getSeverity().name()),
                new Bin("entityType", anomaly.getEntityType()),
                new Bin("entityId", anomaly.getEntityId()),
                new Bin("score", anomaly.getAnomalyScore()),
                new Bin("evidence", serializeEvidence(anomaly.getEvidence())),
                new Bin("detectedAt", anomaly.getDetectedAt()),
                new Bin("investigatedAt", anomaly.getInvestigatedAt() != null ? anomaly.getInvestigatedAt() : 0L),
                new Bin("status", anomaly.getStatus().name()),
                new Bin("notes", anomaly.getInvestigationNotes() != null ? anomaly.getInvestigationNotes() : ""),
                new Bin("investigatedBy", anomaly.getInvestigatedBy() != null ? anomaly.getInvestigatedBy() : "")
        };
    }

    private Anomaly mapRecord(Record record) {
        String category = record.getString("category");
        long investigatedAt = record.getLong("investigatedAt");
        String notes = record.getString("notes");
        String investigatedBy = record.getString("investigatedBy");

        return Anomaly.builder()
                .anomalyId(record.getString("anomalyId"))
                .ruleId(record.getString("ruleId"))
                .ruleName(record.getString("ruleName"))
                .category(category != null && !category.isEmpty() ? RuleCategory.valueOf(category) : null)
                .severity(Severity.valueOf(record.getString("severity")))
                .entityType(record.getString("entityType"))
                .entityId(record.getString("entityId"))
                .anomalyScore(record.getDouble("score"))
                .evidence(deserializeEvidence(record.getString("evidence")))
                .detectedAt(record.getLong("detectedAt"))
                .investigatedAt(investigatedAt > 0 ? investigatedAt : null)
                .status(ResolutionStatus.valueOf(record.getString("status")))
                .investigationNotes(notes != null && !notes.isEmpty() ? notes : null)
                .investigatedBy(investigatedBy != null && !investigatedBy.isEmpty() ? investigatedBy : null)
                .build();
    }

    private String serializeEvidence(FindingEvidence evidence) {
        if (evidence == null) return "";
        try {
            return objectMapper.writerFor(FindingEvidence.class).writeValueAsString(evidence);
        } catch (Exception e) {
            log.warn("Failed to serialize evidence: {}", e.getMessage());
            return "";
        }
    }

    private FindingEvidence deserializeEvidence(String json) {
        if (json == null || json.isEmpty()) return null;
        try {
            return objectMapper.readValue(json, FindingEvidence.class);
        } catch (Exception e) {
            log.warn("Failed to deserialize evidence: {}", e.getMessage());
            return null;
        }
    }
}
