package com.civic.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.civic.anomaly.config.AerospikeConfig;
import com.civic.anomaly.exception.AnomalyPersistenceException;
import com.civic.anomaly.model.DetectionMethod;
import com.civic.anomaly.model.DetectionRule;
import com.civic.anomaly.model.RuleCategory;
import com.civic.anomaly.model.Severity;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Rules keyed by name, so name uniqueness is enforced by the store itself.
 */
@Repository
@ConditionalOnProperty(name = "anomaly.storage", havingValue = "aerospike", matchIfMissing = true)
public class AerospikeDetectionRuleRepository implements DetectionRuleRepository {

    private static final Logger log = LoggerFactory.getLogger(AerospikeDetectionRuleRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    public AerospikeDetectionRuleRepository(AerospikeClient client,
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
    public boolean insert(DetectionRule rule) {
        WritePolicy createOnly = new WritePolicy(writePolicy);
        createOnly.recordExistsAction = RecordExistsAction.CREATE_ONLY;
        try {
            client.put(createOnly, key(rule.getName()), bins(rule));
            return true;
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.KEY_EXISTS_ERROR) {
                return false;
            }
            throw new AnomalyPersistenceException("Failed to insert rule " + rule.getName(), e);
        }
    }

    @Override
    public void save(DetectionRule rule) {
        try {
            client.put(writePolicy, key(rule.getName()), bins(rule));
        } catch (AerospikeException e) {
            throw new AnomalyPersistenceException("Failed to save rule " + rule.getName(), e);
        }
    }

    @Override
    public DetectionRule findByName(String name) {
        try {
            Record record = client.get(readPolicy, key(name));
            if (record == null) return null;
            return mapRecordToRule(record);
        } catch (AerospikeException e) {
            throw new AnomalyPersistenceException("Failed to read rule " + name, e);
        }
    }

    @Override
    public List<DetectionRule> findAll() {
        List<DetectionRule> rules = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        scanPolicy.includeBinData = true;

        try {
            client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_DETECTION_RULES,
                    (key, record) -> {
                        try {
                            DetectionRule rule = mapRecordToRule(record);
                            synchronized (rules) {
                                rules.add(rule);
                            }
                        } catch (Exception e) {
                            log.warn("Failed to deserialize rule record: {}", e.getMessage());
                        }
                    });
        } catch (AerospikeException e) {
            throw new AnomalyPersistenceException("Failed to scan detection rules", e);
        }
        rules.sort(Comparator.comparing(DetectionRule::getName));
        return rules;
    }

    private Key key(String name) {
        return new Key(namespace, AerospikeConfig.SET_DETECTION_RULES, name);
    }

    private Bin[] bins(DetectionRule rule) {
        return new Bin[]{
                new Bin("ruleId", rule.getRuleId()),
                new Bin("name", rule.getName()),
                new Bin("description", rule.getDescription()),
                new Bin("category", rule.getCategory().name()),
                new Bin("method", rule.getMethod().name()),
                new Bin("threshold", rule.getThresholdValue()),
                new Bin("severity", rule.getSeverity().name()),
                new Bin("active", rule.isActive()),
                new Bin("params", serializeParams(rule.getParams())),
                new Bin("createdAt", rule.getCreatedAt())
        };
    }

    private DetectionRule mapRecordToRule(Record record) {
        return DetectionRule.builder()
                .ruleId(record.getString("ruleId"))
                .name(record.getString("name"))
                .description(record.getString("description"))
                .category(RuleCategory.valueOf(record.getString("category")))
                .method(DetectionMethod.valueOf(record.getString("method")))
                .thresholdValue(record.getDouble("threshold"))
                .severity(Severity.valueOf(record.getString("severity")))
                .active(record.getBoolean("active"))
                .params(deserializeParams(record.getString("params")))
                .createdAt(record.getLong("createdAt"))
                .build();
    }

    private String serializeParams(Map<String, String> params) {
        try {
            return objectMapper.writeValueAsString(params != null ? params : Map.of());
        } catch (Exception e) {
            return "{}";
        }
    }

    private Map<String, String> deserializeParams(String json) {
        if (json == null || json.isEmpty()) return new HashMap<>();
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, String>>() {});
        } catch (Exception e) {
            return new HashMap<>();
        }
    }
}
