package com.civic.anomaly.repository;

import com.civic.anomaly.model.DetectionRule;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Repository
@ConditionalOnProperty(name = "anomaly.storage", havingValue = "memory")
public class InMemoryDetectionRuleRepository implements DetectionRuleRepository {

    private final Map<String, DetectionRule> storage = new ConcurrentHashMap<>();

    @Override
    public boolean insert(DetectionRule rule) {
        return storage.putIfAbsent(rule.getName(), copy(rule)) == null;
    }

    @Override
    public void save(DetectionRule rule) {
        storage.put(rule.getName(), copy(rule));
    }

    @Override
    public DetectionRule findByName(String name) {
        DetectionRule rule = storage.get(name);
        return rule != null ? copy(rule) : null;
    }

    @Override
    public List<DetectionRule> findAll() {
        return storage.values().stream()
                .map(InMemoryDetectionRuleRepository::copy)
                .sorted(Comparator.comparing(DetectionRule::getName))
                .toList();
    }

    private static DetectionRule copy(DetectionRule rule) {
        return rule.toBuilder()
                .params(rule.getParams() != null ? new HashMap<>(rule.getParams()) : new HashMap<>())
                .build();
    }
}
