package com.civic.anomaly.repository;

import com.civic.anomaly.model.DetectionRule;

import java.util.List;

public interface DetectionRuleRepository {

    /**
     * Stores a new rule keyed by its name.
     * @return false if a rule with the same name already exists
     */
    boolean insert(DetectionRule rule);

    void save(DetectionRule rule);

    DetectionRule findByName(String name);

    List<DetectionRule> findAll();
}
