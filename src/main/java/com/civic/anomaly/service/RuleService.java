package com.civic.anomaly.service;

import com.civic.anomaly.exception.RuleConfigurationException;
import com.civic.anomaly.exception.RuleNotFoundException;
import com.civic.anomaly.model.DetectionMethod;
import com.civic.anomaly.model.DetectionRule;
import com.civic.anomaly.model.RuleCategory;
import com.civic.anomaly.model.RuleUpdate;
import com.civic.anomaly.repository.DetectionRuleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Service layer for the detection rule registry.
 * Rules are unique by name and validated on every write.
 */
@Service
public class RuleService {

    private static final Logger log = LoggerFactory.getLogger(RuleService.class);

    private final DetectionRuleRepository ruleRepository;
    private final Clock clock;

    public RuleService(DetectionRuleRepository ruleRepository, Clock clock) {
        this.ruleRepository = ruleRepository;
        this.clock = clock;
    }

    public DetectionRule createRule(DetectionRule rule) {
        validate(rule);
        if (rule.getRuleId() == null || rule.getRuleId().isBlank()) {
            rule.setRuleId(UUID.randomUUID().toString());
        }
        if (rule.getParams() == null) {
            rule.setParams(new HashMap<>());
        }
        if (rule.getCreatedAt() <= 0) {
            rule.setCreatedAt(clock.millis());
        }

        if (!ruleRepository.insert(rule)) {
            throw new RuleConfigurationException("A rule named '" + rule.getName() + "' already exists");
        }
        log.info("Rule created: name={}, category={}, method={}, threshold={}",
                rule.getName(), rule.getCategory(), rule.getMethod(), rule.getThresholdValue());
        return rule;
    }

    public DetectionRule getRule(String name) {
        return ruleRepository.findByName(name);
    }

    /**
     * @param category   null for all categories
     * @param activeOnly skip inactive rules
     */
    public List<DetectionRule> listRules(RuleCategory category, boolean activeOnly) {
        return ruleRepository.findAll().stream()
                .filter(r -> category == null || r.getCategory() == category)
                .filter(r -> !activeOnly || r.isActive())
                .toList();
    }

    public DetectionRule setActive(String name, boolean active) {
        DetectionRule existing = ruleRepository.findByName(name);
        if (existing == null) {
            throw new RuleNotFoundException(name);
        }
        existing.setActive(active);
        ruleRepository.save(existing);
        log.info("Rule {} {}", name, active ? "activated" : "deactivated");
        return existing;
    }

    public DetectionRule updateRule(String name, RuleUpdate changes) {
        DetectionRule existing = ruleRepository.findByName(name);
        if (existing == null) {
            throw new RuleNotFoundException(name);
        }

        DetectionRule updated = existing.toBuilder().build();
        if (changes.description() != null) updated.setDescription(changes.description());
        if (changes.thresholdValue() != null) updated.setThresholdValue(changes.thresholdValue());
        if (changes.severity() != null) updated.setSeverity(changes.severity());
        if (changes.params() != null) updated.setParams(new HashMap<>(changes.params()));

        validate(updated);
        ruleRepository.save(updated);
        log.info("Rule updated: name={}, threshold={}, severity={}",
                name, updated.getThresholdValue(), updated.getSeverity());
        return updated;
    }

    /**
     * Active rules grouped by category, for a scan.
     */
    public Map<RuleCategory, List<DetectionRule>> activeRulesByCategory() {
        Map<RuleCategory, List<DetectionRule>> byCategory = new EnumMap<>(RuleCategory.class);
        for (DetectionRule rule : listRules(null, true)) {
            byCategory.computeIfAbsent(rule.getCategory(), c -> new ArrayList<>()).add(rule);
        }
        return byCategory;
    }

    static void validate(DetectionRule rule) {
        if (rule == null) {
            throw new RuleConfigurationException("Rule is required");
        }
        if (rule.getName() == null || rule.getName().isBlank()) {
            throw new RuleConfigurationException("Rule name must not be blank");
        }
        if (rule.getCategory() == null) {
            throw new RuleConfigurationException("Rule " + rule.getName() + " has no category");
        }
        if (rule.getSeverity() == null) {
            throw new RuleConfigurationException("Rule " + rule.getName() + " has no severity");
        }
        DetectionMethod method = rule.getMethod();
        if (method == null) {
            throw new RuleConfigurationException("Rule " + rule.getName() + " has no detection method");
        }
        if (method.getCategory() != rule.getCategory()) {
            throw new RuleConfigurationException("Method " + method.getValue() + " does not belong to category "
                    + rule.getCategory().getValue());
        }
        if (!Double.isFinite(rule.getThresholdValue()) || rule.getThresholdValue() < 0) {
            throw new RuleConfigurationException("Rule " + rule.getName() + " threshold must be a non-negative number");
        }
        for (String param : method.getRequiredParams()) {
            if (rule.getParam(param) == null) {
                throw new RuleConfigurationException("Rule " + rule.getName() + " requires param '" + param + "'");
            }
        }
    }
}
