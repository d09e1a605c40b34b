package com.civic.anomaly.seeder;

import com.civic.anomaly.exception.RuleConfigurationException;
import com.civic.anomaly.model.DetectionMethod;
import com.civic.anomaly.model.DetectionRule;
import com.civic.anomaly.model.Severity;
import com.civic.anomaly.service.RuleService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Installs the default rule catalogue at startup. Rules whose name already exists
 * are left untouched, so operator edits survive restarts.
 *
 * Disable with {@code anomaly.seed-rules=false}.
 */
@Component
@ConditionalOnProperty(name = "anomaly.seed-rules", havingValue = "true", matchIfMissing = true)
@Order(1)
public class DetectionRuleSeeder implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(DetectionRuleSeeder.class);

    private final RuleService ruleService;

    public DetectionRuleSeeder(RuleService ruleService) {
        this.ruleService = ruleService;
    }

    @Override
    public void run(String... args) {
        int created = 0;
        for (DetectionRule rule : defaultRules()) {
            if (ruleService.getRule(rule.getName()) != null) {
                continue;
            }
            try {
                ruleService.createRule(rule);
                created++;
            } catch (RuleConfigurationException e) {
                // another instance seeded it first
                log.info("Default rule {} not seeded: {}", rule.getName(), e.getMessage());
            }
        }
        log.info("Rule seeding complete: {} created, {} in catalogue", created, defaultRules().size());
    }

    static List<DetectionRule> defaultRules() {
        return List.of(
                // Statistical outliers against baselines
                rule("transaction_amount_outlier", "Detects orders with unusual amounts",
                        DetectionMethod.Z_SCORE_IQR, 3.0, Severity.MEDIUM,
                        Map.of("metric", "transaction_amount", "entityType", "order",
                                "period", "daily", "lookbackDays", "90")),
                rule("permit_cost_outlier", "Detects permits with unusual estimated cost",
                        DetectionMethod.Z_SCORE_IQR, 3.0, Severity.MEDIUM,
                        Map.of("metric", "permit_cost", "entityType", "permit",
                                "period", "monthly", "lookbackDays", "365")),

                // Behavioral
                rule("excessive_permit_applications", "Citizens filing many permit applications in 30 days",
                        DetectionMethod.ACTION_COUNT, 5.0, Severity.HIGH,
                        Map.of("entityType", "citizen", "eventType", "permit_application", "windowDays", "30")),
                rule("high_permit_value", "Citizens whose permit applications total an unusually high cost",
                        DetectionMethod.CUMULATIVE_VALUE, 50000.0, Severity.HIGH,
                        Map.of("entityType", "citizen", "eventType", "permit_application", "windowDays", "30")),
                rule("suspicious_voting_behavior", "Votes cast within days of voter registration",
                        DetectionMethod.FIRST_ACTION_LATENCY, 7.0, Severity.MEDIUM,
                        Map.of("entityType", "citizen", "eventType", "vote", "windowDays", "730")),
                rule("multiple_voting_methods", "Citizens voting through more than two methods",
                        DetectionMethod.DISTINCT_CHANNELS, 2.0, Severity.MEDIUM,
                        Map.of("entityType", "citizen", "eventType", "vote", "windowDays", "730")),

                // Temporal
                rule("unusual_time_patterns", "Merchant activity concentrated in night hours",
                        DetectionMethod.HOURLY_DEVIATION, 3.0, Severity.MEDIUM,
                        Map.of("entityType", "merchant", "eventType", "sale", "windowDays", "30",
                                "unusualStartHour", "0", "unusualEndHour", "6")),
                rule("rapid_sequence_activity", "Repeated orders to the same merchant seconds apart",
                        DetectionMethod.RAPID_SEQUENCE, 3.0, Severity.HIGH,
                        Map.of("entityType", "citizen", "targetType", "merchant", "eventType", "order",
                                "windowDays", "7", "maxGapSeconds", "60")),

                // Network
                rule("address_clustering_anomaly", "Many citizens registered at one address",
                        DetectionMethod.ATTRIBUTE_CLUSTERING, 10.0, Severity.HIGH,
                        Map.of("entityType", "citizen", "groupAttribute", "address",
                                "contactAttribute", "email", "sharedContactMinMembers", "3")),
                rule("merchant_self_dealing", "Merchant owners ordering from their own business",
                        DetectionMethod.SELF_DEALING, 0.0, Severity.CRITICAL,
                        Map.of("entityType", "citizen", "targetType", "merchant",
                                "ownerAttribute", "owner", "windowDays", "90")),
                rule("merchant_customer_anomaly", "Unusually heavy trade between one customer and one merchant",
                        DetectionMethod.BILATERAL_VOLUME, 20.0, Severity.CRITICAL,
                        Map.of("entityType", "citizen", "targetType", "merchant", "windowDays", "90",
                                "maxPairValue", "10000", "combine", "any"))
        );
    }

    private static DetectionRule rule(String name, String description, DetectionMethod method,
                                      double threshold, Severity severity, Map<String, String> params) {
        return DetectionRule.builder()
                .name(name)
                .description(description)
                .category(method.getCategory())
                .method(method)
                .thresholdValue(threshold)
                .severity(severity)
                .active(true)
                .params(new HashMap<>(params))
                .build();
    }
}
