package com.civic.anomaly.service;

import com.civic.anomaly.exception.RuleConfigurationException;
import com.civic.anomaly.exception.RuleNotFoundException;
import com.civic.anomaly.model.DetectionMethod;
import com.civic.anomaly.model.DetectionRule;
import com.civic.anomaly.model.RuleCategory;
import com.civic.anomaly.model.RuleUpdate;
import com.civic.anomaly.model.Severity;
import com.civic.anomaly.repository.InMemoryDetectionRuleRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static com.civic.anomaly.testutil.TestDataFactory.NOW;
import static com.civic.anomaly.testutil.TestDataFactory.createRule;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RuleServiceTest {

    private RuleService service;

    @BeforeEach
    void setUp() {
        service = new RuleService(new InMemoryDetectionRuleRepository(),
                Clock.fixed(Instant.ofEpochMilli(NOW), ZoneOffset.UTC));
    }

    @Test
    void createRule_assignsIdAndCreationTime() {
        DetectionRule rule = createRule("frequent", DetectionMethod.ACTION_COUNT, 5, "entityType", "citizen");
        rule.setRuleId(null);
        rule.setCreatedAt(0);

        DetectionRule created = service.createRule(rule);

        assertThat(created.getRuleId()).isNotBlank();
        assertThat(created.getCreatedAt()).isEqualTo(NOW);
        assertThat(service.getRule("frequent")).isNotNull();
    }

    @Test
    void createRule_duplicateName_rejected() {
        service.createRule(createRule("frequent", DetectionMethod.ACTION_COUNT, 5, "entityType", "citizen"));

        assertThatThrownBy(() -> service.createRule(
                createRule("frequent", DetectionMethod.DISTINCT_CHANNELS, 2, "entityType", "citizen")))
                .isInstanceOf(RuleConfigurationException.class)
                .hasMessageContaining("already exists");
    }

    @Test
    void createRule_methodFromOtherCategory_rejected() {
        DetectionRule rule = createRule("mismatch", DetectionMethod.ACTION_COUNT, 5, "entityType", "citizen");
        rule.setCategory(RuleCategory.TEMPORAL);

        assertThatThrownBy(() -> service.createRule(rule))
                .isInstanceOf(RuleConfigurationException.class)
                .hasMessageContaining("does not belong");
    }

    @Test
    void createRule_missingRequiredParam_rejected() {
        DetectionRule rule = createRule("self_dealing", DetectionMethod.SELF_DEALING, 2, "entityType", "citizen");

        assertThatThrownBy(() -> service.createRule(rule))
                .isInstanceOf(RuleConfigurationException.class)
                .hasMessageContaining("targetType");
    }

    @Test
    void createRule_negativeThreshold_rejected() {
        DetectionRule rule = createRule("frequent", DetectionMethod.ACTION_COUNT, -1, "entityType", "citizen");

        assertThatThrownBy(() -> service.createRule(rule)).isInstanceOf(RuleConfigurationException.class);
    }

    @Test
    void unknownCategoryName_rejected() {
        assertThatThrownBy(() -> RuleCategory.fromValue("geographic"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("geographic");
    }

    @Test
    void updateRule_appliesChangesAndRevalidates() {
        service.createRule(createRule("frequent", DetectionMethod.ACTION_COUNT, 5, "entityType", "citizen"));

        DetectionRule updated = service.updateRule("frequent",
                new RuleUpdate("Tighter limit", 3.0, Severity.HIGH, null));

        assertThat(updated.getThresholdValue()).isEqualTo(3.0);
        assertThat(updated.getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(service.getRule("frequent").getDescription()).isEqualTo("Tighter limit");

        assertThatThrownBy(() -> service.updateRule("frequent", new RuleUpdate(null, null, null, Map.of())))
                .isInstanceOf(RuleConfigurationException.class);
        assertThat(service.getRule("frequent").getParam("entityType")).isEqualTo("citizen");
    }

    @Test
    void updateRule_unknown_throwsNotFound() {
        assertThatThrownBy(() -> service.updateRule("missing", new RuleUpdate(null, 1.0, null, null)))
                .isInstanceOf(RuleNotFoundException.class);
    }

    @Test
    void setActive_inactiveRulesLeaveTheScan() {
        service.createRule(createRule("frequent", DetectionMethod.ACTION_COUNT, 5, "entityType", "citizen"));
        service.createRule(createRule("rapid", DetectionMethod.RAPID_SEQUENCE, 3, "entityType", "citizen"));

        service.setActive("rapid", false);

        Map<RuleCategory, List<DetectionRule>> active = service.activeRulesByCategory();
        assertThat(active).containsOnlyKeys(RuleCategory.BEHAVIORAL);
        assertThat(service.listRules(RuleCategory.TEMPORAL, false)).hasSize(1);
        assertThat(service.listRules(RuleCategory.TEMPORAL, true)).isEmpty();
    }
}
