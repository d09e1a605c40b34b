package com.civic.anomaly.seeder;

import com.civic.anomaly.model.DetectionRule;
import com.civic.anomaly.model.RuleCategory;
import com.civic.anomaly.model.RuleUpdate;
import com.civic.anomaly.repository.InMemoryDetectionRuleRepository;
import com.civic.anomaly.service.RuleService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

class DetectionRuleSeederTest {

    private RuleService ruleService;
    private DetectionRuleSeeder seeder;

    @BeforeEach
    void setUp() {
        ruleService = new RuleService(new InMemoryDetectionRuleRepository(), Clock.systemUTC());
        seeder = new DetectionRuleSeeder(ruleService);
    }

    @Test
    void run_installsEveryDefaultRule() {
        seeder.run();

        assertThat(ruleService.listRules(null, false)).hasSize(DetectionRuleSeeder.defaultRules().size());
        assertThat(ruleService.activeRulesByCategory()).containsOnlyKeys(RuleCategory.values());
        assertThat(Arrays.stream(RuleCategory.values()))
                .allSatisfy(c -> assertThat(ruleService.listRules(c, true)).isNotEmpty());
    }

    @Test
    void run_keepsOperatorEdits() {
        seeder.run();
        ruleService.updateRule("excessive_permit_applications", new RuleUpdate(null, 12.0, null, null));

        seeder.run();

        DetectionRule rule = ruleService.getRule("excessive_permit_applications");
        assertThat(rule.getThresholdValue()).isEqualTo(12.0);
        assertThat(ruleService.listRules(null, false)).hasSize(DetectionRuleSeeder.defaultRules().size());
    }
}
