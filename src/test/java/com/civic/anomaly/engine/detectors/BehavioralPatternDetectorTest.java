package com.civic.anomaly.engine.detectors;

import com.civic.anomaly.config.AnomalyEngineConfig;
import com.civic.anomaly.dataset.ActivityEvent;
import com.civic.anomaly.dataset.InMemoryActivityDataset;
import com.civic.anomaly.engine.ScanContext;
import com.civic.anomaly.model.DetectionMethod;
import com.civic.anomaly.model.DetectionRule;
import com.civic.anomaly.model.Finding;
import com.civic.anomaly.model.RuleCategory;
import com.civic.anomaly.model.evidence.BehavioralEvidence;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static com.civic.anomaly.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class BehavioralPatternDetectorTest {

    private BehavioralPatternDetector detector;
    private InMemoryActivityDataset dataset;

    @BeforeEach
    void setUp() {
        detector = new BehavioralPatternDetector(new AnomalyEngineConfig());
        dataset = new InMemoryActivityDataset();
    }

    @Test
    void actionCount_flagsActorsAtOrAboveThreshold() {
        DetectionRule rule = createRule("frequent_applications", DetectionMethod.ACTION_COUNT, 3,
                "entityType", "citizen", "eventType", "permit_application");
        for (int i = 0; i < 3; i++) {
            dataset.addEvent(createEvent("citizen", "C-1", "permit_application", NOW - (i + 1) * DAY));
        }
        dataset.addEvent(createEvent("citizen", "C-2", "permit_application", NOW - DAY));
        dataset.addEvent(createEvent("citizen", "C-2", "permit_application", NOW - 2 * DAY));
        // other event types do not count
        dataset.addEvent(createEvent("citizen", "C-2", "vote", NOW - 3 * DAY));

        List<Finding> findings = detector.detect(createContext(dataset, rule));

        assertThat(findings).hasSize(1);
        assertThat(findings.get(0).entityId()).isEqualTo("C-1");
        assertThat(findings.get(0).score()).isEqualTo(3.0);
        assertThat(((BehavioralEvidence) findings.get(0).evidence()).eventCount()).isEqualTo(3L);
    }

    @Test
    void actionCount_ignoresEventsOutsideWindow() {
        DetectionRule rule = createRule("frequent_applications", DetectionMethod.ACTION_COUNT, 2,
                "entityType", "citizen", "windowDays", "5");
        dataset.addEvent(createEvent("citizen", "C-1", "permit_application", NOW - DAY));
        dataset.addEvent(createEvent("citizen", "C-1", "permit_application", NOW - 20 * DAY));

        assertThat(detector.detect(createContext(dataset, rule))).isEmpty();
    }

    @Test
    void cumulativeValue_scoresTotalOverThreshold() {
        DetectionRule rule = createRule("high_spend", DetectionMethod.CUMULATIVE_VALUE, 1000,
                "entityType", "citizen");
        dataset.addEvent(amountEvent("C-1", 600.0, NOW - DAY));
        dataset.addEvent(amountEvent("C-1", 600.0, NOW - 2 * DAY));
        dataset.addEvent(amountEvent("C-2", 1000.0, NOW - DAY));

        List<Finding> findings = detector.detect(createContext(dataset, rule));

        assertThat(findings).hasSize(1);
        assertThat(findings.get(0).entityId()).isEqualTo("C-1");
        assertThat(findings.get(0).score()).isCloseTo(1.2, within(1e-9));
        assertThat(((BehavioralEvidence) findings.get(0).evidence()).totalValue()).isEqualTo(1200.0);
    }

    @Test
    void firstActionLatency_flagsNewEntitiesActingQuickly() {
        DetectionRule rule = createRule("quick_first_application", DetectionMethod.FIRST_ACTION_LATENCY, 2,
                "entityType", "citizen");
        long newCreated = NOW - 5 * DAY;
        dataset.addEntity(createEntity("citizen", "C-NEW", newCreated));
        dataset.addEvent(createEvent("citizen", "C-NEW", "permit_application", newCreated + 12 * HOUR));
        long oldCreated = NOW - 200 * DAY;
        dataset.addEntity(createEntity("citizen", "C-OLD", oldCreated));
        dataset.addEvent(createEvent("citizen", "C-OLD", "permit_application", NOW - DAY));
        // no entity record
        dataset.addEvent(createEvent("citizen", "C-GHOST", "permit_application", NOW - DAY));

        List<Finding> findings = detector.detect(createContext(dataset, rule));

        assertThat(findings).hasSize(1);
        assertThat(findings.get(0).entityId()).isEqualTo("C-NEW");
        assertThat(findings.get(0).score()).isCloseTo(1.5, within(1e-9));
        assertThat(((BehavioralEvidence) findings.get(0).evidence()).latencyDays()).isCloseTo(0.5, within(1e-9));
    }

    @Test
    void distinctChannels_flagsActorsUsingManyChannels() {
        DetectionRule rule = createRule("channel_hopping", DetectionMethod.DISTINCT_CHANNELS, 2,
                "entityType", "citizen");
        dataset.addEvent(channelEvent("C-1", "web", NOW - DAY));
        dataset.addEvent(channelEvent("C-1", "mobile", NOW - 2 * DAY));
        dataset.addEvent(channelEvent("C-1", "kiosk", NOW - 3 * DAY));
        dataset.addEvent(channelEvent("C-2", "web", NOW - DAY));
        dataset.addEvent(channelEvent("C-2", "web", NOW - 2 * DAY));

        List<Finding> findings = detector.detect(createContext(dataset, rule));

        assertThat(findings).hasSize(1);
        assertThat(findings.get(0).score()).isEqualTo(3.0);
        assertThat(((BehavioralEvidence) findings.get(0).evidence()).channels())
                .containsExactly("kiosk", "mobile", "web");
    }

    @Test
    void firstActionLatency_eventBeforeCreation_skipsOnlyThatEntity() {
        DetectionRule rule = createRule("quick_first_application", DetectionMethod.FIRST_ACTION_LATENCY, 2,
                "entityType", "citizen");
        long newCreated = NOW - 5 * DAY;
        dataset.addEntity(createEntity("citizen", "C-NEW", newCreated));
        dataset.addEvent(createEvent("citizen", "C-NEW", "permit_application", newCreated + 12 * HOUR));
        // acted before it was created
        dataset.addEntity(createEntity("citizen", "C-BAD", NOW - 2 * DAY));
        dataset.addEvent(createEvent("citizen", "C-BAD", "permit_application", NOW - 3 * DAY));
        ScanContext context = createContext(dataset, rule);

        List<Finding> findings = detector.detect(context);

        assertThat(findings).extracting(Finding::entityId).containsExactly("C-NEW");
        assertThat(context.issuesFor(RuleCategory.BEHAVIORAL)).hasSize(1);
        assertThat(context.issuesFor(RuleCategory.BEHAVIORAL).get(0)).contains("C-BAD");
    }

    @Test
    void severalHeuristics_sameActor_eachProducesItsOwnFinding() {
        DetectionRule countRule = createRule("frequent_payments", DetectionMethod.ACTION_COUNT, 3,
                "entityType", "citizen");
        DetectionRule valueRule = createRule("high_spend", DetectionMethod.CUMULATIVE_VALUE, 100,
                "entityType", "citizen");
        for (int i = 0; i < 3; i++) {
            dataset.addEvent(amountEvent("C-1", 50.0, NOW - (i + 1) * DAY));
        }

        List<Finding> findings = detector.detect(createContext(dataset, countRule, valueRule));

        assertThat(findings).hasSize(2);
        assertThat(findings).extracting(Finding::entityId).containsOnly("C-1");
        assertThat(findings).extracting(f -> f.rule().getName())
                .containsExactlyInAnyOrder("frequent_payments", "high_spend");
    }

    private static ActivityEvent amountEvent(String actorId, Double amount, long at) {
        return new ActivityEvent(UUID.randomUUID().toString(), "citizen", actorId, null, null,
                "payment", "web", amount, at);
    }

    private static ActivityEvent channelEvent(String actorId, String channel, long at) {
        return new ActivityEvent(UUID.randomUUID().toString(), "citizen", actorId, null, null,
                "permit_application", channel, null, at);
    }
}
