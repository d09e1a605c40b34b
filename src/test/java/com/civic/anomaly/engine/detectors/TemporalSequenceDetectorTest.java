package com.civic.anomaly.engine.detectors;

import com.civic.anomaly.config.AnomalyEngineConfig;
import com.civic.anomaly.dataset.ActivityDataset;
import com.civic.anomaly.dataset.ActivityEvent;
import com.civic.anomaly.dataset.InMemoryActivityDataset;
import com.civic.anomaly.engine.ScanContext;
import com.civic.anomaly.model.DetectionMethod;
import com.civic.anomaly.model.DetectionRule;
import com.civic.anomaly.model.Finding;
import com.civic.anomaly.model.RuleCategory;
import com.civic.anomaly.model.evidence.HourlyDeviationEvidence;
import com.civic.anomaly.model.evidence.RapidSequenceEvidence;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static com.civic.anomaly.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TemporalSequenceDetectorTest {

    private static final long SECOND = 1000L;

    private TemporalSequenceDetector detector;
    private InMemoryActivityDataset dataset;

    @BeforeEach
    void setUp() {
        detector = new TemporalSequenceDetector(new AnomalyEngineConfig());
        dataset = new InMemoryActivityDataset();
    }

    @Test
    void longestRun_countsConsecutiveShortGaps() {
        List<ActivityEvent> events = sequence("C-1", "M-1", NOW - HOUR, 10, 15, 20, 12);

        RapidSequenceEvidence run = TemporalSequenceDetector.longestRun(events, 60);

        assertThat(run).isNotNull();
        assertThat(run.count()).isEqualTo(5);
        assertThat(run.minGapSeconds()).isEqualTo(10.0);
        assertThat(run.avgGapSeconds()).isCloseTo(14.25, within(1e-9));
        assertThat(run.firstEventAt()).isEqualTo(NOW - HOUR);
        assertThat(run.targetId()).isEqualTo("M-1");
    }

    @Test
    void longestRun_longGapSplitsRuns() {
        List<ActivityEvent> events = sequence("C-1", "M-1", NOW - HOUR, 10, 120, 10, 10);

        RapidSequenceEvidence run = TemporalSequenceDetector.longestRun(events, 60);

        assertThat(run.count()).isEqualTo(3);
        assertThat(run.firstEventAt()).isEqualTo(NOW - HOUR + 130 * SECOND);
    }

    @Test
    void longestRun_gapEqualToMaximumDoesNotQualify() {
        assertThat(TemporalSequenceDetector.longestRun(sequence("C-1", "M-1", NOW - HOUR, 60), 60)).isNull();
        assertThat(TemporalSequenceDetector.longestRun(sequence("C-1", "M-1", NOW - HOUR), 60)).isNull();
    }

    @Test
    void inWindow_supportsWrapAroundMidnight() {
        assertThat(TemporalSequenceDetector.inWindow(3, 0, 6)).isTrue();
        assertThat(TemporalSequenceDetector.inWindow(6, 0, 6)).isTrue();
        assertThat(TemporalSequenceDetector.inWindow(7, 0, 6)).isFalse();
        assertThat(TemporalSequenceDetector.inWindow(23, 22, 4)).isTrue();
        assertThat(TemporalSequenceDetector.inWindow(2, 22, 4)).isTrue();
        assertThat(TemporalSequenceDetector.inWindow(12, 22, 4)).isFalse();
    }

    @Test
    void rapidSequence_flagsActorWithEnoughRepeats() {
        DetectionRule rule = createRule("rapid_orders", DetectionMethod.RAPID_SEQUENCE, 3,
                "entityType", "citizen", "targetType", "merchant");
        sequence("C-1", "M-1", NOW - HOUR, 10, 15, 20, 12).forEach(dataset::addEvent);
        // five minutes apart
        sequence("C-2", "M-1", NOW - HOUR, 300, 300, 300).forEach(dataset::addEvent);

        List<Finding> findings = detector.detect(createContext(dataset, rule));

        assertThat(findings).hasSize(1);
        assertThat(findings.get(0).entityId()).isEqualTo("C-1");
        assertThat(findings.get(0).score()).isEqualTo(5.0);
        assertThat(findings.get(0).evidence()).isInstanceOf(RapidSequenceEvidence.class);
    }

    @Test
    void rapidSequence_keepsStrongestPairPerActor() {
        DetectionRule rule = createRule("rapid_orders", DetectionMethod.RAPID_SEQUENCE, 2,
                "entityType", "citizen", "targetType", "merchant");
        sequence("C-1", "M-1", NOW - 2 * HOUR, 5, 5).forEach(dataset::addEvent);
        sequence("C-1", "M-2", NOW - HOUR, 5, 5, 5, 5).forEach(dataset::addEvent);

        List<Finding> findings = detector.detect(createContext(dataset, rule));

        assertThat(findings).hasSize(1);
        RapidSequenceEvidence evidence = (RapidSequenceEvidence) findings.get(0).evidence();
        assertThat(evidence.targetId()).isEqualTo("M-2");
        assertThat(evidence.count()).isEqualTo(5);
    }

    @Test
    void hourlyDeviation_flagsSpikeInsideUnusualHours() {
        DetectionRule rule = createRule("night_sales", DetectionMethod.HOURLY_DEVIATION, 3,
                "entityType", "merchant", "unusualStartHour", "0", "unusualEndHour", "6");
        long night = Instant.parse("2026-03-14T03:00:00Z").toEpochMilli();
        for (int day = 0; day < 10; day++) {
            dataset.addEvent(createEvent("merchant", "M-1", "sale", night - day * DAY));
        }
        long daytime = Instant.parse("2026-03-10T08:00:00Z").toEpochMilli();
        for (int hour = 0; hour < 10; hour++) {
            dataset.addEvent(createEvent("merchant", "M-1", "sale", daytime + hour * HOUR));
        }
        // spread evenly over business hours
        for (int hour = 0; hour < 10; hour++) {
            dataset.addEvent(createEvent("merchant", "M-2", "sale", daytime + hour * HOUR));
        }

        List<Finding> findings = detector.detect(createContext(dataset, rule));

        assertThat(findings).hasSize(1);
        Finding finding = findings.get(0);
        assertThat(finding.entityId()).isEqualTo("M-1");
        HourlyDeviationEvidence evidence = (HourlyDeviationEvidence) finding.evidence();
        assertThat(evidence.hour()).isEqualTo(3);
        assertThat(evidence.count()).isEqualTo(10L);
        assertThat(evidence.flaggedHours()).containsExactly(3);
        assertThat(finding.score()).isGreaterThan(3.0);
    }

    @Test
    void hourlyDeviation_singleNightEvent_notFlagged() {
        DetectionRule rule = createRule("night_sales", DetectionMethod.HOURLY_DEVIATION, 3,
                "entityType", "merchant");
        dataset.addEvent(createEvent("merchant", "M-1", "sale", Instant.parse("2026-03-14T03:00:00Z").toEpochMilli()));

        assertThat(detector.detect(createContext(dataset, rule))).isEmpty();
    }

    @Test
    void hourlyDeviation_twoActiveHours_deviationCappedBelowDefaultThreshold() {
        DetectionRule rule = createRule("night_sales", DetectionMethod.HOURLY_DEVIATION, 0.5,
                "entityType", "merchant");
        long night = Instant.parse("2026-03-14T03:00:00Z").toEpochMilli();
        for (int day = 0; day < 10; day++) {
            dataset.addEvent(createEvent("merchant", "M-1", "sale", night - day * DAY));
        }
        dataset.addEvent(createEvent("merchant", "M-1", "sale", Instant.parse("2026-03-14T12:00:00Z").toEpochMilli()));

        List<Finding> findings = detector.detect(createContext(dataset, rule));

        // two active hours always sit 0.707 stddev from their mean
        assertThat(findings).hasSize(1);
        assertThat(findings.get(0).score()).isCloseTo(Math.sqrt(0.5), within(1e-9));

        DetectionRule strict = createRule("night_sales", DetectionMethod.HOURLY_DEVIATION, 3,
                "entityType", "merchant");
        assertThat(detector.detect(createContext(dataset, strict))).isEmpty();
    }

    @Test
    void rapidSequence_eventWithoutActor_droppedByDataset() {
        DetectionRule rule = createRule("rapid_orders", DetectionMethod.RAPID_SEQUENCE, 3,
                "entityType", "citizen", "targetType", "merchant");
        sequence("C-1", "M-1", NOW - HOUR, 10, 10, 10, 10).forEach(dataset::addEvent);
        dataset.addEvent(new ActivityEvent("bad", "citizen", null, "merchant", "M-1",
                "order", "web", 20.0, NOW - HOUR + 5 * SECOND));

        List<Finding> findings = detector.detect(createContext(dataset, rule));

        assertThat(findings).extracting(Finding::entityId).containsExactly("C-1");
        assertThat(findings.get(0).score()).isEqualTo(5.0);
    }

    @Test
    void rapidSequence_malformedEvent_skippedAndRecorded() {
        DetectionRule rule = createRule("rapid_orders", DetectionMethod.RAPID_SEQUENCE, 3,
                "entityType", "citizen", "targetType", "merchant");
        List<ActivityEvent> ordered = new ArrayList<>();
        ordered.add(new ActivityEvent("bad", "citizen", null, "merchant", "M-1",
                "order", "web", 20.0, NOW - HOUR));
        ordered.addAll(sequence("C-1", "M-1", NOW - HOUR, 10, 10, 10, 10));
        ActivityDataset source = mock(ActivityDataset.class);
        when(source.fetchOrderedEvents(eq("citizen"), eq("merchant"), anyLong(), anyLong())).thenReturn(ordered);
        ScanContext context = createContext(source, rule);

        List<Finding> findings = detector.detect(context);

        assertThat(findings).extracting(Finding::entityId).containsExactly("C-1");
        assertThat(context.issuesFor(RuleCategory.TEMPORAL)).hasSize(1);
        assertThat(context.issuesFor(RuleCategory.TEMPORAL).get(0)).contains("bad").contains("actor");
    }

    private static List<ActivityEvent> sequence(String actorId, String targetId, long start, long... gapsSeconds) {
        List<ActivityEvent> events = new ArrayList<>();
        long at = start;
        events.add(createTargetedEvent(actorId, targetId, 20.0, at));
        for (long gap : gapsSeconds) {
            at += gap * SECOND;
            events.add(createTargetedEvent(actorId, targetId, 20.0, at));
        }
        return events;
    }
}
