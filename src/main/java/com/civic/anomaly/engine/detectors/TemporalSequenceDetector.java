package com.civic.anomaly.engine.detectors;

import com.civic.anomaly.config.AnomalyEngineConfig;
import com.civic.anomaly.dataset.ActivityEvent;
import com.civic.anomaly.engine.ScanContext;
import com.civic.anomaly.engine.stats.DescriptiveStatistics;
import com.civic.anomaly.model.DetectionRule;
import com.civic.anomaly.model.Finding;
import com.civic.anomaly.model.RuleCategory;
import com.civic.anomaly.model.evidence.HourlyDeviationEvidence;
import com.civic.anomaly.model.evidence.RapidSequenceEvidence;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Time-of-day and sequencing heuristics.
 *
 * HOURLY_DEVIATION: per actor, events are bucketed by hour of day. Mean and stddev
 * are taken over the hours that had activity only; an actor active in fewer than
 * two hours, or with the same count in every active hour, has no deviation. An
 * active hour inside the unusual window with |z| &gt; threshold is flagged. One
 * finding per actor, for its most deviant hour.
 *
 * RAPID_SEQUENCE: per (actor, target) pair, events ordered by time; the longest run
 * of consecutive gaps shorter than maxGapSeconds is found. A run of at least
 * threshold gaps flags the actor, keeping its strongest pair. Score = events in the run.
 */
@Component
public class TemporalSequenceDetector extends AbstractRuleDetector {

    private static final int HOURS = 24;

    public TemporalSequenceDetector(AnomalyEngineConfig config) {
        super(config);
    }

    @Override
    public RuleCategory getSupportedCategory() {
        return RuleCategory.TEMPORAL;
    }

    @Override
    protected List<Finding> evaluate(DetectionRule rule, ScanContext context) {
        return switch (rule.getMethod()) {
            case HOURLY_DEVIATION -> hourlyDeviation(rule, context);
            case RAPID_SEQUENCE -> rapidSequence(rule, context);
            default -> {
                log.warn("Rule {} uses unsupported temporal method {}", rule.getName(), rule.getMethod());
                yield List.of();
            }
        };
    }

    private List<Finding> hourlyDeviation(DetectionRule rule, ScanContext context) {
        String entityType = requireParam(rule, "entityType");
        String eventType = rule.getParam("eventType");
        int windowDays = intParam(rule, "windowDays", defaults.getHourlyWindowDays());
        int startHour = intParam(rule, "unusualStartHour", defaults.getUnusualStartHour());
        int endHour = intParam(rule, "unusualEndHour", defaults.getUnusualEndHour());
        ZoneId zone = context.getZone();

        Map<String, long[]> bucketsByActor = new LinkedHashMap<>();
        for (ActivityEvent event : context.getDataset().fetchEvents(
                entityType, context.windowStart(windowDays), context.windowEnd())) {
            if (!matchesEventType(event.eventType(), eventType)) continue;
            if (!isComplete(event, false, rule, context)) continue;
            int hour = Instant.ofEpochMilli(event.occurredAt()).atZone(zone).getHour();
            bucketsByActor.computeIfAbsent(event.actorId(), k -> new long[HOURS])[hour]++;
        }

        List<Finding> findings = new ArrayList<>();
        for (Map.Entry<String, long[]> entry : bucketsByActor.entrySet()) {
            evaluateEntity(rule, context, entry.getKey(), () -> {
                Finding finding = hourlyFinding(rule, entityType, entry.getKey(), entry.getValue(),
                        startHour, endHour, zone);
                if (finding != null) findings.add(finding);
            });
        }
        return findings;
    }

    private Finding hourlyFinding(DetectionRule rule, String entityType, String actorId, long[] buckets,
                                  int startHour, int endHour, ZoneId zone) {
        List<Double> active = new ArrayList<>();
        for (long count : buckets) {
            if (count > 0) active.add((double) count);
        }
        if (active.size() < 2) return null;

        double[] values = active.stream().mapToDouble(Double::doubleValue).toArray();
        double mean = DescriptiveStatistics.mean(values);
        double stddev = DescriptiveStatistics.sampleStddev(values, mean);
        if (stddev == 0.0) return null;

        double threshold = rule.getThresholdValue();
        List<Integer> flagged = new ArrayList<>();
        int worstHour = -1;
        double worstZ = 0.0;
        for (int h = 0; h < HOURS; h++) {
            if (buckets[h] == 0 || !inWindow(h, startHour, endHour)) continue;
            double absZ = Math.abs((buckets[h] - mean) / stddev);
            if (absZ <= threshold) continue;
            flagged.add(h);
            if (absZ > worstZ) {
                worstZ = absZ;
                worstHour = h;
            }
        }
        if (flagged.isEmpty()) return null;

        HourlyDeviationEvidence evidence = new HourlyDeviationEvidence(worstHour, buckets[worstHour],
                mean, stddev, worstZ, List.copyOf(flagged), zone.getId());
        return new Finding(rule, entityType, actorId, worstZ, evidence);
    }

    /**
     * Inclusive hour window; start &gt; end wraps past midnight (e.g. 22..4).
     */
    static boolean inWindow(int hour, int startHour, int endHour) {
        if (startHour <= endHour) {
            return hour >= startHour && hour <= endHour;
        }
        return hour >= startHour || hour <= endHour;
    }

    private List<Finding> rapidSequence(DetectionRule rule, ScanContext context) {
        String entityType = requireParam(rule, "entityType");
        String targetType = rule.getParam("targetType");
        String eventType = rule.getParam("eventType");
        int windowDays = intParam(rule, "windowDays", defaults.getSequenceWindowDays());
        long maxGapSeconds = rule.getParamAsLong("maxGapSeconds", defaults.getMaxGapSeconds());
        double minRepeat = rule.getThresholdValue();

        List<ActivityEvent> ordered = context.getDataset().fetchOrderedEvents(
                entityType, targetType, context.windowStart(windowDays), context.windowEnd());

        // actor|target -> events in time order
        Map<String, List<ActivityEvent>> byPair = new LinkedHashMap<>();
        for (ActivityEvent event : ordered) {
            if (!matchesEventType(event.eventType(), eventType)) continue;
            if (!isComplete(event, true, rule, context)) continue;
            byPair.computeIfAbsent(event.actorId() + "|" + event.targetId(), k -> new ArrayList<>()).add(event);
        }

        Map<String, RapidSequenceEvidence> strongestByActor = new LinkedHashMap<>();
        for (List<ActivityEvent> pair : byPair.values()) {
            evaluateEntity(rule, context, pair.get(0).actorId(),
                    () -> collectRun(pair, maxGapSeconds, minRepeat, strongestByActor));
        }

        List<Finding> findings = new ArrayList<>();
        for (Map.Entry<String, RapidSequenceEvidence> entry : strongestByActor.entrySet()) {
            findings.add(new Finding(rule, entityType, entry.getKey(), entry.getValue().count(), entry.getValue()));
        }
        return findings;
    }

    private void collectRun(List<ActivityEvent> pair, long maxGapSeconds, double minRepeat,
                            Map<String, RapidSequenceEvidence> strongestByActor) {
        RapidSequenceEvidence run = longestRun(pair, maxGapSeconds);
        if (run == null || run.count() - 1 < minRepeat) return;

        String actorId = pair.get(0).actorId();
        RapidSequenceEvidence current = strongestByActor.get(actorId);
        if (current == null || run.count() > current.count()
                || (run.count() == current.count() && run.minGapSeconds() < current.minGapSeconds())) {
            strongestByActor.put(actorId, run);
        }
    }

    /**
     * Longest run of consecutive gaps below {@code maxGapSeconds} within one time-ordered
     * (actor, target) sequence, or null when no gap qualifies.
     */
    static RapidSequenceEvidence longestRun(List<ActivityEvent> events, long maxGapSeconds) {
        if (events.size() < 2) return null;
        long maxGapMillis = maxGapSeconds * 1000L;

        int bestStart = -1;
        int bestGaps = 0;
        int runStart = 0;
        int runGaps = 0;
        for (int i = 1; i < events.size(); i++) {
            long gap = events.get(i).occurredAt() - events.get(i - 1).occurredAt();
            if (gap < maxGapMillis) {
                if (runGaps == 0) runStart = i - 1;
                runGaps++;
                if (runGaps > bestGaps) {
                    bestGaps = runGaps;
                    bestStart = runStart;
                }
            } else {
                runGaps = 0;
            }
        }
        if (bestGaps == 0) return null;

        long minGap = Long.MAX_VALUE;
        long totalGap = 0;
        for (int i = bestStart + 1; i <= bestStart + bestGaps; i++) {
            long gap = events.get(i).occurredAt() - events.get(i - 1).occurredAt();
            minGap = Math.min(minGap, gap);
            totalGap += gap;
        }

        ActivityEvent first = events.get(bestStart);
        ActivityEvent last = events.get(bestStart + bestGaps);
        return new RapidSequenceEvidence(first.targetType(), first.targetId(), bestGaps + 1,
                minGap / 1000.0, totalGap / 1000.0 / bestGaps, maxGapSeconds,
                first.occurredAt(), last.occurredAt());
    }
}
