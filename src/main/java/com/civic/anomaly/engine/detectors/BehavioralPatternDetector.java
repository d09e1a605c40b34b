package com.civic.anomaly.engine.detectors;

import com.civic.anomaly.config.AnomalyEngineConfig;
import com.civic.anomaly.dataset.ActivityEvent;
import com.civic.anomaly.dataset.EntityRecord;
import com.civic.anomaly.engine.ScanContext;
import com.civic.anomaly.exception.DetectionException;
import com.civic.anomaly.model.DetectionRule;
import com.civic.anomaly.model.Finding;
import com.civic.anomaly.model.RuleCategory;
import com.civic.anomaly.model.WindowSpec;
import com.civic.anomaly.model.evidence.BehavioralEvidence;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Entity-scoped heuristics over each actor's events in a trailing window
 * (param windowDays, default 30), optionally restricted to one eventType:
 * <ul>
 *   <li>ACTION_COUNT: count &gt;= threshold, score = count</li>
 *   <li>CUMULATIVE_VALUE: total amount &gt; threshold, score = total / threshold</li>
 *   <li>FIRST_ACTION_LATENCY: days from entity creation to its first event &lt; threshold,
 *       score = threshold - latency</li>
 *   <li>DISTINCT_CHANNELS: distinct channels &gt; threshold, score = distinct count</li>
 * </ul>
 */
@Component
public class BehavioralPatternDetector extends AbstractRuleDetector {

    public BehavioralPatternDetector(AnomalyEngineConfig config) {
        super(config);
    }

    @Override
    public RuleCategory getSupportedCategory() {
        return RuleCategory.BEHAVIORAL;
    }

    @Override
    protected List<Finding> evaluate(DetectionRule rule, ScanContext context) {
        String entityType = requireParam(rule, "entityType");
        String eventType = rule.getParam("eventType");
        int windowDays = intParam(rule, "windowDays", defaults.getBehaviorWindowDays());

        Map<String, List<ActivityEvent>> byActor = new LinkedHashMap<>();
        for (ActivityEvent event : context.getDataset().fetchEvents(
                entityType, context.windowStart(windowDays), context.windowEnd())) {
            if (!matchesEventType(event.eventType(), eventType)) continue;
            if (!isComplete(event, false, rule, context)) continue;
            byActor.computeIfAbsent(event.actorId(), k -> new ArrayList<>()).add(event);
        }
        if (byActor.isEmpty()) return List.of();

        return switch (rule.getMethod()) {
            case ACTION_COUNT -> actionCount(rule, entityType, eventType, windowDays, byActor, context);
            case CUMULATIVE_VALUE -> cumulativeValue(rule, entityType, eventType, windowDays, byActor, context);
            case FIRST_ACTION_LATENCY -> firstActionLatency(rule, entityType, eventType, windowDays, byActor, context);
            case DISTINCT_CHANNELS -> distinctChannels(rule, entityType, eventType, windowDays, byActor, context);
            default -> {
                log.warn("Rule {} uses unsupported behavioral method {}", rule.getName(), rule.getMethod());
                yield List.of();
            }
        };
    }

    private List<Finding> actionCount(DetectionRule rule, String entityType, String eventType, int windowDays,
                                      Map<String, List<ActivityEvent>> byActor, ScanContext context) {
        List<Finding> findings = new ArrayList<>();
        double threshold = rule.getThresholdValue();
        for (Map.Entry<String, List<ActivityEvent>> entry : byActor.entrySet()) {
            evaluateEntity(rule, context, entry.getKey(), () -> {
                long count = entry.getValue().size();
                if (count < threshold) return;

                BehavioralEvidence evidence = new BehavioralEvidence(rule.getMethod().getValue(), windowDays,
                        eventType, count, null, null, null, threshold);
                findings.add(new Finding(rule, entityType, entry.getKey(), count, evidence));
            });
        }
        return findings;
    }

    private List<Finding> cumulativeValue(DetectionRule rule, String entityType, String eventType, int windowDays,
                                          Map<String, List<ActivityEvent>> byActor, ScanContext context) {
        List<Finding> findings = new ArrayList<>();
        double threshold = rule.getThresholdValue();
        for (Map.Entry<String, List<ActivityEvent>> entry : byActor.entrySet()) {
            evaluateEntity(rule, context, entry.getKey(), () -> {
                double total = entry.getValue().stream().mapToDouble(ActivityEvent::amountOrZero).sum();
                if (total <= threshold) return;

                double score = threshold > 0 ? total / threshold : total;
                BehavioralEvidence evidence = new BehavioralEvidence(rule.getMethod().getValue(), windowDays,
                        eventType, (long) entry.getValue().size(), total, null, null, threshold);
                findings.add(new Finding(rule, entityType, entry.getKey(), score, evidence));
            });
        }
        return findings;
    }

    private List<Finding> firstActionLatency(DetectionRule rule, String entityType, String eventType, int windowDays,
                                             Map<String, List<ActivityEvent>> byActor, ScanContext context) {
        Map<String, EntityRecord> entities = new LinkedHashMap<>();
        for (EntityRecord entity : context.getDataset().fetchEntities(entityType)) {
            entities.put(entity.entityId(), entity);
        }

        List<Finding> findings = new ArrayList<>();
        double threshold = rule.getThresholdValue();
        for (Map.Entry<String, List<ActivityEvent>> entry : byActor.entrySet()) {
            evaluateEntity(rule, context, entry.getKey(), () -> {
                EntityRecord entity = entities.get(entry.getKey());
                if (entity == null) {
                    log.debug("No {} record for actor {}, latency not computed", entityType, entry.getKey());
                    return;
                }

                long firstAt = entry.getValue().stream().mapToLong(ActivityEvent::occurredAt).min().orElseThrow();
                if (firstAt < entity.createdAt()) {
                    throw new DetectionException("first event precedes creation");
                }

                double latencyDays = (double) (firstAt - entity.createdAt()) / WindowSpec.DAY_MILLIS;
                if (latencyDays >= threshold) return;

                BehavioralEvidence evidence = new BehavioralEvidence(rule.getMethod().getValue(), windowDays,
                        eventType, (long) entry.getValue().size(), null, latencyDays, null, threshold);
                findings.add(new Finding(rule, entityType, entry.getKey(), threshold - latencyDays, evidence));
            });
        }
        return findings;
    }

    private List<Finding> distinctChannels(DetectionRule rule, String entityType, String eventType, int windowDays,
                                           Map<String, List<ActivityEvent>> byActor, ScanContext context) {
        List<Finding> findings = new ArrayList<>();
        double threshold = rule.getThresholdValue();
        for (Map.Entry<String, List<ActivityEvent>> entry : byActor.entrySet()) {
            evaluateEntity(rule, context, entry.getKey(), () -> {
                TreeSet<String> channels = new TreeSet<>();
                entry.getValue().stream()
                        .map(ActivityEvent::channel)
                        .filter(Objects::nonNull)
                        .forEach(channels::add);
                if (channels.size() <= threshold) return;

                BehavioralEvidence evidence = new BehavioralEvidence(rule.getMethod().getValue(), windowDays,
                        eventType, (long) entry.getValue().size(), null, null, List.copyOf(channels), threshold);
                findings.add(new Finding(rule, entityType, entry.getKey(), channels.size(), evidence));
            });
        }
        return findings;
    }
}
