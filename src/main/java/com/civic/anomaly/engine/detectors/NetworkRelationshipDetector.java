package com.civic.anomaly.engine.detectors;

import com.civic.anomaly.config.AnomalyEngineConfig;
import com.civic.anomaly.dataset.ActivityEvent;
import com.civic.anomaly.dataset.AttributeGroup;
import com.civic.anomaly.dataset.EntityRecord;
import com.civic.anomaly.engine.ScanContext;
import com.civic.anomaly.model.DetectionRule;
import com.civic.anomaly.model.Finding;
import com.civic.anomaly.model.RuleCategory;
import com.civic.anomaly.model.evidence.ClusterEvidence;
import com.civic.anomaly.model.evidence.RelationshipEvidence;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Relationships between records.
 *
 * ATTRIBUTE_CLUSTERING: entities sharing a group attribute (default address) are
 * flagged when the group has more than threshold members, or more than
 * sharedContactMinMembers members that all use a single contact value (default email).
 * Every member gets its own finding carrying the same cluster evidence.
 *
 * SELF_DEALING: events where the actor owns the target organisation. The organisation
 * is flagged with score = number of such events.
 *
 * BILATERAL_VOLUME: (actor, target) pairs with more than threshold events or more than
 * maxPairValue total value (combine=all requires both). The target organisation is
 * flagged with score = max(count / threshold, value / maxPairValue) over its pairs.
 */
@Component
public class NetworkRelationshipDetector extends AbstractRuleDetector {

    public NetworkRelationshipDetector(AnomalyEngineConfig config) {
        super(config);
    }

    @Override
    public RuleCategory getSupportedCategory() {
        return RuleCategory.PATTERN;
    }

    @Override
    protected List<Finding> evaluate(DetectionRule rule, ScanContext context) {
        return switch (rule.getMethod()) {
            case ATTRIBUTE_CLUSTERING -> attributeClustering(rule, context);
            case SELF_DEALING -> selfDealing(rule, context);
            case BILATERAL_VOLUME -> bilateralVolume(rule, context);
            default -> {
                log.warn("Rule {} uses unsupported pattern method {}", rule.getName(), rule.getMethod());
                yield List.of();
            }
        };
    }

    private List<Finding> attributeClustering(DetectionRule rule, ScanContext context) {
        String entityType = requireParam(rule, "entityType");
        String groupAttribute = rule.getParam("groupAttribute", "address");
        String contactAttribute = rule.getParam("contactAttribute", "email");
        int sharedContactMin = intParam(rule, "sharedContactMinMembers", defaults.getSharedContactMinMembers());
        double threshold = rule.getThresholdValue();

        List<Finding> findings = new ArrayList<>();
        for (AttributeGroup group : context.getDataset().fetchAttributeGroups(entityType, groupAttribute, contactAttribute)) {
            evaluateEntity(rule, context, group.value(), () -> {
                int members = group.memberCount();
                boolean large = members > threshold;
                boolean sharedContact = members > sharedContactMin && group.distinctContacts() == 1;
                if (!large && !sharedContact) return;

                ClusterEvidence evidence = new ClusterEvidence(groupAttribute, group.value(), members,
                        group.distinctContacts(), sharedContact, List.copyOf(group.memberIds()));
                for (String memberId : group.memberIds()) {
                    findings.add(new Finding(rule, entityType, memberId, members, evidence));
                }
            });
        }
        return findings;
    }

    private List<Finding> selfDealing(DetectionRule rule, ScanContext context) {
        String actorType = requireParam(rule, "entityType");
        String targetType = requireParam(rule, "targetType");
        String ownerAttribute = rule.getParam("ownerAttribute", "owner");
        int windowDays = intParam(rule, "windowDays", defaults.getRelationshipWindowDays());
        double threshold = rule.getThresholdValue();

        Map<String, String> ownerByTarget = new HashMap<>();
        for (EntityRecord target : context.getDataset().fetchEntities(targetType)) {
            String owner = target.attribute(ownerAttribute);
            if (owner != null) ownerByTarget.put(target.entityId(), owner);
        }
        if (ownerByTarget.isEmpty()) return List.of();

        Map<String, PairTotals> byTarget = new LinkedHashMap<>();
        for (ActivityEvent event : context.getDataset().fetchOrderedEvents(
                actorType, targetType, context.windowStart(windowDays), context.windowEnd())) {
            if (!isComplete(event, true, rule, context)) continue;
            if (!event.actorId().equals(ownerByTarget.get(event.targetId()))) continue;
            byTarget.computeIfAbsent(event.targetId(), k -> new PairTotals(event.actorId())).add(event);
        }

        List<Finding> findings = new ArrayList<>();
        for (Map.Entry<String, PairTotals> entry : byTarget.entrySet()) {
            PairTotals totals = entry.getValue();
            if (totals.count <= threshold) continue;

            RelationshipEvidence evidence = new RelationshipEvidence(RelationshipEvidence.SELF_DEALING,
                    actorType, totals.actorId, targetType, entry.getKey(), totals.count, totals.value, threshold);
            findings.add(new Finding(rule, targetType, entry.getKey(), totals.count, evidence));
        }
        return findings;
    }

    private List<Finding> bilateralVolume(DetectionRule rule, ScanContext context) {
        String actorType = requireParam(rule, "entityType");
        String targetType = requireParam(rule, "targetType");
        int windowDays = intParam(rule, "windowDays", defaults.getRelationshipWindowDays());
        double maxPairValue = rule.getParamAsDouble("maxPairValue", defaults.getMaxPairValue());
        boolean requireBoth = "all".equalsIgnoreCase(rule.getParam("combine", "any"));
        double threshold = rule.getThresholdValue();

        // actor|target -> totals, in (actor, target) order
        Map<String, PairTotals> pairs = new LinkedHashMap<>();
        Map<String, String> targetOfPair = new HashMap<>();
        for (ActivityEvent event : context.getDataset().fetchOrderedEvents(
                actorType, targetType, context.windowStart(windowDays), context.windowEnd())) {
            if (!isComplete(event, true, rule, context)) continue;
            String pairKey = event.actorId() + "|" + event.targetId();
            pairs.computeIfAbsent(pairKey, k -> new PairTotals(event.actorId())).add(event);
            targetOfPair.putIfAbsent(pairKey, event.targetId());
        }

        Map<String, Finding> strongestByTarget = new LinkedHashMap<>();
        for (Map.Entry<String, PairTotals> entry : pairs.entrySet()) {
            PairTotals totals = entry.getValue();
            boolean countExceeded = totals.count > threshold;
            boolean valueExceeded = totals.value > maxPairValue;
            boolean flagged = requireBoth ? countExceeded && valueExceeded : countExceeded || valueExceeded;
            if (!flagged) continue;

            double countRatio = threshold > 0 ? totals.count / threshold : totals.count;
            double valueRatio = maxPairValue > 0 ? totals.value / maxPairValue : totals.value;
            double score = Math.max(countRatio, valueRatio);

            String targetId = targetOfPair.get(entry.getKey());
            Finding current = strongestByTarget.get(targetId);
            if (current != null && current.score() >= score) continue;

            RelationshipEvidence evidence = new RelationshipEvidence(RelationshipEvidence.BILATERAL_VOLUME,
                    actorType, totals.actorId, targetType, targetId, totals.count, totals.value, threshold);
            strongestByTarget.put(targetId, new Finding(rule, targetType, targetId, score, evidence));
        }
        return new ArrayList<>(strongestByTarget.values());
    }

    private static final class PairTotals {
        private final String actorId;
        private long count;
        private double value;

        private PairTotals(String actorId) {
            this.actorId = actorId;
        }

        private void add(ActivityEvent event) {
            count++;
            value += event.amountOrZero();
        }
    }
}
