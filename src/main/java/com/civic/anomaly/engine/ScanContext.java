package com.civic.anomaly.engine;

import com.civic.anomaly.dataset.ActivityDataset;
import com.civic.anomaly.model.DetectionRule;
import com.civic.anomaly.model.RuleCategory;
import com.civic.anomaly.model.StatisticalBaseline;
import com.civic.anomaly.model.WindowSpec;
import lombok.Builder;
import lombok.Getter;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Everything a detector needs for one scan. Shared by all detector tasks; only the
 * issue log is mutable.
 */
@Getter
@Builder
public class ScanContext {

    private final String scanId;

    // Reference time of the scan, epoch millis. Detection windows end here.
    private final long scanTime;

    @Builder.Default
    private final ZoneId zone = ZoneOffset.UTC;

    private final ActivityDataset dataset;

    // Active rules grouped by category
    @Builder.Default
    private final Map<RuleCategory, List<DetectionRule>> rules = new EnumMap<>(RuleCategory.class);

    // Baselines keyed by metric|entityType|period
    @Builder.Default
    private final Map<String, StatisticalBaseline> baselines = Map.of();

    private final Map<RuleCategory, List<String>> issues = new ConcurrentHashMap<>();

    public List<DetectionRule> rulesFor(RuleCategory category) {
        return rules.getOrDefault(category, List.of());
    }

    public StatisticalBaseline baselineFor(String metricName, String entityType, String timePeriod) {
        return baselines.get(StatisticalBaseline.key(metricName, entityType, timePeriod));
    }

    /**
     * Record a problem that degrades a category without failing it.
     */
    public void recordIssue(RuleCategory category, String message) {
        issues.computeIfAbsent(category, c -> new CopyOnWriteArrayList<>()).add(message);
    }

    public List<String> issuesFor(RuleCategory category) {
        return new ArrayList<>(issues.getOrDefault(category, List.of()));
    }

    public long windowStart(int days) {
        return scanTime - days * WindowSpec.DAY_MILLIS;
    }

    // exclusive upper bound that still includes events stamped at scanTime
    public long windowEnd() {
        return scanTime + 1;
    }
}
