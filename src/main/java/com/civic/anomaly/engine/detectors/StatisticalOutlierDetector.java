package com.civic.anomaly.engine.detectors;

import com.civic.anomaly.config.AnomalyEngineConfig;
import com.civic.anomaly.dataset.MetricSample;
import com.civic.anomaly.engine.ScanContext;
import com.civic.anomaly.engine.stats.DescriptiveStatistics;
import com.civic.anomaly.model.DetectionMethod;
import com.civic.anomaly.model.DetectionRule;
import com.civic.anomaly.model.Finding;
import com.civic.anomaly.model.RuleCategory;
import com.civic.anomaly.model.StatisticalBaseline;
import com.civic.anomaly.model.evidence.OutlierEvidence;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Flags recent metric values that deviate from their baseline.
 *
 * Logic: a value v is an outlier if |v - mean| / stddev > threshold, or if it lies
 * outside [Q1 - k*IQR, Q3 + k*IQR]. The z-test is skipped when the baseline has no
 * spread. When Q1 == Q3 the fences collapse to [Q1, Q3] and every other value is
 * flagged.
 *
 * Scoring: the z-score when defined, otherwise the distance beyond the nearest fence
 * in IQR units (raw distance when the IQR is zero).
 *
 * Example: baseline mean=50, stddev=10, Q1=40, Q3=60. A value of 95 has z=4.5 and
 * exceeds the upper fence of 90, so it is flagged with score 4.5.
 */
@Component
public class StatisticalOutlierDetector extends AbstractRuleDetector {

    public StatisticalOutlierDetector(AnomalyEngineConfig config) {
        super(config);
    }

    @Override
    public RuleCategory getSupportedCategory() {
        return RuleCategory.STATISTICAL;
    }

    @Override
    protected List<Finding> evaluate(DetectionRule rule, ScanContext context) {
        if (rule.getMethod() != DetectionMethod.Z_SCORE_IQR) {
            log.warn("Rule {} uses unsupported statistical method {}", rule.getName(), rule.getMethod());
            return List.of();
        }

        String metric = requireParam(rule, "metric");
        String entityType = requireParam(rule, "entityType");
        String period = rule.getParam("period", "daily");

        StatisticalBaseline baseline = context.baselineFor(metric, entityType, period);
        if (baseline == null || !baseline.isUsable()) {
            log.warn("No usable baseline for {}|{}|{}, rule {} skipped", metric, entityType, period, rule.getName());
            return List.of();
        }

        int detectionDays = intParam(rule, "detectionDays", defaults.getDetectionDays());
        double k = rule.getParamAsDouble("iqrMultiplier", defaults.getIqrMultiplier());
        double threshold = rule.getThresholdValue();

        List<MetricSample> samples = context.getDataset().fetchMetricValues(
                metric, entityType, context.windowStart(detectionDays), context.windowEnd());

        List<Finding> findings = new ArrayList<>();
        for (MetricSample sample : samples) {
            String entityId = sample.entityId() != null ? sample.entityId() : sample.sampleId();
            evaluateEntity(rule, context, entityId, () -> {
                Assessment assessment = assess(sample.value(), baseline, threshold, k);
                if (!assessment.flagged()) return;

                OutlierEvidence evidence = new OutlierEvidence(
                        metric, sample.sampleId(), sample.value(),
                        baseline.getMean(), baseline.getStddev(), baseline.getQ1(), baseline.getQ3(),
                        baseline.getSampleSize(),
                        assessment.zscore(), assessment.lowerBound(), assessment.upperBound(),
                        assessment.degenerateIqr(), assessment.triggeredBy());
                findings.add(new Finding(rule, entityType, entityId, assessment.score(), evidence));
            });
        }
        return findings;
    }

    /**
     * Test one value against a baseline.
     *
     * @param zThreshold    z-score above which the value is flagged
     * @param iqrMultiplier fence width in IQR units
     */
    public static Assessment assess(double value, StatisticalBaseline baseline, double zThreshold, double iqrMultiplier) {
        Double z = DescriptiveStatistics.zScore(value, baseline.getMean(), baseline.getStddev());
        Double absZ = z != null ? Math.abs(z) : null;

        double iqr = baseline.iqr();
        boolean degenerate = iqr == 0.0;
        double lower = baseline.getQ1() - iqrMultiplier * iqr;
        double upper = baseline.getQ3() + iqrMultiplier * iqr;

        List<String> triggeredBy = new ArrayList<>(2);
        if (absZ != null && absZ > zThreshold) {
            triggeredBy.add(OutlierEvidence.BY_Z_SCORE);
        }
        if (value < lower || value > upper) {
            triggeredBy.add(OutlierEvidence.BY_IQR);
        }

        double score = 0.0;
        if (!triggeredBy.isEmpty()) {
            if (absZ != null) {
                score = absZ;
            } else {
                double distance = value < lower ? lower - value : value - upper;
                score = degenerate ? distance : distance / iqr;
            }
        }
        return new Assessment(!triggeredBy.isEmpty(), absZ, lower, upper, degenerate, List.copyOf(triggeredBy), score);
    }

    public record Assessment(boolean flagged,
                             Double zscore,
                             double lowerBound,
                             double upperBound,
                             boolean degenerateIqr,
                             List<String> triggeredBy,
                             double score) {}
}
