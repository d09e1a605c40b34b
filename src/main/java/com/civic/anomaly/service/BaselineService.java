package com.civic.anomaly.service;

import com.civic.anomaly.config.AnomalyEngineConfig;
import com.civic.anomaly.config.MetricsConfig;
import com.civic.anomaly.dataset.ActivityDataset;
import com.civic.anomaly.dataset.MetricSample;
import com.civic.anomaly.engine.stats.DescriptiveStatistics;
import com.civic.anomaly.exception.DatasetAccessException;
import com.civic.anomaly.model.BaselineRefreshResult;
import com.civic.anomaly.model.DetectionRule;
import com.civic.anomaly.model.RuleCategory;
import com.civic.anomaly.model.StatisticalBaseline;
import com.civic.anomaly.model.WindowSpec;
import com.civic.anomaly.repository.BaselineRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Recomputes statistical baselines for every metric referenced by an active
 * statistical rule. Each metric is fetched as its own task with its own timeout,
 * so one slow or failing metric only loses its own baseline.
 */
@Service
public class BaselineService {

    private static final Logger log = LoggerFactory.getLogger(BaselineService.class);

    private final RuleService ruleService;
    private final BaselineRepository baselineRepository;
    private final ActivityDataset dataset;
    private final ExecutorService executor;
    private final MetricsConfig metricsConfig;
    private final AnomalyEngineConfig config;
    private final Clock clock;

    public BaselineService(RuleService ruleService,
                           BaselineRepository baselineRepository,
                           ActivityDataset dataset,
                           @Qualifier("scanExecutor") ExecutorService executor,
                           MetricsConfig metricsConfig,
                           AnomalyEngineConfig config,
                           Clock clock) {
        this.ruleService = ruleService;
        this.baselineRepository = baselineRepository;
        this.dataset = dataset;
        this.executor = executor;
        this.metricsConfig = metricsConfig;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Window from configuration: the configured lookback, ending where the default
     * detection window starts when the detection window is excluded.
     */
    public WindowSpec defaultWindow() {
        int exclude = config.getBaseline().isExcludeDetectionWindow() ? config.getDefaults().getDetectionDays() : 0;
        return new WindowSpec(config.getBaseline().getLookbackDays(), exclude);
    }

    public BaselineRefreshResult refreshBaselines() {
        return refreshBaselines(defaultWindow());
    }

    /**
     * Refresh all baselines over {@code window}. A rule's {@code lookbackDays} param overrides
     * the window length for its metric; when the window excludes recent days, the rule's
     * {@code detectionDays} param overrides how many. Metrics with no samples keep their
     * previous baseline.
     */
    public BaselineRefreshResult refreshBaselines(WindowSpec window) {
        Map<String, MetricSpec> specs = collectSpecs(window);
        BaselineRefreshResult result = BaselineRefreshResult.builder().build();
        if (specs.isEmpty()) {
            log.info("No active statistical rules, baseline refresh skipped");
            return result;
        }

        long now = clock.millis();
        Map<String, Future<StatisticalBaseline>> futures = new LinkedHashMap<>();
        for (Map.Entry<String, MetricSpec> entry : specs.entrySet()) {
            MetricSpec spec = entry.getValue();
            futures.put(entry.getKey(), executor.submit(() -> compute(spec, now)));
        }

        Duration timeout = config.getBaseline().getMetricTimeout();
        int dataErrors = 0;
        for (Map.Entry<String, Future<StatisticalBaseline>> entry : futures.entrySet()) {
            String key = entry.getKey();
            try {
                StatisticalBaseline baseline = entry.getValue().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
                if (baseline == null) {
                    result.getWarnings().add(key + ": no samples in window, previous baseline kept");
                    log.warn("No samples for baseline {}, previous baseline kept", key);
                    metricsConfig.recordBaselineRefresh("stale");
                    continue;
                }
                baselineRepository.upsert(baseline);
                result.getRefreshed().add(key);
                metricsConfig.recordBaselineRefresh("refreshed");
                log.debug("Baseline {} refreshed: n={}, mean={}, stddev={}",
                        key, baseline.getSampleSize(), baseline.getMean(), baseline.getStddev());

            } catch (TimeoutException e) {
                entry.getValue().cancel(true);
                dataErrors++;
                result.getErrors().add(key + ": timed out after " + timeout.toMillis() + "ms");
                log.error("Baseline {} timed out after {}", key, timeout);
                metricsConfig.recordBaselineRefresh("error");

            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                if (cause instanceof DatasetAccessException) {
                    dataErrors++;
                }
                result.getErrors().add(key + ": " + cause.getMessage());
                log.error("Baseline {} failed: {}", key, cause.getMessage());
                metricsConfig.recordBaselineRefresh("error");

            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                entry.getValue().cancel(true);
                result.getErrors().add(key + ": interrupted");
                break;
            }
        }

        result.setFatal(dataErrors == specs.size());
        log.info("Baseline refresh: {} refreshed, {} stale, {} errors{}",
                result.getRefreshed().size(), result.getWarnings().size(), result.getErrors().size(),
                result.isFatal() ? " (dataset unavailable)" : "");
        return result;
    }

    public List<StatisticalBaseline> listBaselines() {
        return baselineRepository.findAll();
    }

    /**
     * All stored baselines keyed by metric|entityType|period.
     */
    public Map<String, StatisticalBaseline> snapshot() {
        Map<String, StatisticalBaseline> byKey = new HashMap<>();
        for (StatisticalBaseline baseline : baselineRepository.findAll()) {
            byKey.put(baseline.key(), baseline);
        }
        return byKey;
    }

    private Map<String, MetricSpec> collectSpecs(WindowSpec window) {
        Map<String, MetricSpec> specs = new LinkedHashMap<>();
        for (DetectionRule rule : ruleService.listRules(RuleCategory.STATISTICAL, true)) {
            String metric = rule.getParam("metric");
            String entityType = rule.getParam("entityType");
            if (metric == null || entityType == null) {
                log.warn("Statistical rule {} has no metric/entityType, skipped", rule.getName());
                continue;
            }
            String period = rule.getParam("period", "daily");
            int lookback = (int) rule.getParamAsLong("lookbackDays", window.lookbackDays());
            WindowSpec ruleWindow = window.withLookbackDays(lookback);
            if (window.excludeRecentDays() > 0) {
                // the baseline ends where this rule's own detection window starts
                int detectionDays = (int) rule.getParamAsLong("detectionDays", window.excludeRecentDays());
                ruleWindow = ruleWindow.withExcludeRecentDays(detectionDays);
            }
            String key = StatisticalBaseline.key(metric, entityType, period);
            // first rule wins when several rules share a metric
            specs.putIfAbsent(key, new MetricSpec(metric, entityType, period, ruleWindow));
        }
        return specs;
    }

    private StatisticalBaseline compute(MetricSpec spec, long now) {
        List<MetricSample> samples = dataset.fetchMetricValues(spec.metric(), spec.entityType(),
                spec.window().fromMillis(now), spec.window().toMillis(now));
        if (samples.isEmpty()) {
            return null;
        }

        DescriptiveStatistics.Summary summary = DescriptiveStatistics.summarize(
                samples.stream().map(MetricSample::value).toList());
        return StatisticalBaseline.builder()
                .metricName(spec.metric())
                .entityType(spec.entityType())
                .timePeriod(spec.period())
                .mean(summary.mean())
                .stddev(summary.stddev())
                .median(summary.median())
                .q1(summary.q1())
                .q3(summary.q3())
                .sampleSize(summary.count())
                .calculatedAt(now)
                .build();
    }

    private record MetricSpec(String metric, String entityType, String period, WindowSpec window) {}
}
