package com.civic.anomaly.engine;

import com.civic.anomaly.config.AnomalyEngineConfig;
import com.civic.anomaly.config.MetricsConfig;
import com.civic.anomaly.model.CategoryStatus;
import com.civic.anomaly.model.Finding;
import com.civic.anomaly.model.RuleCategory;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the detector of every rule category concurrently on the scan pool.
 * Uses the Strategy pattern: each RuleCategory is handled by a registered Detector.
 * A detector that throws or overruns its timeout fails only its own category.
 */
@Component
public class DetectionEngine {

    private static final Logger log = LoggerFactory.getLogger(DetectionEngine.class);

    private final Map<RuleCategory, Detector> detectorMap;
    private final ExecutorService executor;
    private final Tracer tracer;
    private final MetricsConfig metricsConfig;
    private final Duration detectorTimeout;

    public DetectionEngine(List<Detector> detectors,
                           @Qualifier("scanExecutor") ExecutorService executor,
                           Tracer tracer,
                           MetricsConfig metricsConfig,
                           AnomalyEngineConfig config) {
        this.detectorMap = new EnumMap<>(RuleCategory.class);
        this.executor = executor;
        this.tracer = tracer;
        this.metricsConfig = metricsConfig;
        this.detectorTimeout = config.getScan().getDetectorTimeout();

        for (Detector detector : detectors) {
            detectorMap.put(detector.getSupportedCategory(), detector);
            log.info("Registered detector: {} -> {}",
                    detector.getSupportedCategory(), detector.getClass().getSimpleName());
        }
    }

    /**
     * Run all categories against the context and wait for each, up to the detector timeout.
     *
     * @return one outcome per category, in category order
     */
    public Map<RuleCategory, CategoryOutcome> runAll(ScanContext context) {
        Map<RuleCategory, CategoryOutcome> outcomes = new EnumMap<>(RuleCategory.class);
        Map<RuleCategory, Submitted> running = new EnumMap<>(RuleCategory.class);

        for (RuleCategory category : RuleCategory.values()) {
            if (context.rulesFor(category).isEmpty()) {
                outcomes.put(category, CategoryOutcome.skipped(category, null));
                continue;
            }
            Detector detector = detectorMap.get(category);
            if (detector == null) {
                log.warn("No detector registered for category: {}", category);
                outcomes.put(category, CategoryOutcome.skipped(category, "No detector registered"));
                continue;
            }
            running.put(category, submit(detector, context));
        }

        long deadline = System.nanoTime() + detectorTimeout.toNanos();
        for (Map.Entry<RuleCategory, Submitted> entry : running.entrySet()) {
            outcomes.put(entry.getKey(), await(entry.getKey(), entry.getValue(), context, deadline));
        }

        for (CategoryOutcome outcome : outcomes.values()) {
            if (outcome.status() != CategoryStatus.SKIPPED) {
                metricsConfig.recordCategory(outcome.category().getValue(), outcome.status().getValue(),
                        outcome.executionTimeMs());
            }
        }
        return outcomes;
    }

    private Submitted submit(Detector detector, ScanContext context) {
        RuleCategory category = detector.getSupportedCategory();
        Span span = tracer.nextSpan()
                .name("detector.run." + category.getValue())
                .tag("scan.id", context.getScanId())
                .tag("detector.category", category.getValue())
                .tag("detector.rules", String.valueOf(context.rulesFor(category).size()))
                .start();

        long startedAt = System.currentTimeMillis();
        Future<List<Finding>> future = executor.submit(() -> {
            try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
                return detector.detect(context);
            }
        });
        return new Submitted(future, span, startedAt);
    }

    private CategoryOutcome await(RuleCategory category, Submitted submitted, ScanContext context, long deadline) {
        Span span = submitted.span();
        try {
            long remaining = Math.max(0, deadline - System.nanoTime());
            List<Finding> findings = submitted.future().get(remaining, TimeUnit.NANOSECONDS);
            long elapsed = System.currentTimeMillis() - submitted.startedAt();

            List<String> issues = context.issuesFor(category);
            CategoryStatus status;
            if (!issues.isEmpty()) {
                status = CategoryStatus.PARTIAL;
            } else if (findings.isEmpty()) {
                status = CategoryStatus.CLEAN;
            } else {
                status = CategoryStatus.ANOMALIES_FOUND;
            }

            span.tag("detector.findings", String.valueOf(findings.size()));
            span.tag("detector.status", status.getValue());
            log.info("Detector {} finished: {} findings, status={}, {}ms",
                    category, findings.size(), status, elapsed);
            return new CategoryOutcome(category, findings, status, issues, elapsed);

        } catch (TimeoutException e) {
            submitted.future().cancel(true);
            span.error(e);
            log.error("Detector {} timed out after {}", category, detectorTimeout);
            return CategoryOutcome.failed(category, "Timed out after " + detectorTimeout.toMillis() + "ms",
                    System.currentTimeMillis() - submitted.startedAt());

        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            span.error(cause);
            log.error("Detector {} failed: {}", category, cause.getMessage(), cause);
            return CategoryOutcome.failed(category, cause.getClass().getSimpleName() + ": " + cause.getMessage(),
                    System.currentTimeMillis() - submitted.startedAt());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            submitted.future().cancel(true);
            span.error(e);
            return CategoryOutcome.failed(category, "Interrupted",
                    System.currentTimeMillis() - submitted.startedAt());
        } finally {
            span.end();
        }
    }

    private record Submitted(Future<List<Finding>> future, Span span, long startedAt) {}
}
