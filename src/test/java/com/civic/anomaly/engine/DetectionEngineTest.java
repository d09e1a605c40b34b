package com.civic.anomaly.engine;

import com.civic.anomaly.config.AnomalyEngineConfig;
import com.civic.anomaly.config.MetricsConfig;
import com.civic.anomaly.dataset.InMemoryActivityDataset;
import com.civic.anomaly.model.CategoryStatus;
import com.civic.anomaly.model.DetectionMethod;
import com.civic.anomaly.model.DetectionRule;
import com.civic.anomaly.model.Finding;
import com.civic.anomaly.model.RuleCategory;
import io.micrometer.tracing.Tracer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;

import static com.civic.anomaly.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class DetectionEngineTest {

    private ExecutorService executor;
    private AnomalyEngineConfig config;
    private MetricsConfig metricsConfig;

    private final DetectionRule statisticalRule = createRule("amount_outlier", DetectionMethod.Z_SCORE_IQR, 3,
            "metric", "amount", "entityType", "order");
    private final DetectionRule behavioralRule = createRule("frequent", DetectionMethod.ACTION_COUNT, 3,
            "entityType", "citizen");
    private final DetectionRule temporalRule = createRule("rapid", DetectionMethod.RAPID_SEQUENCE, 3,
            "entityType", "citizen");

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        config = new AnomalyEngineConfig();
        config.getScan().setDetectorTimeout(Duration.ofMillis(500));
        metricsConfig = mock(MetricsConfig.class);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void runAll_failingAndSlowDetectorsAreIsolated() {
        DetectionEngine engine = new DetectionEngine(List.of(
                new StubDetector(RuleCategory.STATISTICAL, ctx -> {
                    throw new IllegalStateException("boom");
                }),
                new StubDetector(RuleCategory.BEHAVIORAL, ctx -> {
                    try {
                        Thread.sleep(10_000);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return List.of();
                }),
                new StubDetector(RuleCategory.TEMPORAL, ctx -> List.of(createFinding(temporalRule, "C-1", 5)))),
                executor, Tracer.NOOP, metricsConfig, config);

        Map<RuleCategory, CategoryOutcome> outcomes = engine.runAll(
                createContext(new InMemoryActivityDataset(), statisticalRule, behavioralRule, temporalRule));

        assertThat(outcomes).containsOnlyKeys(RuleCategory.values());
        assertThat(outcomes.get(RuleCategory.STATISTICAL).status()).isEqualTo(CategoryStatus.FAILED);
        assertThat(outcomes.get(RuleCategory.STATISTICAL).errors().get(0)).contains("boom");
        assertThat(outcomes.get(RuleCategory.BEHAVIORAL).status()).isEqualTo(CategoryStatus.FAILED);
        assertThat(outcomes.get(RuleCategory.BEHAVIORAL).errors().get(0)).contains("Timed out");
        assertThat(outcomes.get(RuleCategory.TEMPORAL).status()).isEqualTo(CategoryStatus.ANOMALIES_FOUND);
        assertThat(outcomes.get(RuleCategory.TEMPORAL).findings()).hasSize(1);
        assertThat(outcomes.get(RuleCategory.PATTERN).status()).isEqualTo(CategoryStatus.SKIPPED);
    }

    @Test
    void runAll_recordedIssues_markCategoryPartial() {
        DetectionEngine engine = new DetectionEngine(List.of(
                new StubDetector(RuleCategory.BEHAVIORAL, ctx -> {
                    ctx.recordIssue(RuleCategory.BEHAVIORAL, "frequent: dataset unavailable");
                    return List.of();
                })),
                executor, Tracer.NOOP, metricsConfig, config);

        Map<RuleCategory, CategoryOutcome> outcomes = engine.runAll(
                createContext(new InMemoryActivityDataset(), behavioralRule));

        CategoryOutcome behavioral = outcomes.get(RuleCategory.BEHAVIORAL);
        assertThat(behavioral.status()).isEqualTo(CategoryStatus.PARTIAL);
        assertThat(behavioral.errors()).containsExactly("frequent: dataset unavailable");
    }

    @Test
    void runAll_categoryWithoutDetector_isSkipped() {
        DetectionEngine engine = new DetectionEngine(List.of(), executor, Tracer.NOOP, metricsConfig, config);

        Map<RuleCategory, CategoryOutcome> outcomes = engine.runAll(
                createContext(new InMemoryActivityDataset(), temporalRule));

        assertThat(outcomes.get(RuleCategory.TEMPORAL).status()).isEqualTo(CategoryStatus.SKIPPED);
        assertThat(outcomes.get(RuleCategory.TEMPORAL).errors()).containsExactly("No detector registered");
    }

    @Test
    void runAll_noFindings_isClean() {
        DetectionEngine engine = new DetectionEngine(List.of(
                new StubDetector(RuleCategory.TEMPORAL, ctx -> List.of())),
                executor, Tracer.NOOP, metricsConfig, config);

        Map<RuleCategory, CategoryOutcome> outcomes = engine.runAll(
                createContext(new InMemoryActivityDataset(), temporalRule));

        assertThat(outcomes.get(RuleCategory.TEMPORAL).status()).isEqualTo(CategoryStatus.CLEAN);
    }

    private record StubDetector(RuleCategory category,
                                Function<ScanContext, List<Finding>> body) implements Detector {

        @Override
        public RuleCategory getSupportedCategory() {
            return category;
        }

        @Override
        public List<Finding> detect(ScanContext context) {
            return body.apply(context);
        }
    }
}
