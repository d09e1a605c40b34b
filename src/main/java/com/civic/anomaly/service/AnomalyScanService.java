package com.civic.anomaly.service;

import com.civic.anomaly.config.AnomalyEngineConfig;
import com.civic.anomaly.config.MetricsConfig;
import com.civic.anomaly.dataset.ActivityDataset;
import com.civic.anomaly.engine.CategoryOutcome;
import com.civic.anomaly.engine.DetectionEngine;
import com.civic.anomaly.engine.ScanContext;
import com.civic.anomaly.exception.ScanInProgressException;
import com.civic.anomaly.model.Alert;
import com.civic.anomaly.model.BaselineRefreshResult;
import com.civic.anomaly.model.CategoryResult;
import com.civic.anomaly.model.CategoryStatus;
import com.civic.anomaly.model.Finding;
import com.civic.anomaly.model.RuleCategory;
import com.civic.anomaly.model.ScanReport;
import com.civic.anomaly.model.ScanStatus;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Orchestrates a full scan: baseline refresh, concurrent detection, anomaly
 * persistence, reporting and alerting. At most one scan runs at a time.
 */
@Service
public class AnomalyScanService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyScanService.class);

    private final BaselineService baselineService;
    private final RuleService ruleService;
    private final DetectionEngine detectionEngine;
    private final AnomalyService anomalyService;
    private final AnomalyReportService reportService;
    private final TwilioNotificationService notificationService;
    private final ActivityDataset dataset;
    private final MetricsConfig metricsConfig;
    private final AnomalyEngineConfig config;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicReference<ScanReport> latestReport = new AtomicReference<>();

    public AnomalyScanService(BaselineService baselineService,
                              RuleService ruleService,
                              DetectionEngine detectionEngine,
                              AnomalyService anomalyService,
                              AnomalyReportService reportService,
                              TwilioNotificationService notificationService,
                              ActivityDataset dataset,
                              MetricsConfig metricsConfig,
                              AnomalyEngineConfig config,
                              Clock clock) {
        this.baselineService = baselineService;
        this.ruleService = ruleService;
        this.detectionEngine = detectionEngine;
        this.anomalyService = anomalyService;
        this.reportService = reportService;
        this.notificationService = notificationService;
        this.dataset = dataset;
        this.metricsConfig = metricsConfig;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Run a complete detection pass. Always returns a report; failures are recorded
     * in it rather than thrown.
     *
     * @throws ScanInProgressException if another scan is running
     */
    @Observed(name = "scan.full", contextualName = "full-scan")
    public ScanReport runFullScan() {
        if (!running.compareAndSet(false, true)) {
            throw new ScanInProgressException();
        }

        long startedAt = clock.millis();
        ScanReport report = ScanReport.builder()
                .scanId(UUID.randomUUID().toString())
                .startedAt(startedAt)
                .status(ScanStatus.RUNNING)
                .build();
        log.info("Scan {} started", report.getScanId());

        try {
            executeScan(report, startedAt);
        } catch (RuntimeException e) {
            log.error("Scan {} failed: {}", report.getScanId(), e.getMessage(), e);
            report.setStatus(ScanStatus.FAILED);
            report.setError(e.getClass().getSimpleName() + ": " + e.getMessage());
        } finally {
            long finishedAt = clock.millis();
            report.setFinishedAt(finishedAt);
            report.setExecutionTimeMs(finishedAt - startedAt);
            metricsConfig.recordScan(report.getStatus().getValue(), report.getExecutionTimeMs());
            latestReport.set(report);
            running.set(false);
        }

        log.info("Scan {} finished: status={}, anomaliesCreated={}, {}ms",
                report.getScanId(), report.getStatus(), report.totalAnomaliesCreated(), report.getExecutionTimeMs());
        return report;
    }

    public ScanReport getLatestReport() {
        return latestReport.get();
    }

    public boolean isRunning() {
        return running.get();
    }

    private void executeScan(ScanReport report, long scanTime) {
        BaselineRefreshResult baselines = refreshBaselines();
        report.setBaselines(baselines);

        if (baselines.isFatal()) {
            log.error("Scan {}: dataset unavailable during baseline refresh, detectors skipped", report.getScanId());
            for (RuleCategory category : RuleCategory.values()) {
                report.getCategories().add(CategoryResult.builder()
                        .category(category)
                        .categoryName(category.getDisplayName())
                        .status(CategoryStatus.SKIPPED)
                        .errors(new ArrayList<>(List.of("Dataset unavailable")))
                        .build());
            }
            report.setStatus(ScanStatus.FAILED);
            report.setError("Dataset unavailable during baseline refresh");
            return;
        }

        ScanContext context = ScanContext.builder()
                .scanId(report.getScanId())
                .scanTime(scanTime)
                .zone(ZoneId.of(config.getScan().getZone()))
                .dataset(dataset)
                .rules(ruleService.activeRulesByCategory())
                .baselines(baselineService.snapshot())
                .build();

        Map<RuleCategory, CategoryOutcome> outcomes = detectionEngine.runAll(context);
        boolean degraded = !baselines.getErrors().isEmpty();
        for (CategoryOutcome outcome : outcomes.values()) {
            CategoryResult result = persist(outcome);
            report.getCategories().add(result);
            degraded |= result.getStatus().isDegraded();
        }
        report.setStatus(degraded ? ScanStatus.PARTIAL : ScanStatus.COMPLETED);

        raiseAlerts(report);
        metricsConfig.updatePendingCount(anomalyService.countPending());
    }

    private BaselineRefreshResult refreshBaselines() {
        try {
            return baselineService.refreshBaselines();
        } catch (RuntimeException e) {
            log.error("Baseline refresh failed: {}", e.getMessage(), e);
            BaselineRefreshResult failed = BaselineRefreshResult.builder().fatal(true).build();
            failed.getErrors().add(e.getClass().getSimpleName() + ": " + e.getMessage());
            return failed;
        }
    }

    private CategoryResult persist(CategoryOutcome outcome) {
        List<String> errors = new ArrayList<>(outcome.errors());
        int created = 0;
        int duplicates = 0;
        for (Finding finding : outcome.findings()) {
            metricsConfig.recordFinding(finding.rule().getName());
            try {
                if (anomalyService.upsertFinding(finding)) {
                    created++;
                } else {
                    duplicates++;
                }
            } catch (RuntimeException e) {
                log.error("Failed to store finding rule={} {}={}: {}", finding.rule().getName(),
                        finding.entityType(), finding.entityId(), e.getMessage());
                errors.add("Store " + finding.rule().getName() + "/" + finding.entityId() + ": " + e.getMessage());
            }
        }

        CategoryStatus status = outcome.status();
        if (errors.size() > outcome.errors().size() && !status.isDegraded()) {
            status = CategoryStatus.PARTIAL;
        }

        return CategoryResult.builder()
                .category(outcome.category())
                .categoryName(outcome.category().getDisplayName())
                .findingsCount(outcome.findings().size())
                .anomaliesCreated(created)
                .duplicatesSkipped(duplicates)
                .executionTimeMs(outcome.executionTimeMs())
                .status(status)
                .errors(errors)
                .build();
    }

    private void raiseAlerts(ScanReport report) {
        try {
            List<Alert> alerts = reportService.evaluateAlerts();
            report.setAlerts(new ArrayList<>(alerts));
            if (!alerts.isEmpty()) {
                notificationService.notifyAlerts(report.getScanId(),
                        TwilioNotificationService.buildMessageBody(report, alerts));
            }
        } catch (RuntimeException e) {
            log.error("Alert evaluation failed for scan {}: {}", report.getScanId(), e.getMessage(), e);
        }
    }
}
