package com.civic.anomaly.service;

import com.civic.anomaly.config.AnomalyEngineConfig;
import com.civic.anomaly.config.MetricsConfig;
import com.civic.anomaly.model.Alert;
import com.civic.anomaly.model.AlertKpi;
import com.civic.anomaly.model.Anomaly;
import com.civic.anomaly.model.AnomalyFilter;
import com.civic.anomaly.model.AnomalyReport;
import com.civic.anomaly.model.ReportEntry;
import com.civic.anomaly.model.ResolutionStatus;
import com.civic.anomaly.model.Severity;
import com.civic.anomaly.model.WindowSpec;
import com.civic.anomaly.repository.AnomalyRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Aggregates recent anomalies for operators and checks configured KPI limits.
 */
@Service
public class AnomalyReportService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyReportService.class);

    private static final int TOP_RULES = 10;

    private final AnomalyRepository anomalyRepository;
    private final AnomalyEngineConfig config;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public AnomalyReportService(AnomalyRepository anomalyRepository,
                                AnomalyEngineConfig config,
                                MetricsConfig metricsConfig,
                                Clock clock) {
        this.anomalyRepository = anomalyRepository;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    public AnomalyReport generateReport(int windowDays) {
        if (windowDays <= 0) {
            throw new IllegalArgumentException("windowDays must be positive");
        }
        long now = clock.millis();
        List<Anomaly> anomalies = anomalyRepository.query(
                AnomalyFilter.detectedSince(now - windowDays * WindowSpec.DAY_MILLIS));

        Map<Severity, Long> severityCounts = new EnumMap<>(Severity.class);
        for (Anomaly anomaly : anomalies) {
            severityCounts.merge(anomaly.getSeverity(), 1L, Long::sum);
        }
        List<ReportEntry> bySeverity = severityCounts.entrySet().stream()
                .sorted(Comparator.comparingInt(e -> e.getKey().getReportOrder()))
                .map(e -> new ReportEntry(e.getKey().getValue(), e.getValue()))
                .toList();

        return AnomalyReport.builder()
                .windowDays(windowDays)
                .generatedAt(now)
                .totalAnomalies(anomalies.size())
                .bySeverity(new ArrayList<>(bySeverity))
                .byEntityType(countDescending(anomalies, Anomaly::getEntityType, Integer.MAX_VALUE))
                .byStatus(countDescending(anomalies, a -> a.getStatus().getValue(), Integer.MAX_VALUE))
                .topRules(countDescending(anomalies, Anomaly::getRuleName, TOP_RULES))
                .alerts(evaluateThresholds(anomalies))
                .build();
    }

    /**
     * Alerts raised by anomalies in the configured alerting window.
     */
    public List<Alert> evaluateAlerts() {
        return generateReport(config.getAlerting().getWindowDays()).getAlerts();
    }

    private List<Alert> evaluateThresholds(List<Anomaly> anomalies) {
        List<Alert> alerts = new ArrayList<>();
        for (AnomalyEngineConfig.AlertThreshold threshold : config.getAlerting().getThresholds()) {
            if (threshold.getKpi() == null) continue;
            long value = kpiValue(threshold.getKpi(), anomalies);
            if (value <= threshold.getLimit()) continue;

            String name = threshold.getName() != null ? threshold.getName() : threshold.getKpi().name();
            String message = String.format("%s: %d %s anomalies exceed the limit of %d",
                    name, value, threshold.getKpi().name().toLowerCase(), threshold.getLimit());
            alerts.add(new Alert(name, threshold.getKpi(), value, threshold.getLimit(), threshold.getSeverity(), message));
            metricsConfig.recordAlert(threshold.getKpi().name());
            log.warn("Alert raised: {}", message);
        }
        return alerts;
    }

    static long kpiValue(AlertKpi kpi, List<Anomaly> anomalies) {
        return switch (kpi) {
            case TOTAL -> anomalies.size();
            case PENDING -> anomalies.stream().filter(a -> a.getStatus() == ResolutionStatus.PENDING).count();
            case CONFIRMED -> anomalies.stream().filter(a -> a.getStatus() == ResolutionStatus.CONFIRMED).count();
            case CRITICAL -> anomalies.stream().filter(a -> a.getSeverity() == Severity.CRITICAL).count();
            case HIGH -> anomalies.stream().filter(a -> a.getSeverity() == Severity.HIGH).count();
        };
    }

    private static List<ReportEntry> countDescending(List<Anomaly> anomalies, Function<Anomaly, String> key, int limit) {
        Map<String, Long> counts = new HashMap<>();
        for (Anomaly anomaly : anomalies) {
            String k = key.apply(anomaly);
            counts.merge(k != null ? k : "unknown", 1L, Long::sum);
        }
        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed()
                        .thenComparing(Map.Entry.<String, Long>comparingByKey()))
                .limit(limit)
                .map(e -> new ReportEntry(e.getKey(), e.getValue()))
                .collect(Collectors.toCollection(ArrayList::new));
    }
}
