package com.civic.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Aggregate view of anomalies detected within a trailing window")
public class AnomalyReport {

    @Schema(example = "7")
    private int windowDays;

    private long generatedAt;

    @Schema(description = "Anomalies in the window", example = "42")
    private long totalAnomalies;

    @Schema(description = "Counts by severity, critical first")
    @Builder.Default
    private List<ReportEntry> bySeverity = new ArrayList<>();

    @Schema(description = "Counts by entity type, most frequent first")
    @Builder.Default
    private List<ReportEntry> byEntityType = new ArrayList<>();

    @Schema(description = "Counts by investigation status, most frequent first")
    @Builder.Default
    private List<ReportEntry> byStatus = new ArrayList<>();

    @Schema(description = "Top 10 rules by anomalies raised")
    @Builder.Default
    private List<ReportEntry> topRules = new ArrayList<>();

    @Builder.Default
    private List<Alert> alerts = new ArrayList<>();
}
