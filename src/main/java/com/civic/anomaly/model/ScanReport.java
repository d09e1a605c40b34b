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
@Schema(description = "Summary of a full detection scan")
public class ScanReport {

    private String scanId;
    private long startedAt;
    private long finishedAt;
    private long executionTimeMs;

    @Schema(example = "completed")
    private ScanStatus status;

    private BaselineRefreshResult baselines;

    @Builder.Default
    private List<CategoryResult> categories = new ArrayList<>();

    @Builder.Default
    private List<Alert> alerts = new ArrayList<>();

    @Schema(description = "Top-level failure message when the scan failed")
    private String error;

    public int totalAnomaliesCreated() {
        return categories.stream().mapToInt(CategoryResult::getAnomaliesCreated).sum();
    }
}
