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
@Schema(description = "Per-category outcome of a scan")
public class CategoryResult {

    @Schema(example = "statistical")
    private RuleCategory category;

    @Schema(description = "Human-readable category name", example = "Statistical Outliers")
    private String categoryName;

    @Schema(description = "Findings produced by the detector", example = "3")
    private int findingsCount;

    @Schema(description = "New pending anomalies stored", example = "2")
    private int anomaliesCreated;

    @Schema(description = "Findings skipped because a pending anomaly already existed", example = "1")
    private int duplicatesSkipped;

    private long executionTimeMs;

    @Schema(example = "anomalies_found")
    private CategoryStatus status;

    @Builder.Default
    private List<String> errors = new ArrayList<>();
}
