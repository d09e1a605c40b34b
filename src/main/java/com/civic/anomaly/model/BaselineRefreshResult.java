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
@Schema(description = "Outcome of a baseline refresh")
public class BaselineRefreshResult {

    @Schema(description = "Keys (metric|entityType|period) of baselines that were recomputed")
    @Builder.Default
    private List<String> refreshed = new ArrayList<>();

    @Schema(description = "Baselines left untouched because their window had no samples")
    @Builder.Default
    private List<String> warnings = new ArrayList<>();

    @Schema(description = "Per-metric failures")
    @Builder.Default
    private List<String> errors = new ArrayList<>();

    @Schema(description = "True when every metric failed with a data-access error")
    private boolean fatal;
}
