package com.civic.anomaly.controller.dto;

import com.civic.anomaly.model.ResolutionStatus;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Investigation update for an anomaly")
public record InvestigationRequest(
        @Schema(description = "Target status", example = "confirmed", requiredMode = Schema.RequiredMode.REQUIRED)
        ResolutionStatus status,
        @Schema(description = "Investigator notes", example = "Matched against permit office records")
        String notes,
        @Schema(description = "Operator id", example = "analyst-7")
        String investigatedBy) {
}
