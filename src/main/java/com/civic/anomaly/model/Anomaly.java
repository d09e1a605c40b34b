package com.civic.anomaly.model;

import com.civic.anomaly.model.evidence.FindingEvidence;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A persisted finding under investigation")
public class Anomaly {

    @Schema(description = "Anomaly identifier", example = "5d1e8b7a-2c4f-4f4e-a0ab-3f55f0e1b2c9")
    private String anomalyId;

    @Schema(description = "Identifier of the rule that raised the anomaly")
    private String ruleId;

    @Schema(description = "Name of the rule that raised the anomaly", example = "rapid_sequence_activity")
    private String ruleName;

    @Schema(description = "Rule category", example = "temporal")
    private RuleCategory category;

    @Schema(description = "Severity of the rule at detection time", example = "high")
    private Severity severity;

    @Schema(description = "Type of the flagged business record", example = "citizen")
    private String entityType;

    @Schema(description = "Identifier of the flagged business record", example = "10042")
    private String entityId;

    @Schema(description = "Non-negative method-specific score", example = "4.5")
    private double anomalyScore;

    @Schema(description = "Method-specific evidence")
    private FindingEvidence evidence;

    @Schema(description = "Detection time in epoch milliseconds", example = "1739886764000")
    private long detectedAt;

    @Schema(description = "Time of the last investigation update in epoch milliseconds, null until investigated")
    private Long investigatedAt;

    @Schema(description = "Investigation status", example = "pending")
    private ResolutionStatus status;

    @Schema(description = "Investigator notes")
    private String investigationNotes;

    @Schema(description = "Operator who last updated the investigation", example = "analyst-7")
    private String investigatedBy;

    public String openKey() {
        return openKey(ruleId, entityType, entityId);
    }

    public static String openKey(String ruleId, String entityType, String entityId) {
        return ruleId + "|" + entityType + "|" + entityId;
    }
}
