package com.civic.anomaly.controller;

import com.civic.anomaly.controller.dto.InvestigationRequest;
import com.civic.anomaly.model.Anomaly;
import com.civic.anomaly.model.AnomalyFilter;
import com.civic.anomaly.model.ResolutionStatus;
import com.civic.anomaly.model.Severity;
import com.civic.anomaly.service.AnomalyService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/anomalies")
@Tag(name = "Anomalies", description = "Detected anomalies and their investigation")
public class AnomalyController {

    private final AnomalyService anomalyService;

    public AnomalyController(AnomalyService anomalyService) {
        this.anomalyService = anomalyService;
    }

    @GetMapping
    @Operation(summary = "Query anomalies", description = "Newest first. All filters are optional.")
    public ResponseEntity<List<Anomaly>> query(
            @RequestParam(required = false) String entityType,
            @Parameter(description = "low, medium, high or critical")
            @RequestParam(required = false) String severity,
            @Parameter(description = "pending, false_positive, confirmed or resolved")
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String ruleName,
            @Parameter(description = "Detected at or after, epoch millis")
            @RequestParam(required = false) Long fromDate,
            @Parameter(description = "Detected at or before, epoch millis")
            @RequestParam(required = false) Long toDate,
            @RequestParam(defaultValue = "100") int limit) {
        AnomalyFilter filter = new AnomalyFilter(
                entityType,
                severity != null ? Severity.fromValue(severity) : null,
                status != null ? ResolutionStatus.fromValue(status) : null,
                ruleName, fromDate, toDate, limit);
        return ResponseEntity.ok(anomalyService.query(filter));
    }

    @GetMapping("/{anomalyId}")
    @Operation(summary = "Get an anomaly with its evidence")
    public ResponseEntity<Anomaly> get(@PathVariable String anomalyId) {
        Anomaly anomaly = anomalyService.getAnomaly(anomalyId);
        if (anomaly == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(anomaly);
    }

    @PostMapping("/{anomalyId}/investigation")
    @Operation(summary = "Update investigation status",
               description = "pending -> false_positive | confirmed, confirmed -> resolved. " +
                             "Other moves return 409.")
    public ResponseEntity<Anomaly> updateInvestigation(@PathVariable String anomalyId,
                                                       @RequestBody InvestigationRequest request) {
        if (request.status() == null) {
            throw new IllegalArgumentException("status is required");
        }
        return ResponseEntity.ok(anomalyService.transition(
                anomalyId, request.status(), request.notes(), request.investigatedBy()));
    }
}
