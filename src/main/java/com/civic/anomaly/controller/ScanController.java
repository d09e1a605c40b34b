package com.civic.anomaly.controller;

import com.civic.anomaly.model.ScanReport;
import com.civic.anomaly.service.AnomalyScanService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/scans")
@Tag(name = "Scans", description = "Trigger and inspect full detection scans")
public class ScanController {

    private final AnomalyScanService scanService;

    public ScanController(AnomalyScanService scanService) {
        this.scanService = scanService;
    }

    @PostMapping
    @Operation(summary = "Run a full scan",
               description = "Refreshes baselines, runs all detector categories and stores new anomalies. " +
                             "Blocks until the scan finishes. Returns 409 if a scan is already running.")
    public ResponseEntity<ScanReport> runFullScan() {
        return ResponseEntity.ok(scanService.runFullScan());
    }

    @GetMapping("/latest")
    @Operation(summary = "Get the latest scan report")
    public ResponseEntity<ScanReport> getLatest() {
        ScanReport report = scanService.getLatestReport();
        if (report == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(report);
    }
}
