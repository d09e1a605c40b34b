package com.civic.anomaly.controller;

import com.civic.anomaly.model.AnomalyReport;
import com.civic.anomaly.service.AnomalyReportService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/reports")
@Tag(name = "Reports", description = "Aggregated anomaly statistics and KPI alerts")
public class ReportController {

    private final AnomalyReportService reportService;

    public ReportController(AnomalyReportService reportService) {
        this.reportService = reportService;
    }

    @GetMapping
    @Operation(summary = "Generate anomaly report",
               description = "Counts by severity, entity type and status plus the top 10 rules over the trailing window")
    public ResponseEntity<AnomalyReport> generateReport(@RequestParam(defaultValue = "7") int windowDays) {
        return ResponseEntity.ok(reportService.generateReport(windowDays));
    }
}
