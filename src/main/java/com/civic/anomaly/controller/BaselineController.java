package com.civic.anomaly.controller;

import com.civic.anomaly.model.BaselineRefreshResult;
import com.civic.anomaly.model.StatisticalBaseline;
import com.civic.anomaly.model.WindowSpec;
import com.civic.anomaly.service.BaselineService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/baselines")
@Tag(name = "Baselines", description = "Statistical baselines used by outlier detection")
public class BaselineController {

    private final BaselineService baselineService;

    public BaselineController(BaselineService baselineService) {
        this.baselineService = baselineService;
    }

    @GetMapping
    @Operation(summary = "List stored baselines")
    public ResponseEntity<List<StatisticalBaseline>> listBaselines() {
        return ResponseEntity.ok(baselineService.listBaselines());
    }

    @PostMapping("/refresh")
    @Operation(summary = "Refresh baselines",
               description = "Recomputes baselines outside a scan. Rules may still override the lookback per metric.")
    public ResponseEntity<BaselineRefreshResult> refresh(
            @Parameter(description = "Lookback in days, defaults to the configured window")
            @RequestParam(required = false) Integer lookbackDays) {
        WindowSpec window = baselineService.defaultWindow();
        if (lookbackDays != null) {
            window = window.withLookbackDays(lookbackDays);
        }
        return ResponseEntity.ok(baselineService.refreshBaselines(window));
    }
}
