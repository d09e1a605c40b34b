package com.civic.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "A KPI that exceeded its configured limit")
public record Alert(String name, AlertKpi kpi, long value, long limit, Severity severity, String message) {}
