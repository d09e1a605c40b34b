package com.civic.anomaly.model;

public record ReportEntry(String key, long count) {}
