package com.civic.anomaly.controller.dto;

public record ErrorResponse(String code, String message) {}
