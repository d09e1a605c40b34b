package com.civic.anomaly.controller.dto;

import io.swagger.v3.oas.annotations.media.Schema;

public record ActivationRequest(@Schema(example = "false") boolean active) {}
