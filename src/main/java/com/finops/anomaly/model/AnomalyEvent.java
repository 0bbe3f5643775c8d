package com.finops.anomaly.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
@Jacksonized
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@Schema(description = "A detected deviation from expected metric behaviour")
public class AnomalyEvent {

    @Schema(description = "Metric that deviated", example = "cost_per_post")
    String metricName;

    @Schema(description = "Observed value", example = "0.026")
    double currentValue;

    @Schema(description = "Expected value the observation was compared against", example = "0.02")
    double baselineValue;

    @Schema(description = "Severity tier", example = "warning", allowableValues = {"info", "warning", "critical"})
    Severity severity;

    @Schema(description = "Detector confidence in [0, 1]", example = "0.6")
    double confidence;

    @Schema(description = "Detection context: detector, entity, ratios and model diagnostics")
    @Singular("contextEntry")
    Map<String, Object> context;

    @Schema(description = "Detection time", example = "2026-01-15T10:30:00Z")
    Instant detectedAt;
}
