package com.finops.anomaly.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@Schema(description = "Alert content, rendered per channel")
public class AlertData {

    @Schema(description = "Severity tier", example = "warning")
    private Severity severity;

    @Schema(description = "Short headline", example = "Cost per post above baseline")
    private String title;

    @Schema(description = "Alert body", example = "cost_per_post is 30% above its $0.02 baseline")
    private String message;

    @Schema(description = "Additional fields rendered as key/value pairs")
    private Map<String, Object> context;

    @Schema(description = "Alert time. Defaults to now.")
    private Instant timestamp;

    /**
     * Builds alert content from a detected anomaly.
     */
    public static AlertData fromEvent(AnomalyEvent event) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("metric_name", event.getMetricName());
        context.put("current_value", event.getCurrentValue());
        context.put("baseline_value", event.getBaselineValue());
        context.put("confidence", event.getConfidence());
        if (event.getContext() != null) {
            event.getContext().forEach(context::putIfAbsent);
        }

        String title = String.format("%s anomaly: %s", capitalize(event.getSeverity().wireName()), event.getMetricName());
        String message = String.format("%s is %s (baseline %s)",
                event.getMetricName(), format(event.getCurrentValue()), format(event.getBaselineValue()));

        return AlertData.builder()
                .severity(event.getSeverity())
                .title(title)
                .message(message)
                .context(context)
                .timestamp(event.getDetectedAt())
                .build();
    }

    private static String capitalize(String value) {
        return Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }

    private static String format(double value) {
        return String.format("%.4f", value);
    }
}
