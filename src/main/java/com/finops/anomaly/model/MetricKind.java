package com.finops.anomaly.model;

/**
 * Metrics with a dedicated business rule. Anything else is {@link #GENERIC}
 * and only receives model findings.
 */
public enum MetricKind {
    COST_PER_POST("cost_per_post"),
    VIRAL_COEFFICIENT("viral_coefficient"),
    ENGAGEMENT_RATE("engagement_rate"),
    PATTERN_FATIGUE("pattern_fatigue"),
    GENERIC("generic");

    private final String metricName;

    MetricKind(String metricName) {
        this.metricName = metricName;
    }

    public String getMetricName() {
        return metricName;
    }

    public static MetricKind fromMetricName(String metricName) {
        for (MetricKind kind : values()) {
            if (kind != GENERIC && kind.metricName.equals(metricName)) {
                return kind;
            }
        }
        return GENERIC;
    }
}
