package com.finops.anomaly.engine;

import lombok.Value;

/**
 * Identity of model state: a metric, optionally scoped to one entity.
 */
@Value
public class MetricKey {
    String metricName;
    String entityId;

    public static MetricKey of(String metricName, String entityId) {
        return new MetricKey(metricName, entityId == null || entityId.isBlank() ? null : entityId);
    }

    @Override
    public String toString() {
        return entityId == null ? metricName : metricName + "@" + entityId;
    }
}
