package com.finops.anomaly.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A single observation of a metric. Never stored; consumed by one evaluation.
 * {@code patternId} is only set for {@code pattern_fatigue} samples, where
 * {@code value} is the usage count.
 */
@Value
@Builder
public class MetricSample {
    String metricName;
    double value;
    String entityId;
    String patternId;
    Instant timestamp;
}
