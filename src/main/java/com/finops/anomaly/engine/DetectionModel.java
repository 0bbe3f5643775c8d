package com.finops.anomaly.engine;

import com.finops.anomaly.model.ThresholdConfig;

import java.time.Instant;
import java.util.Map;

/**
 * Common shape of every detection model: a bounded window or bucket set plus a deviation score.
 * Implementations are not thread-safe; callers serialize access per model instance.
 */
public interface DetectionModel {

    ModelKind kind();

    /**
     * Applies the sample to the model state and returns the reading for it.
     * Each model defines whether the reading is taken before or after the update.
     */
    ModelReading addSample(double value, Instant at, ThresholdConfig config);

    /**
     * Reads the value against the current state without mutating it.
     */
    ModelReading score(double value, Instant at, ThresholdConfig config);

    boolean isAnomaly(ModelReading reading, ThresholdConfig config);

    void reset();

    /**
     * Diagnostics for the stats endpoint: sample counts, mean/stddev, bucket occupancy.
     */
    Map<String, Object> stats();
}
