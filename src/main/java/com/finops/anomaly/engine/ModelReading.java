package com.finops.anomaly.engine;

import lombok.Value;

/**
 * What a model reports about one value. A reading without sufficient data is a soft
 * "no anomaly": its score is zero and callers must not treat it as an error.
 */
@Value
public class ModelReading {

    private static final ModelReading INSUFFICIENT = new ModelReading(0.0, 0.0, false);

    // Deviation score; meaning depends on the model (z-score, fractional deviation, fatigue)
    double score;

    // Value the sample was compared against (mean, bucket average, prior fatigue)
    double baseline;

    boolean sufficientData;

    public static ModelReading of(double score, double baseline) {
        return new ModelReading(score, baseline, true);
    }

    public static ModelReading insufficientData() {
        return INSUFFICIENT;
    }
}
