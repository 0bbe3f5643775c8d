package com.finops.anomaly.engine;

import com.finops.anomaly.model.ThresholdConfig;
import lombok.Value;

import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The statistical, trend and seasonal models of one metric key. All access goes through
 * this object's monitor, so evaluations of the same key are serialized while different
 * keys never contend.
 */
public class MetricModelSet {

    private final MetricKey key;
    private final RollingStatisticalModel statistical;
    private final TrendModel trend;
    private final SeasonalModel seasonal;

    public MetricModelSet(MetricKey key, int windowSize, ZoneId zone, int seasonalMinSamples) {
        this.key = key;
        this.statistical = new RollingStatisticalModel(windowSize);
        this.trend = new TrendModel(zone);
        this.seasonal = new SeasonalModel(zone, seasonalMinSamples);
    }

    public MetricKey getKey() {
        return key;
    }

    /**
     * Applies one sample to every model exactly once, in a fixed order, and returns what
     * each model saw.
     */
    public synchronized List<Observation> observe(double value, Instant at, ThresholdConfig config) {
        List<Observation> observations = new ArrayList<>(3);
        for (DetectionModel model : List.of(statistical, trend, seasonal)) {
            ModelReading reading = model.addSample(value, at, config);
            observations.add(new Observation(model.kind(), reading, model.isAnomaly(reading, config)));
        }
        return observations;
    }

    public synchronized void reset(Set<ModelKind> kinds, int windowSize) {
        if (kinds.contains(ModelKind.STATISTICAL)) {
            statistical.reset(windowSize);
        }
        if (kinds.contains(ModelKind.TREND)) {
            trend.reset();
        }
        if (kinds.contains(ModelKind.SEASONAL)) {
            seasonal.reset();
        }
    }

    public synchronized Map<ModelKind, Map<String, Object>> stats() {
        Map<ModelKind, Map<String, Object>> stats = new LinkedHashMap<>();
        stats.put(ModelKind.STATISTICAL, statistical.stats());
        stats.put(ModelKind.TREND, trend.stats());
        stats.put(ModelKind.SEASONAL, seasonal.stats());
        return stats;
    }

    public synchronized double[] statisticalValues() {
        return statistical.values();
    }

    @Value
    public static class Observation {
        ModelKind kind;
        ModelReading reading;
        boolean anomalous;
    }
}
