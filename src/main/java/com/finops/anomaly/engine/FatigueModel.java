package com.finops.anomaly.engine;

import com.finops.anomaly.model.ThresholdConfig;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Exponentially decayed usage score of one content pattern:
 * {@code fatigue(t+1) = fatigue(t) * decay + increment}, with the decay applied once per
 * elapsed bucket. The sample value is a usage count; the increment is
 * {@code count * incrementPerUse}. Constant memory per pattern.
 */
public class FatigueModel implements DetectionModel {

    private final String patternId;
    private final double incrementPerUse;
    private final long bucketMillis;

    private double fatigue;
    private long lastBucket = Long.MIN_VALUE;
    private long usageCount;

    public FatigueModel(String patternId, double incrementPerUse, Duration bucket) {
        if (bucket.isZero() || bucket.isNegative()) {
            throw new IllegalArgumentException("decay bucket must be positive");
        }
        this.patternId = patternId;
        this.incrementPerUse = incrementPerUse;
        this.bucketMillis = bucket.toMillis();
    }

    @Override
    public ModelKind kind() {
        return ModelKind.FATIGUE;
    }

    public String getPatternId() {
        return patternId;
    }

    @Override
    public ModelReading addSample(double usageCount, Instant at, ThresholdConfig config) {
        double prior = decayedAt(at, config.getDecayFactor());
        fatigue = prior + usageCount * incrementPerUse;
        lastBucket = Math.max(lastBucket, bucketOf(at));
        this.usageCount += Math.round(usageCount);
        return ModelReading.of(fatigue, prior);
    }

    @Override
    public ModelReading score(double usageCount, Instant at, ThresholdConfig config) {
        double prior = decayedAt(at, config.getDecayFactor());
        return ModelReading.of(prior + usageCount * incrementPerUse, prior);
    }

    /**
     * Fatigue after idle decay up to {@code at}, without recording any usage.
     */
    public double currentFatigue(Instant at, double decayFactor) {
        return decayedAt(at, decayFactor);
    }

    public boolean isFatigued(Instant at, ThresholdConfig config) {
        return currentFatigue(at, config.getDecayFactor()) + SeverityRules.EPSILON >= config.getWarningPct();
    }

    @Override
    public boolean isAnomaly(ModelReading reading, ThresholdConfig config) {
        return reading.getScore() + SeverityRules.EPSILON >= config.getWarningPct();
    }

    @Override
    public void reset() {
        fatigue = 0.0;
        lastBucket = Long.MIN_VALUE;
        usageCount = 0;
    }

    @Override
    public Map<String, Object> stats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("fatigue_score", fatigue);
        stats.put("usage_count", usageCount);
        stats.put("last_bucket_start", lastBucket == Long.MIN_VALUE
                ? null : Instant.ofEpochMilli(lastBucket * bucketMillis).toString());
        return stats;
    }

    private double decayedAt(Instant at, double decayFactor) {
        if (lastBucket == Long.MIN_VALUE) {
            return 0.0;
        }
        long elapsed = bucketOf(at) - lastBucket;
        if (elapsed <= 0) {
            return fatigue;
        }
        return fatigue * Math.pow(decayFactor, elapsed);
    }

    private long bucketOf(Instant at) {
        return Math.floorDiv(at.toEpochMilli(), bucketMillis);
    }
}
