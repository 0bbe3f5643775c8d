package com.finops.anomaly.engine;

import com.finops.anomaly.model.ThresholdConfig;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Running averages over a fixed set of calendar buckets. A new sample is compared with the
 * average its bucket held before the sample was applied; the deviation is
 * {@code |value - average| / |average|}.
 */
public abstract class BucketedAverageModel implements DetectionModel {

    private final double[] averages;
    private final long[] counts;
    private final ZoneId zone;
    private final int minSamplesBeforeSignal;
    private long totalSamples;

    protected BucketedAverageModel(int bucketCount, ZoneId zone, int minSamplesBeforeSignal) {
        this.averages = new double[bucketCount];
        this.counts = new long[bucketCount];
        this.zone = zone;
        this.minSamplesBeforeSignal = minSamplesBeforeSignal;
    }

    protected abstract int bucketIndex(ZonedDateTime time);

    @Override
    public ModelReading addSample(double value, Instant at, ThresholdConfig config) {
        ModelReading reading = score(value, at, config);
        int idx = bucketOf(at);
        counts[idx]++;
        averages[idx] += (value - averages[idx]) / counts[idx];
        totalSamples++;
        return reading;
    }

    @Override
    public ModelReading score(double value, Instant at, ThresholdConfig config) {
        int idx = bucketOf(at);
        if (totalSamples < minSamplesBeforeSignal || counts[idx] == 0) {
            return ModelReading.insufficientData();
        }
        double average = averages[idx];
        if (average == 0.0) {
            return ModelReading.insufficientData();
        }
        return ModelReading.of(Math.abs(value - average) / Math.abs(average), average);
    }

    @Override
    public boolean isAnomaly(ModelReading reading, ThresholdConfig config) {
        return reading.isSufficientData() && reading.getScore() > config.getTrendDeviationPct();
    }

    @Override
    public void reset() {
        Arrays.fill(averages, 0.0);
        Arrays.fill(counts, 0L);
        totalSamples = 0;
    }

    public int bucketOf(Instant at) {
        return bucketIndex(at.atZone(zone));
    }

    public double bucketAverage(int idx) {
        return averages[idx];
    }

    public long bucketCount(int idx) {
        return counts[idx];
    }

    public long totalSamples() {
        return totalSamples;
    }

    public int occupiedBuckets() {
        int occupied = 0;
        for (long c : counts) {
            if (c > 0) {
                occupied++;
            }
        }
        return occupied;
    }

    @Override
    public Map<String, Object> stats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("total_samples", totalSamples);
        stats.put("bucket_count", counts.length);
        stats.put("occupied_buckets", occupiedBuckets());
        stats.put("signal_ready", totalSamples >= minSamplesBeforeSignal);
        return stats;
    }
}
