package com.finops.anomaly.engine;

import com.finops.anomaly.model.ThresholdConfig;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fixed-capacity circular buffer of recent values with z-score deviation detection.
 * The oldest value is evicted on overflow, so memory is bounded by the capacity.
 */
public class RollingStatisticalModel implements DetectionModel {

    public static final int DEFAULT_CAPACITY = 100;

    private double[] buffer;
    private int next;
    private int size;
    private long totalSamples;

    public RollingStatisticalModel(int capacity) {
        if (capacity < 2) {
            throw new IllegalArgumentException("capacity must be >= 2");
        }
        this.buffer = new double[capacity];
    }

    @Override
    public ModelKind kind() {
        return ModelKind.STATISTICAL;
    }

    @Override
    public ModelReading addSample(double value, Instant at, ThresholdConfig config) {
        add(value);
        return score(value, at, config);
    }

    void add(double value) {
        buffer[next] = value;
        next = (next + 1) % buffer.length;
        if (size < buffer.length) {
            size++;
        }
        totalSamples++;
    }

    @Override
    public ModelReading score(double value, Instant at, ThresholdConfig config) {
        if (size < 2) {
            return ModelReading.insufficientData();
        }
        double mean = mean();
        double stddev = stddev(mean);
        if (stddev == 0.0) {
            return ModelReading.of(0.0, mean);
        }
        return ModelReading.of(Math.abs(value - mean) / stddev, mean);
    }

    @Override
    public boolean isAnomaly(ModelReading reading, ThresholdConfig config) {
        return reading.isSufficientData() && reading.getScore() > config.getOutlierZScore();
    }

    @Override
    public void reset() {
        next = 0;
        size = 0;
        totalSamples = 0;
    }

    /**
     * Clears the buffer and resizes it to a new capacity.
     */
    public void reset(int capacity) {
        if (capacity < 2) {
            throw new IllegalArgumentException("capacity must be >= 2");
        }
        buffer = new double[capacity];
        reset();
    }

    public int size() {
        return size;
    }

    public int capacity() {
        return buffer.length;
    }

    /**
     * Buffered values, oldest first.
     */
    public double[] values() {
        double[] out = new double[size];
        int start = size < buffer.length ? 0 : next;
        for (int i = 0; i < size; i++) {
            out[i] = buffer[(start + i) % buffer.length];
        }
        return out;
    }

    @Override
    public Map<String, Object> stats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("sample_count", size);
        stats.put("total_samples", totalSamples);
        stats.put("capacity", buffer.length);
        if (size > 0) {
            double mean = mean();
            stats.put("mean", mean);
            stats.put("stddev", stddev(mean));
        }
        return stats;
    }

    private double mean() {
        double sum = 0.0;
        for (int i = 0; i < size; i++) {
            sum += buffer[i];
        }
        return sum / size;
    }

    // Population standard deviation. Exactly zero when every buffered value is equal,
    // even where the floating point mean differs from them in the last bit.
    private double stddev(double mean) {
        double min = buffer[0];
        double max = buffer[0];
        double sumSq = 0.0;
        for (int i = 0; i < size; i++) {
            double v = buffer[i];
            min = Math.min(min, v);
            max = Math.max(max, v);
            double d = v - mean;
            sumSq += d * d;
        }
        if (min == max) {
            return 0.0;
        }
        return Math.sqrt(sumSq / size);
    }
}
