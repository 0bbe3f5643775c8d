package com.finops.anomaly.service;

import com.finops.anomaly.config.AnomalyProperties;
import com.finops.anomaly.exception.ValidationException;
import com.finops.anomaly.model.MetricKind;
import com.finops.anomaly.model.ThresholdConfig;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-metric threshold configuration, read on every evaluation.
 *
 * Entries are immutable {@link ThresholdConfig} values created lazily from compiled defaults
 * (plus any overrides from {@code anomaly.thresholds}). Updates merge a partial change into the
 * current entry, validate the result and swap it in with a single map operation, so readers
 * see either the old or the new config and a rejected update leaves the entry untouched.
 * Writers are serialized; reads never block.
 */
@Service
public class ThresholdRegistry {

    private static final Logger log = LoggerFactory.getLogger(ThresholdRegistry.class);

    private final AnomalyProperties properties;
    private final ConcurrentHashMap<String, ThresholdConfig> configs = new ConcurrentHashMap<>();

    public ThresholdRegistry(AnomalyProperties properties) {
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        // Fail fast on bad overrides and make the known metrics visible in GET /thresholds
        for (MetricKind kind : MetricKind.values()) {
            if (kind != MetricKind.GENERIC) {
                get(kind.getMetricName());
            }
        }
        properties.getThresholds().keySet().forEach(this::get);
        log.info("Threshold registry initialized with {} metrics", configs.size());
    }

    public ThresholdConfig get(String metricName) {
        if (metricName == null || metricName.isBlank()) {
            throw new ValidationException("metric_name must not be blank", "metric_name");
        }
        return configs.computeIfAbsent(metricName, this::initialConfig);
    }

    /**
     * Snapshot of every metric that has a config, ordered by name.
     */
    public Map<String, ThresholdConfig> getAll() {
        return Collections.unmodifiableMap(new TreeMap<>(configs));
    }

    /**
     * Applies a partial update to one metric. Keys are ThresholdConfig field names in snake_case.
     *
     * @throws ValidationException if any key is unknown or the merged config breaks an invariant;
     *                             the stored config is unchanged in that case
     */
    public synchronized ThresholdConfig set(String metricName, Map<String, Object> partialUpdate) {
        ThresholdConfig updated = merge(get(metricName), partialUpdate);
        configs.put(metricName, updated);
        log.info("Updated thresholds for {}: {}", metricName, partialUpdate);
        return updated;
    }

    /**
     * Applies updates to several metrics. Every merged config is validated before any is stored,
     * and the validated configs are the ones stored.
     */
    public synchronized Map<String, ThresholdConfig> setAll(Map<String, Map<String, Object>> updates) {
        Map<String, ThresholdConfig> merged = new LinkedHashMap<>();
        for (Map.Entry<String, Map<String, Object>> entry : updates.entrySet()) {
            merged.put(entry.getKey(), merge(get(entry.getKey()), entry.getValue()));
        }
        configs.putAll(merged);
        log.info("Updated thresholds for {}", merged.keySet());
        return merged;
    }

    private ThresholdConfig merge(ThresholdConfig current, Map<String, Object> update) {
        if (update == null || update.isEmpty()) {
            throw new ValidationException("update for " + current.getMetricName() + " is empty",
                    current.getMetricName());
        }
        ThresholdConfig.ThresholdConfigBuilder builder = current.toBuilder();
        for (Map.Entry<String, Object> field : update.entrySet()) {
            String key = field.getKey();
            Object value = field.getValue();
            switch (key) {
                case "baseline" -> builder.baseline(toDouble(key, value));
                case "warning_pct" -> builder.warningPct(toDouble(key, value));
                case "critical_pct" -> builder.criticalPct(toDouble(key, value));
                case "elevated_multiplier" -> builder.elevatedMultiplier(toDouble(key, value));
                case "critical_multiplier" -> builder.criticalMultiplier(toDouble(key, value));
                case "window_size" -> builder.windowSize(toInt(key, value));
                case "outlier_z_score" -> builder.outlierZScore(toDouble(key, value));
                case "trend_deviation_pct" -> builder.trendDeviationPct(toDouble(key, value));
                case "decay_factor" -> builder.decayFactor(toDouble(key, value));
                default -> throw new ValidationException("Unknown threshold field: " + key, key);
            }
        }
        ThresholdConfig merged = builder.build();
        merged.validate();
        return merged;
    }

    private ThresholdConfig initialConfig(String metricName) {
        ThresholdConfig config = compiledDefaults(metricName);
        AnomalyProperties.ThresholdOverride o = properties.getThresholds().get(metricName);
        if (o != null) {
            ThresholdConfig.ThresholdConfigBuilder b = config.toBuilder();
            if (o.getBaseline() != null) b.baseline(o.getBaseline());
            if (o.getWarningPct() != null) b.warningPct(o.getWarningPct());
            if (o.getCriticalPct() != null) b.criticalPct(o.getCriticalPct());
            if (o.getElevatedMultiplier() != null) b.elevatedMultiplier(o.getElevatedMultiplier());
            if (o.getCriticalMultiplier() != null) b.criticalMultiplier(o.getCriticalMultiplier());
            if (o.getWindowSize() != null) b.windowSize(o.getWindowSize());
            if (o.getOutlierZScore() != null) b.outlierZScore(o.getOutlierZScore());
            if (o.getTrendDeviationPct() != null) b.trendDeviationPct(o.getTrendDeviationPct());
            if (o.getDecayFactor() != null) b.decayFactor(o.getDecayFactor());
            config = b.build();
            try {
                config.validate();
            } catch (ValidationException e) {
                throw new IllegalStateException(
                        "Invalid anomaly.thresholds." + metricName + "." + e.getField() + ": " + e.getMessage(), e);
            }
        }
        return config;
    }

    /**
     * Defaults compiled into the service, used when nothing is configured for a metric.
     */
    public static ThresholdConfig compiledDefaults(String metricName) {
        ThresholdConfig.ThresholdConfigBuilder b = ThresholdConfig.builder()
                .metricName(metricName)
                .baseline(0.0)
                .warningPct(0.25)
                .criticalPct(0.5)
                .elevatedMultiplier(1.5)
                .criticalMultiplier(2.0)
                .windowSize(100)
                .outlierZScore(2.0)
                .trendDeviationPct(0.5)
                .decayFactor(0.95);

        switch (MetricKind.fromMetricName(metricName)) {
            case COST_PER_POST -> b.baseline(0.02);
            case VIRAL_COEFFICIENT -> b.baseline(1.0).warningPct(0.70).criticalPct(0.50);
            case ENGAGEMENT_RATE -> b.baseline(0.05);
            case PATTERN_FATIGUE -> b.warningPct(0.8).criticalPct(0.9);
            default -> { }
        }
        return b.build();
    }

    private static double toDouble(String key, Object value) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                throw new ValidationException(key + " must be a number", key);
            }
        }
        throw new ValidationException(key + " must be a number", key);
    }

    private static int toInt(String key, Object value) {
        double d = toDouble(key, value);
        if (d != Math.rint(d) || d > Integer.MAX_VALUE || d < Integer.MIN_VALUE) {
            throw new ValidationException(key + " must be an integer", key);
        }
        return (int) d;
    }
}
