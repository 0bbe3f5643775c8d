package com.finops.anomaly.engine;

import com.finops.anomaly.config.AnomalyProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.ToIntFunction;

/**
 * Owner of all model state.
 *
 * Lifecycle: a {@link MetricModelSet} is created on the first sample for its metric key and a
 * {@link FatigueModel} on the first usage of its pattern. State is only cleared through
 * {@link #reset}, which clears in place under each entry's lock. Nothing is evicted implicitly.
 */
@Component
public class ModelStateStore {

    private static final Logger log = LoggerFactory.getLogger(ModelStateStore.class);

    private final ConcurrentHashMap<MetricKey, MetricModelSet> metricModels = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, FatigueModel> fatigueModels = new ConcurrentHashMap<>();
    private final AnomalyProperties.Models config;
    private final ZoneId zone;

    public ModelStateStore(AnomalyProperties properties) {
        this.config = properties.getModels();
        this.zone = ZoneId.of(config.getTimeZone());
    }

    public MetricModelSet forMetric(MetricKey key, int windowSize) {
        return metricModels.computeIfAbsent(key, k -> {
            log.debug("Creating model state for {}", k);
            return new MetricModelSet(k, windowSize, zone, config.getSeasonalMinSamples());
        });
    }

    public FatigueModel forPattern(String patternId) {
        return fatigueModels.computeIfAbsent(patternId, p -> {
            log.debug("Creating fatigue state for pattern {}", p);
            return new FatigueModel(p, config.getFatigueIncrementPerUse(), config.getFatigueDecayBucket());
        });
    }

    /**
     * Clears the given model kinds for every key. Statistical buffers are re-sized to the
     * window size currently configured for their metric.
     *
     * @return number of keys whose state was cleared
     */
    public int reset(Set<ModelKind> kinds, ToIntFunction<String> windowSizeForMetric) {
        int cleared = 0;
        if (kinds.contains(ModelKind.STATISTICAL) || kinds.contains(ModelKind.TREND)
                || kinds.contains(ModelKind.SEASONAL)) {
            for (MetricModelSet set : metricModels.values()) {
                set.reset(kinds, windowSizeForMetric.applyAsInt(set.getKey().getMetricName()));
                cleared++;
            }
        }
        if (kinds.contains(ModelKind.FATIGUE)) {
            for (FatigueModel model : fatigueModels.values()) {
                synchronized (model) {
                    model.reset();
                }
                cleared++;
            }
        }
        log.info("Reset models {} across {} keys", kinds, cleared);
        return cleared;
    }

    public Map<String, Object> stats() {
        Map<String, Object> byKind = new LinkedHashMap<>();
        Map<String, Object> statistical = new TreeMap<>();
        Map<String, Object> trend = new TreeMap<>();
        Map<String, Object> seasonal = new TreeMap<>();
        for (MetricModelSet set : metricModels.values()) {
            Map<ModelKind, Map<String, Object>> stats = set.stats();
            String key = set.getKey().toString();
            statistical.put(key, stats.get(ModelKind.STATISTICAL));
            trend.put(key, stats.get(ModelKind.TREND));
            seasonal.put(key, stats.get(ModelKind.SEASONAL));
        }
        Map<String, Object> fatigue = new TreeMap<>();
        for (FatigueModel model : fatigueModels.values()) {
            synchronized (model) {
                fatigue.put(model.getPatternId(), model.stats());
            }
        }
        byKind.put(ModelKind.STATISTICAL.wireName(), statistical);
        byKind.put(ModelKind.TREND.wireName(), trend);
        byKind.put(ModelKind.SEASONAL.wireName(), seasonal);
        byKind.put(ModelKind.FATIGUE.wireName(), fatigue);
        return byKind;
    }

    public int metricKeyCount() {
        return metricModels.size();
    }

    public int patternCount() {
        return fatigueModels.size();
    }
}
