package com.finops.anomaly.service;

import com.finops.anomaly.config.MetricsConfig;
import com.finops.anomaly.engine.AnomalyDetector;
import com.finops.anomaly.engine.Evaluation;
import com.finops.anomaly.engine.ModelKind;
import com.finops.anomaly.engine.ModelStateStore;
import com.finops.anomaly.exception.ValidationException;
import com.finops.anomaly.model.AnomalyEvent;
import com.finops.anomaly.model.DetectRequest;
import com.finops.anomaly.model.DetectResponse;
import com.finops.anomaly.model.MetricKind;
import com.finops.anomaly.model.MetricSample;
import com.finops.anomaly.model.Severity;
import com.finops.anomaly.repository.AnomalyEventSink;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Entry point for metric detection requests.
 *
 * Flow:
 * 1. Validate the request and turn each metric field into a sample
 * 2. Evaluate every sample against its models and severity rules
 * 3. Record each event in the event sink and in metrics
 * 4. Hand warning / critical events to automatic alerting (async, when enabled)
 */
@Service
public class AnomalyDetectionService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetectionService.class);

    private final AnomalyDetector detector;
    private final ModelStateStore stateStore;
    private final ThresholdRegistry thresholdRegistry;
    private final AnomalyEventSink eventSink;
    private final AutoAlertService autoAlertService;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public AnomalyDetectionService(AnomalyDetector detector,
                                   ModelStateStore stateStore,
                                   ThresholdRegistry thresholdRegistry,
                                   AnomalyEventSink eventSink,
                                   AutoAlertService autoAlertService,
                                   MetricsConfig metricsConfig,
                                   Clock clock) {
        this.detector = detector;
        this.stateStore = stateStore;
        this.thresholdRegistry = thresholdRegistry;
        this.eventSink = eventSink;
        this.autoAlertService = autoAlertService;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    @Observed(name = "anomaly.detect", contextualName = "detect-anomalies")
    public DetectResponse detect(DetectRequest request) {
        // All samples are validated before any model is touched
        List<MetricSample> samples = toSamples(request);

        List<AnomalyEvent> anomalies = new ArrayList<>();
        List<String> modelsUpdated = new ArrayList<>();
        for (MetricSample sample : samples) {
            Evaluation evaluation = detector.evaluate(sample);
            metricsConfig.recordSampleEvaluated(sample.getMetricName());
            anomalies.addAll(evaluation.getEvents());
            modelsUpdated.addAll(evaluation.getModelsUpdated());
        }
        metricsConfig.updateTrackedModelKeys(stateStore.metricKeyCount() + stateStore.patternCount());

        for (AnomalyEvent event : anomalies) {
            metricsConfig.recordAnomaly(event.getMetricName(), event.getSeverity().wireName(), event.getConfidence());
            eventSink.record(event, request.getEntityId());
            if (event.getSeverity().isAtLeast(Severity.WARNING)) {
                log.warn("Anomaly detected: metric={}, entity={}, severity={}, current={}, baseline={}, confidence={}",
                        event.getMetricName(), request.getEntityId(), event.getSeverity().wireName(),
                        event.getCurrentValue(), event.getBaselineValue(), event.getConfidence());
            }
        }

        if (!anomalies.isEmpty()) {
            autoAlertService.alertAsync(anomalies, request.getEntityId());
        }

        return DetectResponse.builder()
                .anomaliesDetected(anomalies.size())
                .anomalies(anomalies)
                .modelsUpdated(modelsUpdated)
                .build();
    }

    /**
     * Clears model state of the given kinds ("all" or a single kind). Thresholds are untouched.
     *
     * @return number of model keys cleared
     */
    public int resetModels(List<String> kinds) {
        if (kinds == null || kinds.isEmpty()) {
            throw new ValidationException("models must name at least one model kind", "models");
        }
        Set<ModelKind> parsed = ModelKind.parseAll(kinds);
        int cleared = stateStore.reset(parsed, metric -> thresholdRegistry.get(metric).getWindowSize());
        metricsConfig.updateTrackedModelKeys(stateStore.metricKeyCount() + stateStore.patternCount());
        return cleared;
    }

    public Map<String, Object> modelStats() {
        return stateStore.stats();
    }

    private List<MetricSample> toSamples(DetectRequest request) {
        if (request == null) {
            throw new ValidationException("request body is required", "body");
        }
        Instant at = request.getTimestamp() != null ? Instant.ofEpochMilli(request.getTimestamp()) : clock.instant();
        String entityId = request.getEntityId();

        List<MetricSample> samples = new ArrayList<>();
        addSample(samples, MetricKind.COST_PER_POST, request.getCostPerPost(), null, entityId, at);
        addSample(samples, MetricKind.VIRAL_COEFFICIENT, request.getViralCoefficient(), null, entityId, at);
        addSample(samples, MetricKind.ENGAGEMENT_RATE, request.getEngagementRate(), null, entityId, at);

        String patternName = request.getPatternName();
        boolean hasPattern = patternName != null && !patternName.isBlank();
        if (request.getPatternUsageCount() != null && !hasPattern) {
            throw new ValidationException("pattern_name is required with pattern_usage_count", "pattern_name");
        }
        if (hasPattern) {
            // A pattern reported without a count counts as one use
            double usage = request.getPatternUsageCount() != null ? request.getPatternUsageCount() : 1.0;
            addSample(samples, MetricKind.PATTERN_FATIGUE, usage, patternName, entityId, at);
        }

        if (samples.isEmpty()) {
            throw new ValidationException(
                    "at least one of cost_per_post, viral_coefficient, engagement_rate, pattern_name is required",
                    "body");
        }
        return samples;
    }

    private static void addSample(List<MetricSample> samples, MetricKind kind, Double value, String patternId,
                                  String entityId, Instant at) {
        if (value == null) {
            return;
        }
        String field = kind == MetricKind.PATTERN_FATIGUE ? "pattern_usage_count" : kind.getMetricName();
        if (!Double.isFinite(value) || value < 0) {
            throw new ValidationException(field + " must be a finite number >= 0", field);
        }
        samples.add(MetricSample.builder()
                .metricName(kind.getMetricName())
                .value(value)
                .entityId(entityId)
                .patternId(patternId)
                .timestamp(at)
                .build());
    }
}
