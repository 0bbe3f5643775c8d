package com.finops.anomaly.engine;

import com.finops.anomaly.exception.ValidationException;
import com.finops.anomaly.model.AnomalyEvent;
import com.finops.anomaly.model.MetricKind;
import com.finops.anomaly.model.MetricSample;
import com.finops.anomaly.model.ThresholdConfig;
import com.finops.anomaly.service.ThresholdRegistry;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs a sample through the models owned by its metric key and the business severity rules.
 *
 * For one sample the owning model state is updated exactly once, before any rule reads it.
 * A sample may produce several events: the business rule and each model report independently.
 */
@Component
public class AnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetector.class);

    private final ThresholdRegistry thresholdRegistry;
    private final ModelStateStore stateStore;
    private final Tracer tracer;
    private final Clock clock;

    public AnomalyDetector(ThresholdRegistry thresholdRegistry, ModelStateStore stateStore,
                           Tracer tracer, Clock clock) {
        this.thresholdRegistry = thresholdRegistry;
        this.stateStore = stateStore;
        this.tracer = tracer;
        this.clock = clock;
    }

    public Evaluation evaluate(MetricSample sample) {
        validate(sample);
        ThresholdConfig config = thresholdRegistry.get(sample.getMetricName());
        Instant at = sample.getTimestamp() != null ? sample.getTimestamp() : clock.instant();

        Span span = tracer.nextSpan()
                .name("anomaly.evaluate")
                .tag("metric.name", sample.getMetricName())
                .start();

        try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
            Evaluation evaluation = MetricKind.fromMetricName(sample.getMetricName()) == MetricKind.PATTERN_FATIGUE
                    ? evaluateFatigue(sample, at, config)
                    : evaluateMetric(sample, at, config);
            span.tag("anomaly.count", String.valueOf(evaluation.getEvents().size()));
            return evaluation;
        } catch (RuntimeException e) {
            span.error(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private Evaluation evaluateMetric(MetricSample sample, Instant at, ThresholdConfig config) {
        MetricKey key = MetricKey.of(sample.getMetricName(), sample.getEntityId());
        MetricModelSet models = stateStore.forMetric(key, config.getWindowSize());
        List<MetricModelSet.Observation> observations = models.observe(sample.getValue(), at, config);

        List<AnomalyEvent> events = new ArrayList<>();
        List<String> updated = new ArrayList<>();

        businessRule(sample, config).ifPresent(finding -> events.add(event(sample, at, config.getBaseline(), finding)
                .contextEntry("detector", ruleName(sample.getMetricName()))
                .contextEntry("ratio_to_baseline", finding.getRatio())
                .build()));

        for (MetricModelSet.Observation obs : observations) {
            updated.add(obs.getKind().wireName() + ":" + key);
            ModelReading reading = obs.getReading();
            if (!reading.isSufficientData()) {
                log.debug("{} model for {} has insufficient data", obs.getKind().wireName(), key);
                continue;
            }
            if (!obs.isAnomalous()) {
                continue;
            }
            SeverityRules.Finding finding = obs.getKind() == ModelKind.STATISTICAL
                    ? SeverityRules.outlier(reading.getScore(), config)
                    : SeverityRules.bucketBreak(reading.getScore(), config);
            events.add(event(sample, at, reading.getBaseline(), finding)
                    .contextEntry("detector", obs.getKind().wireName())
                    .contextEntry(obs.getKind() == ModelKind.STATISTICAL ? "z_score" : "deviation_pct",
                            reading.getScore())
                    .build());
        }
        return new Evaluation(events, updated);
    }

    private Evaluation evaluateFatigue(MetricSample sample, Instant at, ThresholdConfig config) {
        FatigueModel model = stateStore.forPattern(sample.getPatternId());
        ModelReading reading;
        boolean fatigued;
        synchronized (model) {
            reading = model.addSample(sample.getValue(), at, config);
            fatigued = model.isAnomaly(reading, config);
        }

        List<AnomalyEvent> events = new ArrayList<>(1);
        if (fatigued) {
            SeverityRules.fatigue(reading.getScore(), config).ifPresent(finding ->
                    events.add(event(sample, at, config.getWarningPct(), finding)
                            .currentValue(reading.getScore())
                            .contextEntry("detector", ModelKind.FATIGUE.wireName())
                            .contextEntry("pattern_name", sample.getPatternId())
                            .contextEntry("usage_count", sample.getValue())
                            .build()));
        }
        return new Evaluation(events, List.of(ModelKind.FATIGUE.wireName() + ":" + sample.getPatternId()));
    }

    private Optional<SeverityRules.Finding> businessRule(MetricSample sample, ThresholdConfig config) {
        switch (MetricKind.fromMetricName(sample.getMetricName())) {
            case COST_PER_POST:
                return SeverityRules.cost(sample.getValue(), config);
            case VIRAL_COEFFICIENT:
                return SeverityRules.viralDrop(sample.getValue(), config);
            default:
                return Optional.empty();
        }
    }

    private static String ruleName(String metricName) {
        return MetricKind.fromMetricName(metricName) == MetricKind.COST_PER_POST ? "cost_rule" : "viral_drop_rule";
    }

    private AnomalyEvent.AnomalyEventBuilder event(MetricSample sample, Instant at, double baseline,
                                                   SeverityRules.Finding finding) {
        AnomalyEvent.AnomalyEventBuilder builder = AnomalyEvent.builder()
                .metricName(sample.getMetricName())
                .currentValue(sample.getValue())
                .baselineValue(baseline)
                .severity(finding.getSeverity())
                .confidence(finding.getConfidence())
                .detectedAt(clock.instant())
                .contextEntry("sample_time", at.toString());
        if (sample.getEntityId() != null) {
            builder.contextEntry("entity_id", sample.getEntityId());
        }
        return builder;
    }

    private static void validate(MetricSample sample) {
        if (sample == null || sample.getMetricName() == null || sample.getMetricName().isBlank()) {
            throw new ValidationException("metric_name is required", "metric_name");
        }
        if (!Double.isFinite(sample.getValue())) {
            throw new ValidationException(sample.getMetricName() + " must be a finite number", sample.getMetricName());
        }
        if (sample.getValue() < 0) {
            throw new ValidationException(sample.getMetricName() + " must be >= 0", sample.getMetricName());
        }
        if (MetricKind.fromMetricName(sample.getMetricName()) == MetricKind.PATTERN_FATIGUE
                && (sample.getPatternId() == null || sample.getPatternId().isBlank())) {
            throw new ValidationException("pattern_name is required with pattern usage", "pattern_name");
        }
    }
}
