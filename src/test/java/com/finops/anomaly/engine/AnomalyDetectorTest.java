package com.finops.anomaly.engine;

import com.finops.anomaly.config.AnomalyProperties;
import com.finops.anomaly.exception.ValidationException;
import com.finops.anomaly.model.AnomalyEvent;
import com.finops.anomaly.model.Severity;
import com.finops.anomaly.service.ThresholdRegistry;
import io.micrometer.tracing.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;

import static com.finops.anomaly.testutil.TestDataFactory.MONDAY_10AM;
import static com.finops.anomaly.testutil.TestDataFactory.patternUsage;
import static com.finops.anomaly.testutil.TestDataFactory.sample;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class AnomalyDetectorTest {

    private ThresholdRegistry registry;
    private ModelStateStore stateStore;
    private AnomalyDetector detector;

    @BeforeEach
    void setUp() {
        AnomalyProperties properties = new AnomalyProperties();
        registry = new ThresholdRegistry(properties);
        registry.init();
        stateStore = new ModelStateStore(properties);
        detector = new AnomalyDetector(registry, stateStore, Tracer.NOOP,
                Clock.fixed(MONDAY_10AM, ZoneOffset.UTC));
    }

    @Test
    void cost_at125Percent_isSingleWarningWithConfidence06() {
        List<AnomalyEvent> events = detector.evaluate(sample("cost_per_post", 0.025, MONDAY_10AM)).getEvents();

        assertThat(events).hasSize(1);
        AnomalyEvent event = events.get(0);
        assertThat(event.getSeverity()).isEqualTo(Severity.WARNING);
        assertThat(event.getConfidence()).isEqualTo(0.6);
        assertThat(event.getBaselineValue()).isEqualTo(0.02);
        assertThat(event.getContext()).containsEntry("detector", "cost_rule");
        assertThat(event.getDetectedAt()).isEqualTo(MONDAY_10AM);
    }

    @Test
    void cost_atBaseline_noEvent() {
        assertThat(detector.evaluate(sample("cost_per_post", 0.02, MONDAY_10AM)).getEvents()).isEmpty();
    }

    @Test
    void cost_at150And200Percent() {
        AnomalyEvent elevated = detector.evaluate(sample("cost_per_post", 0.03, "a", MONDAY_10AM)).getEvents().get(0);
        assertThat(elevated.getSeverity()).isEqualTo(Severity.WARNING);
        assertThat(elevated.getConfidence()).isEqualTo(0.8);

        AnomalyEvent critical = detector.evaluate(sample("cost_per_post", 0.04, "b", MONDAY_10AM)).getEvents().get(0);
        assertThat(critical.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(critical.getConfidence()).isEqualTo(0.9);
    }

    @Test
    void viral_dropTiers() {
        assertThat(detector.evaluate(sample("viral_coefficient", 0.9, "a", MONDAY_10AM)).getEvents()).isEmpty();

        AnomalyEvent warning = detector.evaluate(sample("viral_coefficient", 0.7, "b", MONDAY_10AM)).getEvents().get(0);
        assertThat(warning.getSeverity()).isEqualTo(Severity.WARNING);
        assertThat(warning.getContext()).containsEntry("detector", "viral_drop_rule");

        AnomalyEvent critical = detector.evaluate(sample("viral_coefficient", 0.4, "c", MONDAY_10AM)).getEvents().get(0);
        assertThat(critical.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(critical.getConfidence()).isEqualTo(0.85);
    }

    @Test
    void viral_zeroBaseline_noEvent() {
        registry.set("viral_coefficient", Map.<String, Object>of("baseline", 0.0));

        assertThat(detector.evaluate(sample("viral_coefficient", 0.1, MONDAY_10AM)).getEvents()).isEmpty();
    }

    @Test
    void fatigue_tiersFromPatternUsage() {
        AnomalyEvent warning = detector.evaluate(patternUsage("hot_take", 8, MONDAY_10AM)).getEvents().get(0);
        assertThat(warning.getSeverity()).isEqualTo(Severity.WARNING);
        assertThat(warning.getConfidence()).isEqualTo(0.75);
        assertThat(warning.getContext()).containsEntry("pattern_name", "hot_take");

        AnomalyEvent critical = detector.evaluate(patternUsage("listicle", 9.5, MONDAY_10AM)).getEvents().get(0);
        assertThat(critical.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(critical.getCurrentValue()).isCloseTo(0.95, within(1e-9));
    }

    @Test
    void fatigue_belowThreshold_updatesModelOnly() {
        Evaluation evaluation = detector.evaluate(patternUsage("hot_take", 2, MONDAY_10AM));

        assertThat(evaluation.getEvents()).isEmpty();
        assertThat(evaluation.getModelsUpdated()).containsExactly("fatigue:hot_take");
    }

    @Test
    void spikeAfterStableHistory_triggersRuleStatisticalAndTrend() {
        for (int day = 0; day < 20; day++) {
            Evaluation history = detector.evaluate(sample("cost_per_post", 0.02, MONDAY_10AM.plus(Duration.ofDays(day))));
            assertThat(history.getEvents()).isEmpty();
        }

        List<AnomalyEvent> events = detector.evaluate(
                sample("cost_per_post", 0.06, MONDAY_10AM.plus(Duration.ofDays(20)))).getEvents();

        Map<Object, Severity> byDetector = events.stream()
                .collect(Collectors.toMap(e -> e.getContext().get("detector"), AnomalyEvent::getSeverity));
        assertThat(byDetector).containsOnlyKeys("cost_rule", "statistical", "trend");
        assertThat(byDetector.get("cost_rule")).isEqualTo(Severity.CRITICAL);
        // sqrt(20) standard deviations, above twice the z threshold
        assertThat(byDetector.get("statistical")).isEqualTo(Severity.WARNING);
        assertThat(byDetector.get("trend")).isEqualTo(Severity.INFO);
    }

    @Test
    void modelsUpdated_namesEveryModelOfTheKey() {
        Evaluation evaluation = detector.evaluate(sample("engagement_rate", 0.05, "ai_jesus", MONDAY_10AM));

        assertThat(evaluation.getModelsUpdated()).containsExactly(
                "statistical:engagement_rate@ai_jesus",
                "trend:engagement_rate@ai_jesus",
                "seasonal:engagement_rate@ai_jesus");
    }

    @Test
    void concurrentEvaluationsOfSameKey_loseAndDuplicateNothing() throws Exception {
        registry.set("engagement_rate", Map.<String, Object>of("window_size", 1000));
        int threads = 8;
        int perThread = 50;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch startGate = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                int base = t * perThread;
                futures.add(pool.submit(() -> {
                    startGate.await();
                    for (int i = 0; i < perThread; i++) {
                        detector.evaluate(sample("engagement_rate", base + i, MONDAY_10AM));
                    }
                    return null;
                }));
            }
            startGate.countDown();
            for (Future<?> f : futures) {
                f.get();
            }
        } finally {
            pool.shutdownNow();
        }

        double[] values = stateStore.forMetric(MetricKey.of("engagement_rate", null), 1000).statisticalValues();
        Arrays.sort(values);
        assertThat(values).hasSize(threads * perThread);
        for (int i = 0; i < values.length; i++) {
            assertThat(values[i]).isEqualTo(i);
        }
    }

    @Test
    void differentEntities_haveIndependentState() {
        detector.evaluate(sample("engagement_rate", 0.05, "a", MONDAY_10AM));
        detector.evaluate(sample("engagement_rate", 0.05, "b", MONDAY_10AM));

        assertThat(stateStore.metricKeyCount()).isEqualTo(2);
    }

    @Test
    void negativeValue_isRejected() {
        assertThatThrownBy(() -> detector.evaluate(sample("cost_per_post", -1, MONDAY_10AM)))
                .isInstanceOf(ValidationException.class);
        assertThat(stateStore.metricKeyCount()).isZero();
    }

    @Test
    void patternUsageWithoutPattern_isRejected() {
        assertThatThrownBy(() -> detector.evaluate(sample("pattern_fatigue", 1, MONDAY_10AM)))
                .isInstanceOf(ValidationException.class)
                .extracting(e -> ((ValidationException) e).getField())
                .isEqualTo("pattern_name");
    }

    @Test
    void sampleWithoutTimestamp_usesClock() {
        Evaluation evaluation = detector.evaluate(sample("cost_per_post", 0.05, (Instant) null));

        assertThat(evaluation.getEvents().get(0).getContext()).containsEntry("sample_time", MONDAY_10AM.toString());
    }
}
