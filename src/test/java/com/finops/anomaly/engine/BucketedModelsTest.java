package com.finops.anomaly.engine;

import com.finops.anomaly.model.ThresholdConfig;
import com.finops.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class BucketedModelsTest {

    private final ThresholdConfig config = TestDataFactory.defaults("engagement_rate");
    private final Instant monday10 = TestDataFactory.MONDAY_10AM;

    @Test
    void trend_firstSampleInBucket_isInsufficientData() {
        TrendModel model = new TrendModel(ZoneOffset.UTC);
        ModelReading reading = model.addSample(1.0, monday10, config);

        assertThat(reading.isSufficientData()).isFalse();
        assertThat(model.bucketCount(10)).isEqualTo(1);
    }

    @Test
    void trend_comparesAgainstPreUpdateAverage() {
        TrendModel model = new TrendModel(ZoneOffset.UTC);
        model.addSample(1.0, monday10, config);
        model.addSample(1.0, monday10.plus(Duration.ofDays(1)), config);

        // Same hour next day; pre-update average is 1.0
        ModelReading reading = model.addSample(2.0, monday10.plus(Duration.ofDays(2)), config);

        assertThat(reading.getBaseline()).isCloseTo(1.0, within(1e-9));
        assertThat(reading.getScore()).isCloseTo(1.0, within(1e-9));
        assertThat(model.isAnomaly(reading, config)).isTrue();
        assertThat(model.bucketAverage(10)).isCloseTo(4.0 / 3.0, within(1e-9));
    }

    @Test
    void trend_otherHoursAreIndependent() {
        TrendModel model = new TrendModel(ZoneOffset.UTC);
        model.addSample(1.0, monday10, config);

        ModelReading reading = model.addSample(50.0, monday10.plus(Duration.ofHours(1)), config);

        assertThat(reading.isSufficientData()).isFalse();
        assertThat(model.occupiedBuckets()).isEqualTo(2);
    }

    @Test
    void trend_deviationAtThreshold_isNotABreak() {
        TrendModel model = new TrendModel(ZoneOffset.UTC);
        model.addSample(1.0, monday10, config);
        ModelReading reading = model.addSample(1.5, monday10.plus(Duration.ofDays(1)), config);

        assertThat(reading.getScore()).isCloseTo(0.5, within(1e-9));
        assertThat(model.isAnomaly(reading, config)).isFalse();
    }

    @Test
    void seasonal_silentUntilFullWeeklyCycle() {
        SeasonalModel model = new SeasonalModel(ZoneOffset.UTC);
        Instant t = monday10;
        for (int i = 0; i < SeasonalModel.BUCKETS; i++) {
            ModelReading reading = model.addSample(1.0, t, config);
            assertThat(reading.isSufficientData()).isFalse();
            t = t.plus(Duration.ofHours(1));
        }
        assertThat(model.occupiedBuckets()).isEqualTo(SeasonalModel.BUCKETS);

        // One week later, same slot as the first sample
        ModelReading reading = model.addSample(3.0, t, config);
        assertThat(reading.isSufficientData()).isTrue();
        assertThat(reading.getScore()).isCloseTo(2.0, within(1e-9));
        assertThat(model.isAnomaly(reading, config)).isTrue();
    }

    @Test
    void seasonal_bucketIsDayOfWeekTimesHour() {
        SeasonalModel model = new SeasonalModel(ZoneOffset.UTC);

        assertThat(model.bucketOf(Instant.parse("2025-01-06T00:00:00Z"))).isEqualTo(0);
        assertThat(model.bucketOf(monday10)).isEqualTo(10);
        assertThat(model.bucketOf(Instant.parse("2025-01-12T23:30:00Z"))).isEqualTo(167);
    }

    @Test
    void reset_clearsBuckets() {
        TrendModel model = new TrendModel(ZoneOffset.UTC);
        model.addSample(1.0, monday10, config);

        model.reset();

        assertThat(model.totalSamples()).isZero();
        assertThat(model.occupiedBuckets()).isZero();
    }
}
