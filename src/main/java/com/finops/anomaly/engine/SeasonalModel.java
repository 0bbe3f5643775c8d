package com.finops.anomaly.engine;

import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * 168 (day-of-week x hour) buckets. Silent until it has seen a full weekly cycle of samples;
 * before that every reading is insufficient data, which suppresses only seasonal findings.
 */
public class SeasonalModel extends BucketedAverageModel {

    public static final int BUCKETS = 7 * 24;

    public SeasonalModel(ZoneId zone, int minSamplesBeforeSignal) {
        super(BUCKETS, zone, minSamplesBeforeSignal);
    }

    public SeasonalModel(ZoneId zone) {
        this(zone, BUCKETS);
    }

    @Override
    public ModelKind kind() {
        return ModelKind.SEASONAL;
    }

    @Override
    protected int bucketIndex(ZonedDateTime time) {
        // Monday = 0
        return (time.getDayOfWeek().getValue() - 1) * 24 + time.getHour();
    }
}
