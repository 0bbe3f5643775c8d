package com.finops.anomaly.engine;

import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * 24 hour-of-day buckets. Buckets wrap daily, so the lookback is implicitly 24 hours.
 */
public class TrendModel extends BucketedAverageModel {

    public static final int BUCKETS = 24;

    public TrendModel(ZoneId zone) {
        super(BUCKETS, zone, 0);
    }

    @Override
    public ModelKind kind() {
        return ModelKind.TREND;
    }

    @Override
    protected int bucketIndex(ZonedDateTime time) {
        return time.getHour();
    }
}
