package com.finops.anomaly.alert;

import java.time.Duration;

/**
 * {@code base * 2^attempt}, capped at {@code max}. With a one second base: 1s, 2s, 4s ...
 */
public class ExponentialBackoffPolicy implements BackoffPolicy {

    private final long baseMillis;
    private final long maxMillis;

    public ExponentialBackoffPolicy(Duration base, Duration max) {
        this.baseMillis = Math.max(0, base.toMillis());
        this.maxMillis = Math.max(baseMillis, max.toMillis());
    }

    @Override
    public Duration delayAfter(int failedAttempt) {
        double pow = Math.pow(2.0, Math.max(0, failedAttempt));
        long ideal = (long) Math.min((double) Long.MAX_VALUE, baseMillis * pow);
        return Duration.ofMillis(Math.min(ideal, maxMillis));
    }
}
