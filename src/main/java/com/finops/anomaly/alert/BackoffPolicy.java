package com.finops.anomaly.alert;

import java.time.Duration;

/**
 * Delay between delivery attempts of one channel.
 */
public interface BackoffPolicy {

    /**
     * @param failedAttempt 0-based index of the attempt that just failed
     */
    Duration delayAfter(int failedAttempt);
}
