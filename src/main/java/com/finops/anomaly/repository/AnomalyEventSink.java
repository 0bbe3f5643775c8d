package com.finops.anomaly.repository;

import com.finops.anomaly.model.AnomalyEvent;

/**
 * Write-only history of detected anomalies. Implementations must not throw: a sink failure
 * never fails a detection.
 */
public interface AnomalyEventSink {

    void record(AnomalyEvent event, String entityId);
}
