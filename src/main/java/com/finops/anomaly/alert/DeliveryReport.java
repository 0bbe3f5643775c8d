package com.finops.anomaly.alert;

import lombok.Value;

import java.time.Duration;
import java.util.List;

@Value
public class DeliveryReport {
    String alertId;
    Duration overallElapsed;
    List<DeliveryOutcome> outcomes;
    boolean slaMet;

    public long count(DeliveryStatus status) {
        return outcomes.stream().filter(o -> o.getStatus() == status).count();
    }

    public int successCount() {
        return (int) count(DeliveryStatus.SUCCESS);
    }
}
