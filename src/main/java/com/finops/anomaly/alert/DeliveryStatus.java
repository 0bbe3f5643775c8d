package com.finops.anomaly.alert;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DeliveryStatus {
    SUCCESS,
    FAILED,
    SKIPPED,
    TIMED_OUT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
