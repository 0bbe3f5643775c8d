package com.finops.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.finops.anomaly.exception.ValidationException;

/**
 * Severity tier of an anomaly or alert. Ordered from least to most severe.
 */
public enum Severity {
    INFO,
    WARNING,
    CRITICAL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }

    @JsonCreator
    public static Severity fromWireName(String value) {
        if (value == null) {
            throw new ValidationException("severity is required", "severity");
        }
        for (Severity s : values()) {
            if (s.name().equalsIgnoreCase(value.trim())) {
                return s;
            }
        }
        throw new ValidationException("Unknown severity: " + value, "severity");
    }
}
