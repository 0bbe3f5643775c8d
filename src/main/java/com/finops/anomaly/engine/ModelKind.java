package com.finops.anomaly.engine;

import com.finops.anomaly.exception.ValidationException;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;

public enum ModelKind {
    STATISTICAL,
    TREND,
    SEASONAL,
    FATIGUE;

    public String wireName() {
        return name().toLowerCase();
    }

    /**
     * Parses a model kind name; {@code "all"} expands to every kind.
     */
    public static Set<ModelKind> parse(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("model kind must not be blank", "models");
        }
        if ("all".equalsIgnoreCase(value.trim())) {
            return EnumSet.allOf(ModelKind.class);
        }
        for (ModelKind kind : values()) {
            if (kind.name().equalsIgnoreCase(value.trim())) {
                return EnumSet.of(kind);
            }
        }
        throw new ValidationException("Unknown model kind: " + value, "models");
    }

    /**
     * Union of several kind names. Every name is checked before anything is returned.
     */
    public static Set<ModelKind> parseAll(Collection<String> values) {
        Set<ModelKind> kinds = EnumSet.noneOf(ModelKind.class);
        for (String value : values) {
            kinds.addAll(parse(value));
        }
        return kinds;
    }
}
