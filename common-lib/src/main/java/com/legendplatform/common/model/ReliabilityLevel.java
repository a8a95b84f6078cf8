package com.legendplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Declared reliability of an engine, ordered from least to most trusted.
 * Each level carries the fixed weight used by consensus aggregation.
 */
public enum ReliabilityLevel {
    EXPERIMENTAL(0.3),
    VARIABLE(0.5),
    MEDIUM(0.7),
    HIGH(1.0);

    private final double weight;

    ReliabilityLevel(double weight) {
        this.weight = weight;
    }

    public double weight() {
        return weight;
    }

    /** True when this level is the same as or more reliable than {@code floor}. */
    public boolean isAtLeast(ReliabilityLevel floor) {
        return floor == null || this.compareTo(floor) >= 0;
    }

    @JsonValue
    public String jsonValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ReliabilityLevel fromValue(String value) {
        if (value == null || value.isBlank()) return null;
        return ReliabilityLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
