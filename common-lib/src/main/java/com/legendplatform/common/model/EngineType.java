package com.legendplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Engine classification. Used for selecting engines only; it never affects weighting.
 */
public enum EngineType {
    TRADITIONAL,
    SCANNER,
    HYBRID;

    @JsonValue
    public String jsonValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static EngineType fromValue(String value) {
        if (value == null || value.isBlank()) return null;
        return EngineType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
