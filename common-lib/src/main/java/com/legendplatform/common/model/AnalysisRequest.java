package com.legendplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * One analysis call: which subject, on which timeframe, as of when.
 * Every engine task receives this same immutable value.
 */
public record AnalysisRequest(
    @JsonProperty("symbol")    String symbol,
    @JsonProperty("timeframe") String timeframe,
    @JsonProperty("asOf")      Instant asOf
) {
    public AnalysisRequest {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("symbol must not be blank");
        }
        if (timeframe == null || timeframe.isBlank()) {
            throw new IllegalArgumentException("timeframe must not be blank");
        }
        Objects.requireNonNull(asOf, "asOf");
    }

    public static AnalysisRequest of(String symbol, String timeframe, Instant asOf) {
        return new AnalysisRequest(symbol, timeframe, asOf);
    }

    public static AnalysisRequest now(String symbol, String timeframe) {
        return new AnalysisRequest(symbol, timeframe, Instant.now());
    }
}
