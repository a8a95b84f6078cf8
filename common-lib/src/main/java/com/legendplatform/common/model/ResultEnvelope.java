package com.legendplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Standard output of one engine run.
 *
 * <p>{@code facts} is schema-less: each engine publishes whatever fact names it computes.
 * The map is copied on construction and exposed read-only, preserving the engine's key order.
 */
public record ResultEnvelope(
    @JsonProperty("engineName") String engineName,
    @JsonProperty("timeframe")  String timeframe,
    @JsonProperty("asOf")       Instant asOf,
    @JsonProperty("facts")      Map<String, Object> facts,
    @JsonProperty("quality")    QualityMeta quality
) {
    public ResultEnvelope {
        Objects.requireNonNull(engineName, "engineName");
        facts   = facts == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(facts));
        quality = quality == null ? QualityMeta.unknown() : quality;
    }

    public static ResultEnvelope of(String engineName, AnalysisRequest request,
                                    Map<String, Object> facts, QualityMeta quality) {
        return new ResultEnvelope(engineName, request.timeframe(), request.asOf(), facts, quality);
    }

    public Object fact(String name) {
        return facts.get(name);
    }
}
