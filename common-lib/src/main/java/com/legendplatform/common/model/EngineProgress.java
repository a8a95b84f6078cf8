package com.legendplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Progress update emitted by an engine while it runs.
 *
 * @param engineName engine reporting progress
 * @param stage      free-form stage label, e.g. {@code fetch}, {@code compute}, {@code score}
 * @param percent    completion in [0, 100]
 * @param note       optional human-readable note, may be {@code null}
 */
public record EngineProgress(
    @JsonProperty("engineName") String engineName,
    @JsonProperty("stage")      String stage,
    @JsonProperty("percent")    double percent,
    @JsonProperty("note")       String note
) {
    public EngineProgress {
        if (Double.isNaN(percent) || percent < 0.0 || percent > 100.0) {
            throw new IllegalArgumentException("percent must be within [0, 100], got " + percent);
        }
    }

    public static EngineProgress of(String engineName, String stage, double percent, String note) {
        return new EngineProgress(engineName, stage, percent, note);
    }
}
