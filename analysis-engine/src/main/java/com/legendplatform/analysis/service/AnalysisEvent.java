package com.legendplatform.analysis.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.legendplatform.common.model.AnalysisResult;
import com.legendplatform.common.model.EngineProgress;

/**
 * Element of a streamed analysis: any number of {@code PROGRESS} events followed by
 * exactly one {@code COMPLETED} event carrying the full result.
 */
public record AnalysisEvent(
    @JsonProperty("type")     Type type,
    @JsonProperty("progress") EngineProgress progress,
    @JsonProperty("result")   AnalysisResult result
) {
    public enum Type { PROGRESS, COMPLETED }

    public static AnalysisEvent progress(EngineProgress progress) {
        return new AnalysisEvent(Type.PROGRESS, progress, null);
    }

    public static AnalysisEvent completed(AnalysisResult result) {
        return new AnalysisEvent(Type.COMPLETED, null, result);
    }
}
