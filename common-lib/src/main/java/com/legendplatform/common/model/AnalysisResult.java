package com.legendplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.legendplatform.common.consensus.ConsensusResult;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Everything one analysis call produced: the per-engine outcomes in input order,
 * the aggregated consensus (null when consensus was disabled) and timing metadata.
 */
public record AnalysisResult(
    @JsonProperty("request")           AnalysisRequest request,
    @JsonProperty("outcomes")          List<EngineOutcome> outcomes,
    @JsonProperty("consensus")         ConsensusResult consensus,
    @JsonProperty("totalEngines")      int totalEngines,
    @JsonProperty("successfulEngines") int successfulEngines,
    @JsonProperty("startedAt")         Instant startedAt,
    @JsonProperty("completedAt")       Instant completedAt,
    @JsonProperty("executionTimeMs")   long executionTimeMs
) {
    public AnalysisResult {
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
    }

    public static AnalysisResult of(AnalysisRequest request, List<EngineOutcome> outcomes,
                                    ConsensusResult consensus, Instant startedAt, Instant completedAt) {
        int successful = (int) outcomes.stream().filter(EngineOutcome::isSuccess).count();
        return new AnalysisResult(request, outcomes, consensus, outcomes.size(), successful,
                                  startedAt, completedAt, Duration.between(startedAt, completedAt).toMillis());
    }

    /** Successful envelopes only, in the same order as {@link #outcomes()}. */
    @JsonProperty("engineResults")
    public List<ResultEnvelope> engineResults() {
        return outcomes.stream()
            .filter(EngineOutcome::isSuccess)
            .map(EngineOutcome::envelope)
            .toList();
    }
}
