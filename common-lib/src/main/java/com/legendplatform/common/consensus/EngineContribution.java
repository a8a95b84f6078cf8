package com.legendplatform.common.consensus;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.legendplatform.common.model.ReliabilityLevel;

/**
 * What one engine put into a consensus computation.
 *
 * @param score       extracted directional score in [-1, 1]
 * @param signal      per-engine bucket of {@code score}
 * @param confidence  extracted confidence in [0, 1]
 * @param weight      {@code reliability.weight() × confidence}; zero means excluded from the average
 * @param reliability the engine's declared reliability
 * @param signalField fact name the score was read from, {@code null} when nothing was recognized
 */
public record EngineContribution(
    @JsonProperty("score")       double score,
    @JsonProperty("signal")      ConsensusSignal signal,
    @JsonProperty("confidence")  double confidence,
    @JsonProperty("weight")      double weight,
    @JsonProperty("reliability") ReliabilityLevel reliability,
    @JsonProperty("signalField") String signalField
) {
    public boolean included() {
        return weight > 0.0;
    }
}
