package com.legendplatform.common.consensus;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable output of a {@link ConsensusStrategy} run.
 *
 * <p>Fields:
 * <ul>
 *   <li>{@code signal}             : aggregated verdict, {@code INSUFFICIENT_DATA} when no engine carries weight</li>
 *   <li>{@code confidence}         : share of the maximum weight the included engines could carry, [0, 1]</li>
 *   <li>{@code strength}           : {@code |weightedScore|}</li>
 *   <li>{@code quality}            : coarse trust grade</li>
 *   <li>{@code enginesAnalyzed}    : successful, reliability-eligible engines inspected</li>
 *   <li>{@code enginesIncluded}    : subset of those with positive weight</li>
 *   <li>{@code reliabilityAverage} : mean reliability weight of the included engines</li>
 *   <li>{@code weightedScore}      : {@code Σ(score·weight) / Σ(weight)} in [-1, 1]</li>
 *   <li>{@code engineContributions}: engine name → contribution, in outcome order</li>
 * </ul>
 */
public record ConsensusResult(
    @JsonProperty("signal")              ConsensusSignal signal,
    @JsonProperty("confidence")          double confidence,
    @JsonProperty("strength")            double strength,
    @JsonProperty("quality")             ConsensusQuality quality,
    @JsonProperty("enginesAnalyzed")     int enginesAnalyzed,
    @JsonProperty("enginesIncluded")     int enginesIncluded,
    @JsonProperty("enginesBullish")      int enginesBullish,
    @JsonProperty("enginesBearish")      int enginesBearish,
    @JsonProperty("enginesNeutral")      int enginesNeutral,
    @JsonProperty("reliabilityAverage")  double reliabilityAverage,
    @JsonProperty("weightedScore")       double weightedScore,
    @JsonProperty("engineContributions") Map<String, EngineContribution> engineContributions
) {
    public ConsensusResult {
        engineContributions = engineContributions == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(engineContributions));
    }

    /** Result for the case where no engine carries weight. */
    public static ConsensusResult insufficient(int enginesAnalyzed,
                                               Map<String, EngineContribution> contributions) {
        return new ConsensusResult(ConsensusSignal.INSUFFICIENT_DATA, 0.0, 0.0,
                                   ConsensusQuality.INSUFFICIENT, enginesAnalyzed, 0,
                                   0, 0, 0, 0.0, 0.0, contributions);
    }

    public boolean isSufficient() {
        return signal != ConsensusSignal.INSUFFICIENT_DATA;
    }
}
