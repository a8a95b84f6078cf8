package com.legendplatform.common.consensus;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Coarse grade of how much a {@link ConsensusResult} can be trusted.
 *
 * <pre>
 *   HIGH         ≥ 3 included engines, avg reliability ≥ 0.7, confidence ≥ 0.7
 *   MEDIUM       ≥ 2 included engines, avg reliability ≥ 0.5, confidence ≥ 0.5
 *   LOW          anything else with at least one included engine
 *   INSUFFICIENT no included engine
 * </pre>
 */
public enum ConsensusQuality {
    HIGH,
    MEDIUM,
    LOW,
    INSUFFICIENT;

    static ConsensusQuality grade(int includedEngines, double reliabilityAverage, double confidence) {
        if (includedEngines == 0) return INSUFFICIENT;
        if (includedEngines >= 3
                && ConsensusSignal.atLeast(reliabilityAverage, 0.7)
                && ConsensusSignal.atLeast(confidence, 0.7)) return HIGH;
        if (includedEngines >= 2
                && ConsensusSignal.atLeast(reliabilityAverage, 0.5)
                && ConsensusSignal.atLeast(confidence, 0.5)) return MEDIUM;
        return LOW;
    }

    @JsonValue
    public String jsonValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
