package com.legendplatform.common.consensus;

import com.legendplatform.common.model.EngineOutcome;
import com.legendplatform.common.model.ReliabilityLevel;

import java.util.List;

/**
 * Strategy contract for reducing per-engine outcomes into one {@link ConsensusResult}.
 *
 * <p>Implementations must be:
 * <ul>
 *   <li><b>Stateless</b>: no mutable state; safe to call concurrently</li>
 *   <li><b>Pure</b>: no reactive types, no side effects on the outcomes</li>
 *   <li><b>Non-null</b>: always return a result; zero usable engines yields
 *       {@link ConsensusResult#insufficient}</li>
 * </ul>
 *
 * <p>Current implementation: {@link ReliabilityWeightedConsensusStrategy}.
 */
public interface ConsensusStrategy {

    /**
     * @param outcomes      outcomes in scheduler order; failed and timed-out entries are skipped
     * @param minReliability reliability floor for inclusion, {@code null} for no floor
     * @return the aggregated result, never {@code null}
     */
    ConsensusResult compute(List<EngineOutcome> outcomes, ReliabilityLevel minReliability);

    default ConsensusResult compute(List<EngineOutcome> outcomes) {
        return compute(outcomes, null);
    }
}
