package com.legendplatform.common.consensus;

import com.legendplatform.common.model.EngineOutcome;
import com.legendplatform.common.model.ReliabilityLevel;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Default {@link ConsensusStrategy}: weights each engine by its declared reliability
 * and the confidence it reports.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Skip outcomes that did not succeed, and engines below the reliability floor.</li>
 *   <li>Extract {@code score} and {@code confidence} with {@link SignalExtractor}.</li>
 *   <li>{@code weight = reliability.weight() × confidence}. Engines with zero weight stay in
 *       the contributions map but take no part in the average.</li>
 *   <li>{@code weightedScore = Σ(score × weight) / Σ(weight)} → [-1.0, +1.0].</li>
 *   <li>{@code confidence = Σ(weight) / Σ(reliability.weight())} over included engines.</li>
 *   <li>{@code strength = |weightedScore|}; signal and quality from their thresholds.</li>
 * </ol>
 *
 * <p>{@code Σ(weight) = 0} yields {@link ConsensusResult#insufficient}, whatever the engine count.
 *
 * <p>This class is stateless and thread-safe.
 */
public class ReliabilityWeightedConsensusStrategy implements ConsensusStrategy {

    @Override
    public ConsensusResult compute(List<EngineOutcome> outcomes, ReliabilityLevel minReliability) {
        Map<String, EngineContribution> contributions = new LinkedHashMap<>();

        double totalWeight      = 0.0;
        double weightedSum      = 0.0;
        double reliabilitySum   = 0.0;
        int analyzed = 0;
        int included = 0;
        int bullish  = 0;
        int bearish  = 0;
        int neutral  = 0;

        for (EngineOutcome outcome : outcomes) {
            if (!outcome.isSuccess() || !outcome.reliabilityLevel().isAtLeast(minReliability)) {
                continue;
            }
            analyzed++;

            SignalExtractor.Extraction extraction = SignalExtractor.extract(outcome.envelope().facts());
            double reliabilityWeight = outcome.reliabilityLevel().weight();
            double weight = reliabilityWeight * extraction.confidence();
            ConsensusSignal engineSignal = extraction.hasSignal()
                ? ConsensusSignal.fromScore(extraction.score())
                : ConsensusSignal.INSUFFICIENT_DATA;

            contributions.put(outcome.engineName(), new EngineContribution(
                extraction.score(), engineSignal, extraction.confidence(), weight,
                outcome.reliabilityLevel(), extraction.field()));

            if (weight <= 0.0) {
                continue;
            }
            included++;
            totalWeight    += weight;
            weightedSum    += extraction.score() * weight;
            reliabilitySum += reliabilityWeight;

            if (engineSignal.isBullish())      bullish++;
            else if (engineSignal.isBearish()) bearish++;
            else                               neutral++;
        }

        if (totalWeight <= 0.0) {
            return ConsensusResult.insufficient(analyzed, contributions);
        }

        double weightedScore      = clamp(weightedSum / totalWeight, -1.0, 1.0);
        double confidence         = clamp(totalWeight / reliabilitySum, 0.0, 1.0);
        double reliabilityAverage = reliabilitySum / included;

        return new ConsensusResult(
            ConsensusSignal.fromScore(weightedScore),
            confidence,
            Math.abs(weightedScore),
            ConsensusQuality.grade(included, reliabilityAverage, confidence),
            analyzed, included, bullish, bearish, neutral,
            reliabilityAverage, weightedScore, contributions);
    }

    private static double clamp(double v, double min, double max) {
        return Math.max(min, Math.min(max, v));
    }
}
