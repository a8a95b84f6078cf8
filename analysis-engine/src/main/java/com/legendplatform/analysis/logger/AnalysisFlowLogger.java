package com.legendplatform.analysis.logger;

import com.legendplatform.common.consensus.ConsensusResult;
import com.legendplatform.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Logs each stage of an analysis call without touching pipeline behaviour.
 *
 * <p>Lifecycle stages (in order):
 * <ol>
 *   <li>{@link #REQUEST_RECEIVED}  : analysis call accepted</li>
 *   <li>{@link #ENGINES_RESOLVED}  : target engine set selected from the registry</li>
 *   <li>{@link #ENGINES_COMPLETED} : scheduler returned every outcome</li>
 *   <li>{@link #CONSENSUS_COMPUTED}: consensus aggregated (skipped when disabled)</li>
 * </ol>
 *
 * <pre>
 *     .doOnEach(flowLogger.stage(AnalysisFlowLogger.ENGINES_COMPLETED))
 * </pre>
 */
@Component
public class AnalysisFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(AnalysisFlowLogger.class);

    public static final String REQUEST_RECEIVED   = "REQUEST_RECEIVED";
    public static final String ENGINES_RESOLVED   = "ENGINES_RESOLVED";
    public static final String ENGINES_COMPLETED  = "ENGINES_COMPLETED";
    public static final String CONSENSUS_COMPUTED = "CONSENSUS_COMPUTED";

    /**
     * Returns a {@code doOnEach} consumer that logs {@code stageName} on {@code onNext} only.
     * The analysis id is read from the Reactor Context carried by the signal.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String analysisId = TraceContextUtil.getAnalysisId(signal.getContextView());
            TraceContextUtil.withMdc(analysisId, () ->
                log.info("[AnalysisFlow] stage={} analysisId={}", stageName, analysisId)
            );
        };
    }

    public void logWithAnalysisId(String stageName, String analysisId, String detail) {
        TraceContextUtil.withMdc(analysisId, () ->
            log.info("[AnalysisFlow] stage={} analysisId={} {}", stageName, analysisId, detail)
        );
    }

    public void logConsensus(ConsensusResult consensus, String analysisId) {
        TraceContextUtil.withMdc(analysisId, () ->
            log.info("[AnalysisFlow] stage={} signal={} weightedScore={} confidence={} quality={} "
                     + "included={}/{} analysisId={}",
                     CONSENSUS_COMPUTED,
                     consensus.signal(), String.format("%.3f", consensus.weightedScore()),
                     String.format("%.3f", consensus.confidence()), consensus.quality(),
                     consensus.enginesIncluded(), consensus.enginesAnalyzed(), analysisId)
        );
    }
}
