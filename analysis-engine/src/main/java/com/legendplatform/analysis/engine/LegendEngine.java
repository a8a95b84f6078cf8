package com.legendplatform.analysis.engine;

import com.legendplatform.common.model.AnalysisRequest;
import com.legendplatform.common.model.EngineType;
import com.legendplatform.common.model.ProgressSink;
import com.legendplatform.common.model.ReliabilityLevel;
import com.legendplatform.common.model.ResultEnvelope;
import reactor.core.publisher.Mono;

/**
 * Capability contract every pluggable analysis engine implements.
 *
 * <p>{@link #name()}, {@link #reliabilityLevel()} and {@link #engineType()} must be constant
 * for the engine's lifetime. {@link #run} may signal an error or never complete; the
 * scheduler isolates both cases from sibling engines.
 */
public interface LegendEngine {

    String name();

    ReliabilityLevel reliabilityLevel();

    EngineType engineType();

    default String description() {
        return name();
    }

    /**
     * Produces this engine's opinion for {@code request}.
     *
     * @param request  the immutable analysis request
     * @param progress sink for progress updates, never {@code null}
     * @return a single envelope whose {@code engineName} equals {@link #name()}
     */
    Mono<ResultEnvelope> run(AnalysisRequest request, ProgressSink progress);
}
