package com.legendplatform.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

/**
 * Carries the analysis id through reactive pipelines.
 *
 * <p>Reactor Context is the single source of truth for the id inside a pipeline.
 * MDC is only written for the duration of a log statement, never as a persistent
 * ThreadLocal store: engine tasks hop across {@code boundedElastic} threads.
 *
 * <pre>
 *     return TraceContextUtil.withAnalysisId(pipeline, analysisId);
 * </pre>
 */
public final class TraceContextUtil {

    public static final String ANALYSIS_ID_KEY = "analysisId";

    private TraceContextUtil() {}

    public static <T> Mono<T> withAnalysisId(Mono<T> mono, String analysisId) {
        return mono.contextWrite(ctx -> ctx.put(ANALYSIS_ID_KEY, analysisId));
    }

    public static <T> Flux<T> withAnalysisId(Flux<T> flux, String analysisId) {
        return flux.contextWrite(ctx -> ctx.put(ANALYSIS_ID_KEY, analysisId));
    }

    /** Returns {@code "unknown"} when no id is present, never {@code null}. */
    public static String getAnalysisId(ContextView ctx) {
        return ctx.getOrDefault(ANALYSIS_ID_KEY, "unknown");
    }

    /**
     * Bridges the id into MDC while {@code logAction} runs, then removes it.
     * Only use this around logging side-effects.
     */
    public static void withMdc(String analysisId, Runnable logAction) {
        MDC.put(ANALYSIS_ID_KEY, analysisId);
        try {
            logAction.run();
        } finally {
            MDC.remove(ANALYSIS_ID_KEY);
        }
    }
}
