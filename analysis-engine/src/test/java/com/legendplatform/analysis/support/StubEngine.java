package com.legendplatform.analysis.support;

import com.legendplatform.analysis.engine.LegendEngine;
import com.legendplatform.common.model.AnalysisRequest;
import com.legendplatform.common.model.EngineType;
import com.legendplatform.common.model.ProgressSink;
import com.legendplatform.common.model.QualityMeta;
import com.legendplatform.common.model.ReliabilityLevel;
import com.legendplatform.common.model.ResultEnvelope;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;

/**
 * Configurable engine for tests. Counts how often {@link #run} is invoked.
 */
public class StubEngine implements LegendEngine {

    private final String name;
    private final ReliabilityLevel reliability;
    private final EngineType type;
    private final BiFunction<AnalysisRequest, ProgressSink, Mono<ResultEnvelope>> behaviour;
    private final AtomicInteger invocations = new AtomicInteger();

    public StubEngine(String name, ReliabilityLevel reliability, EngineType type,
                      BiFunction<AnalysisRequest, ProgressSink, Mono<ResultEnvelope>> behaviour) {
        this.name        = name;
        this.reliability = reliability;
        this.type        = type;
        this.behaviour   = behaviour;
    }

    public static StubEngine withFacts(String name, ReliabilityLevel reliability, Map<String, Object> facts) {
        return new StubEngine(name, reliability, EngineType.TRADITIONAL, (request, progress) -> {
            progress.report(name, "compute", 50.0, null);
            progress.report(name, "score", 100.0, "done");
            return Mono.just(ResultEnvelope.of(name, request, facts, QualityMeta.of(100.0, 1.0, 1.0)));
        });
    }

    public static StubEngine scored(String name, ReliabilityLevel reliability, double score, double confidence) {
        return withFacts(name, reliability, Map.of("signal_score", score, "confidence", confidence));
    }

    public static StubEngine delayed(String name, ReliabilityLevel reliability, Duration delay) {
        return new StubEngine(name, reliability, EngineType.TRADITIONAL, (request, progress) ->
            Mono.delay(delay).map(t -> ResultEnvelope.of(name, request, Map.of("signal", "bullish"), null)));
    }

    public static StubEngine failing(String name, ReliabilityLevel reliability, RuntimeException error) {
        return new StubEngine(name, reliability, EngineType.TRADITIONAL, (request, progress) -> Mono.error(error));
    }

    public StubEngine ofType(EngineType engineType) {
        return new StubEngine(name, reliability, engineType, behaviour);
    }

    public int invocations() {
        return invocations.get();
    }

    @Override
    public String name() { return name; }

    @Override
    public ReliabilityLevel reliabilityLevel() { return reliability; }

    @Override
    public EngineType engineType() { return type; }

    @Override
    public Mono<ResultEnvelope> run(AnalysisRequest request, ProgressSink progress) {
        invocations.incrementAndGet();
        return behaviour.apply(request, progress);
    }
}
