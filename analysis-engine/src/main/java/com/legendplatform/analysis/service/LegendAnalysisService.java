package com.legendplatform.analysis.service;

import com.legendplatform.analysis.engine.LegendEngine;
import com.legendplatform.analysis.logger.AnalysisFlowLogger;
import com.legendplatform.analysis.registry.EngineDescriptor;
import com.legendplatform.analysis.registry.EngineRegistry;
import com.legendplatform.analysis.scheduler.ExecutionScheduler;
import com.legendplatform.common.consensus.ConsensusResult;
import com.legendplatform.common.consensus.ConsensusStrategy;
import com.legendplatform.common.exception.UnknownEngineException;
import com.legendplatform.common.model.AnalysisRequest;
import com.legendplatform.common.model.AnalysisResult;
import com.legendplatform.common.model.EngineOutcome;
import com.legendplatform.common.model.ProgressSink;
import com.legendplatform.common.model.ReliabilityLevel;
import com.legendplatform.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Entry point for analysis calls: selects engines from the {@link EngineRegistry}, runs them
 * through the {@link ExecutionScheduler} and aggregates the outcomes with the configured
 * {@link ConsensusStrategy}.
 *
 * <p>Configuration errors (an engine name that is not registered) are signalled as
 * {@link UnknownEngineException} before any engine is scheduled. Engine failures never are:
 * they arrive as {@link EngineOutcome}s.
 */
@Service
public class LegendAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(LegendAnalysisService.class);

    private final EngineRegistry registry;
    private final ExecutionScheduler scheduler;
    private final ConsensusStrategy consensusStrategy;
    private final AnalysisFlowLogger flowLogger;
    private final Duration defaultTimeout;
    private final String defaultTimeframe;

    public LegendAnalysisService(
            EngineRegistry registry,
            ExecutionScheduler scheduler,
            ConsensusStrategy consensusStrategy,
            AnalysisFlowLogger flowLogger,
            @Value("${analysis.engine-timeout:30s}") Duration defaultTimeout,
            @Value("${analysis.default-timeframe:1D}") String defaultTimeframe) {
        this.registry          = registry;
        this.scheduler         = scheduler;
        this.consensusStrategy = consensusStrategy;
        this.flowLogger        = flowLogger;
        this.defaultTimeout    = defaultTimeout;
        this.defaultTimeframe  = defaultTimeframe;
    }

    /**
     * Runs the named engines ({@code null} = all registered) and returns one outcome per engine,
     * in registration order.
     */
    public Mono<List<EngineOutcome>> runAll(AnalysisRequest request, List<String> engineNames,
                                            ProgressSink progress, Duration perEngineTimeout) {
        return Mono.defer(() -> {
            List<LegendEngine> engines = registry.resolve(engineNames);
            return scheduler.runAll(request, engines, progress, effectiveTimeout(perEngineTimeout));
        });
    }

    /** Runs a single registered engine. */
    public Mono<EngineOutcome> runEngine(String engineName, AnalysisRequest request, ProgressSink progress) {
        return Mono.defer(() -> {
            LegendEngine engine = registry.find(engineName)
                .orElseThrow(() -> new UnknownEngineException(List.of(engineName)));
            return scheduler.runOne(request, engine, progress, defaultTimeout);
        });
    }

    public Mono<AnalysisResult> analyzeWithConsensus(AnalysisRequest request, AnalysisOptions options) {
        AnalysisOptions opts = options == null ? AnalysisOptions.defaults() : options;
        return Mono.defer(() -> {
            String analysisId = UUID.randomUUID().toString();
            Instant startedAt = Instant.now();
            flowLogger.logWithAnalysisId(AnalysisFlowLogger.REQUEST_RECEIVED, analysisId,
                "symbol=" + request.symbol() + " timeframe=" + request.timeframe());

            List<LegendEngine> engines = selectEngines(opts);
            flowLogger.logWithAnalysisId(AnalysisFlowLogger.ENGINES_RESOLVED, analysisId,
                "engines=" + engines.stream().map(LegendEngine::name).toList());

            Mono<AnalysisResult> pipeline = scheduler
                .runAll(request, engines, opts.progressSink(), effectiveTimeout(opts.perEngineTimeout()))
                .doOnEach(flowLogger.stage(AnalysisFlowLogger.ENGINES_COMPLETED))
                .map(outcomes -> {
                    ConsensusResult consensus = null;
                    if (opts.enableConsensus()) {
                        consensus = consensusStrategy.compute(outcomes, opts.minConsensusReliability());
                        flowLogger.logConsensus(consensus, analysisId);
                    }
                    AnalysisResult result = AnalysisResult.of(request, outcomes, consensus, startedAt, Instant.now());
                    log.info("Analysis complete. symbol={} engines={}/{} executionTimeMs={} analysisId={}",
                             request.symbol(), result.successfulEngines(), result.totalEngines(),
                             result.executionTimeMs(), analysisId);
                    return result;
                });
            return TraceContextUtil.withAnalysisId(pipeline, analysisId);
        });
    }

    /**
     * Streams progress from every engine, then one completion event with the full result.
     * Cancelling the stream cancels the analysis.
     */
    public Flux<AnalysisEvent> streamAnalysis(AnalysisRequest request, AnalysisOptions options) {
        AnalysisOptions opts = options == null ? AnalysisOptions.defaults() : options;
        return Flux.create(sink -> {
            ProgressSink forward = progress -> sink.next(AnalysisEvent.progress(progress));
            Disposable analysis = analyzeWithConsensus(request, opts.withProgressSink(forward))
                .subscribe(
                    result -> {
                        sink.next(AnalysisEvent.completed(result));
                        sink.complete();
                    },
                    sink::error);
            sink.onDispose(analysis);
        });
    }

    /** Consensus over every registered engine, for {@code symbol} as of now. */
    public Mono<ConsensusResult> quickConsensus(String symbol, String timeframe, ReliabilityLevel minReliability) {
        return Mono.defer(() -> {
            AnalysisRequest request = AnalysisRequest.now(symbol, timeframeOrDefault(timeframe));
            AnalysisOptions options = AnalysisOptions.defaults().withMinConsensusReliability(minReliability);
            return analyzeWithConsensus(request, options).map(AnalysisResult::consensus);
        });
    }

    /** Full analysis with consensus over every registered engine, for {@code symbol} as of now. */
    public Mono<AnalysisResult> quickAnalysis(String symbol, String timeframe) {
        return Mono.defer(() -> analyzeWithConsensus(
            AnalysisRequest.now(symbol, timeframeOrDefault(timeframe)), AnalysisOptions.defaults()));
    }

    public List<EngineDescriptor> availableEngines() {
        return registry.describe();
    }

    public String defaultTimeframe() {
        return defaultTimeframe;
    }

    private List<LegendEngine> selectEngines(AnalysisOptions opts) {
        return registry.resolve(opts.engineNames()).stream()
            .filter(e -> e.reliabilityLevel().isAtLeast(opts.minEngineReliability()))
            .filter(e -> opts.engineType() == null || e.engineType() == opts.engineType())
            .toList();
    }

    private Duration effectiveTimeout(Duration requested) {
        return requested != null ? requested : defaultTimeout;
    }

    private String timeframeOrDefault(String timeframe) {
        return timeframe == null || timeframe.isBlank() ? defaultTimeframe : timeframe;
    }
}
