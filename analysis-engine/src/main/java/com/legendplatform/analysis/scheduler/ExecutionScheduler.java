package com.legendplatform.analysis.scheduler;

import com.legendplatform.analysis.engine.LegendEngine;
import com.legendplatform.common.exception.EngineException;
import com.legendplatform.common.exception.EngineTimeoutException;
import com.legendplatform.common.model.AnalysisRequest;
import com.legendplatform.common.model.EngineOutcome;
import com.legendplatform.common.model.EngineType;
import com.legendplatform.common.model.ProgressSink;
import com.legendplatform.common.model.ReliabilityLevel;
import com.legendplatform.common.model.ResultEnvelope;
import com.legendplatform.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs engines concurrently against one request and collects one {@link EngineOutcome} per engine.
 *
 * <p>Guarantees:
 * <ul>
 *   <li>Each engine is subscribed on its own {@code boundedElastic} worker; engines share no
 *       mutable state.</li>
 *   <li>An engine's error, empty completion, malformed envelope or timeout becomes that engine's
 *       outcome and never reaches a sibling.</li>
 *   <li>The returned list is emitted only after every engine finished (all-complete barrier), in the
 *       order of the input list.</li>
 *   <li>Cancelling the returned {@link Mono} cancels every engine still running.</li>
 * </ul>
 */
public class ExecutionScheduler {

    private static final Logger log = LoggerFactory.getLogger(ExecutionScheduler.class);

    private final Scheduler workers;

    public ExecutionScheduler() {
        this(Schedulers.boundedElastic());
    }

    public ExecutionScheduler(Scheduler workers) {
        this.workers = workers;
    }

    /**
     * @param progress         progress sink shared by all engines, may be {@code null}
     * @param perEngineTimeout timeout applied to each engine independently, {@code null} or
     *                         non-positive for none
     */
    public Mono<List<EngineOutcome>> runAll(AnalysisRequest request,
                                            List<? extends LegendEngine> engines,
                                            ProgressSink progress,
                                            Duration perEngineTimeout) {
        List<LegendEngine> targets = List.copyOf(engines);
        log.info("Dispatching {} engines in parallel for symbol={} timeframe={}",
                 targets.size(), request.symbol(), request.timeframe());
        if (targets.isEmpty()) {
            return Mono.just(List.of());
        }
        return Flux.fromIterable(targets)
            .flatMapSequential(engine -> runOne(request, engine, progress, perEngineTimeout), targets.size())
            .collectList();
    }

    public Mono<EngineOutcome> runOne(AnalysisRequest request, LegendEngine engine,
                                      ProgressSink progress, Duration timeout) {
        return Mono.deferContextual(ctx -> {
            String analysisId      = TraceContextUtil.getAnalysisId(ctx);
            long startNanos        = System.nanoTime();
            String name            = engine.name();
            ReliabilityLevel level = engine.reliabilityLevel();
            EngineType type        = engine.engineType();
            if (level == null) {
                TraceContextUtil.withMdc(analysisId, () ->
                    log.error("Engine={} declares no reliability level. Not scheduled. symbol={}",
                              name, request.symbol()));
                return Mono.just(EngineOutcome.failure(name, ReliabilityLevel.EXPERIMENTAL, type,
                                                       "Engine declares no reliability level", 0L));
            }
            ProgressSink sink = isolate(name, progress, analysisId);

            Mono<ResultEnvelope> run = Mono.defer(() -> engine.run(request, sink))
                .subscribeOn(workers)
                .switchIfEmpty(Mono.error(() ->
                    new EngineException(name, "Engine completed without a result")));

            if (timeout != null && !timeout.isNegative() && !timeout.isZero()) {
                run = run.timeout(timeout, Mono.error(() ->
                    new EngineTimeoutException(name, timeout, null)));
            }

            return run
                .map(envelope -> {
                    if (!name.equals(envelope.engineName())) {
                        throw new EngineException(name,
                            "Malformed envelope: reports engine name '" + envelope.engineName() + "'");
                    }
                    long elapsed = elapsedMs(startNanos);
                    TraceContextUtil.withMdc(analysisId, () ->
                        log.info("Engine={} complete. symbol={} facts={} elapsedMs={}",
                                 name, request.symbol(), envelope.facts().size(), elapsed));
                    return EngineOutcome.success(name, level, type, envelope, elapsed);
                })
                .onErrorResume(e -> {
                    long elapsed = elapsedMs(startNanos);
                    if (e instanceof EngineTimeoutException) {
                        TraceContextUtil.withMdc(analysisId, () ->
                            log.warn("Engine={} timed out. symbol={} timeoutMs={}",
                                     name, request.symbol(), timeout.toMillis()));
                        return Mono.just(EngineOutcome.timeout(name, level, type, e.getMessage(), elapsed));
                    }
                    TraceContextUtil.withMdc(analysisId, () ->
                        log.error("Engine={} failed for symbol={}", name, request.symbol(), e));
                    return Mono.just(EngineOutcome.failure(name, level, type, describe(e), elapsed));
                })
                .doOnCancel(() -> TraceContextUtil.withMdc(analysisId, () ->
                    log.info("Engine={} cancelled. symbol={}", name, request.symbol())));
        });
    }

    /** Wraps the caller's sink so a failing sink cannot fail the engine that reports to it. */
    private ProgressSink isolate(String engineName, ProgressSink delegate, String analysisId) {
        if (delegate == null || delegate == ProgressSink.NOOP) {
            return ProgressSink.NOOP;
        }
        return progress -> {
            try {
                delegate.report(progress);
            } catch (RuntimeException e) {
                TraceContextUtil.withMdc(analysisId, () ->
                    log.warn("Progress sink rejected update. engine={} stage={}",
                             engineName, progress.stage(), e));
            }
        };
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
