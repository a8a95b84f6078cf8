package com.legendplatform.analysis.service;

import com.legendplatform.common.model.EngineType;
import com.legendplatform.common.model.ProgressSink;
import com.legendplatform.common.model.ReliabilityLevel;

import java.time.Duration;
import java.util.List;

/**
 * Per-call options for {@link LegendAnalysisService#analyzeWithConsensus}.
 *
 * <p>{@code engineNames}, {@code minEngineReliability} and {@code engineType} narrow the engine set
 * before scheduling. {@code minConsensusReliability} only narrows the consensus: engines below it
 * still run and still appear in the outcomes. {@code null} means "no restriction" throughout;
 * a {@code null} {@code perEngineTimeout} falls back to the configured default.
 */
public record AnalysisOptions(
    List<String> engineNames,
    ReliabilityLevel minEngineReliability,
    EngineType engineType,
    ReliabilityLevel minConsensusReliability,
    boolean enableConsensus,
    Duration perEngineTimeout,
    ProgressSink progressSink
) {
    private static final AnalysisOptions DEFAULTS =
        new AnalysisOptions(null, null, null, null, true, null, null);

    public AnalysisOptions {
        engineNames = engineNames == null ? null : List.copyOf(engineNames);
    }

    public static AnalysisOptions defaults() {
        return DEFAULTS;
    }

    public AnalysisOptions withEngineNames(List<String> names) {
        return new AnalysisOptions(names, minEngineReliability, engineType, minConsensusReliability,
                                   enableConsensus, perEngineTimeout, progressSink);
    }

    public AnalysisOptions withMinEngineReliability(ReliabilityLevel level) {
        return new AnalysisOptions(engineNames, level, engineType, minConsensusReliability,
                                   enableConsensus, perEngineTimeout, progressSink);
    }

    public AnalysisOptions withEngineType(EngineType type) {
        return new AnalysisOptions(engineNames, minEngineReliability, type, minConsensusReliability,
                                   enableConsensus, perEngineTimeout, progressSink);
    }

    public AnalysisOptions withMinConsensusReliability(ReliabilityLevel level) {
        return new AnalysisOptions(engineNames, minEngineReliability, engineType, level,
                                   enableConsensus, perEngineTimeout, progressSink);
    }

    public AnalysisOptions withConsensus(boolean enabled) {
        return new AnalysisOptions(engineNames, minEngineReliability, engineType, minConsensusReliability,
                                   enabled, perEngineTimeout, progressSink);
    }

    public AnalysisOptions withPerEngineTimeout(Duration timeout) {
        return new AnalysisOptions(engineNames, minEngineReliability, engineType, minConsensusReliability,
                                   enableConsensus, timeout, progressSink);
    }

    public AnalysisOptions withProgressSink(ProgressSink sink) {
        return new AnalysisOptions(engineNames, minEngineReliability, engineType, minConsensusReliability,
                                   enableConsensus, perEngineTimeout, sink);
    }
}
