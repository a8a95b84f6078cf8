package com.legendplatform.analysis.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.legendplatform.analysis.service.AnalysisOptions;
import com.legendplatform.common.model.AnalysisRequest;
import com.legendplatform.common.model.EngineType;
import com.legendplatform.common.model.ReliabilityLevel;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * HTTP body for {@code POST /api/v1/analyze}. Every field except {@code symbol} is optional.
 */
public record AnalyzeRequest(
    @JsonProperty("symbol")                  String symbol,
    @JsonProperty("timeframe")               String timeframe,
    @JsonProperty("asOf")                    Instant asOf,
    @JsonProperty("engineNames")             List<String> engineNames,
    @JsonProperty("minEngineReliability")    ReliabilityLevel minEngineReliability,
    @JsonProperty("engineType")              EngineType engineType,
    @JsonProperty("minConsensusReliability") ReliabilityLevel minConsensusReliability,
    @JsonProperty("enableConsensus")         Boolean enableConsensus,
    @JsonProperty("timeoutMs")               Long timeoutMs
) {
    public AnalysisRequest toRequest(String defaultTimeframe) {
        String tf = timeframe == null || timeframe.isBlank() ? defaultTimeframe : timeframe;
        return AnalysisRequest.of(symbol, tf, asOf != null ? asOf : Instant.now());
    }

    public AnalysisOptions toOptions() {
        return new AnalysisOptions(
            engineNames, minEngineReliability, engineType, minConsensusReliability,
            enableConsensus == null || enableConsensus,
            timeoutMs == null ? null : Duration.ofMillis(timeoutMs),
            null);
    }
}
