package com.legendplatform.analysis.controller;

import com.legendplatform.analysis.dto.AnalyzeRequest;
import com.legendplatform.analysis.registry.EngineDescriptor;
import com.legendplatform.analysis.service.AnalysisEvent;
import com.legendplatform.analysis.service.LegendAnalysisService;
import com.legendplatform.common.consensus.ConsensusResult;
import com.legendplatform.common.exception.UnknownEngineException;
import com.legendplatform.common.model.AnalysisResult;
import com.legendplatform.common.model.ReliabilityLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * HTTP adapter translating to and from {@link LegendAnalysisService}. Holds no analysis logic.
 */
@RestController
@RequestMapping("/api/v1/analyze")
public class AnalysisController {

    private static final Logger log = LoggerFactory.getLogger(AnalysisController.class);

    private final LegendAnalysisService analysisService;

    public AnalysisController(LegendAnalysisService analysisService) {
        this.analysisService = analysisService;
    }

    @PostMapping
    public Mono<ResponseEntity<AnalysisResult>> analyze(@RequestBody AnalyzeRequest body) {
        log.info("Analysis requested. symbol={} engines={}", body.symbol(), body.engineNames());
        return Mono.fromCallable(() -> body.toRequest(analysisService.defaultTimeframe()))
            .flatMap(request -> analysisService.analyzeWithConsensus(request, body.toOptions()))
            .map(ResponseEntity::ok);
    }

    @PostMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<AnalysisEvent> stream(@RequestBody AnalyzeRequest body) {
        log.info("Streaming analysis requested. symbol={}", body.symbol());
        return Mono.fromCallable(() -> body.toRequest(analysisService.defaultTimeframe()))
            .flatMapMany(request -> analysisService.streamAnalysis(request, body.toOptions()));
    }

    @GetMapping("/consensus")
    public Mono<ResponseEntity<ConsensusResult>> consensus(
            @RequestParam String symbol,
            @RequestParam(required = false) String timeframe,
            @RequestParam(required = false) String minReliability) {
        log.info("Quick consensus requested. symbol={} timeframe={} minReliability={}",
                 symbol, timeframe, minReliability);
        return analysisService.quickConsensus(symbol, timeframe, ReliabilityLevel.fromValue(minReliability))
            .map(ResponseEntity::ok);
    }

    @GetMapping("/engines")
    public Mono<ResponseEntity<List<EngineDescriptor>>> engines() {
        return Mono.just(ResponseEntity.ok(analysisService.availableEngines()));
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<String>> health() {
        return Mono.just(ResponseEntity.ok("OK"));
    }

    @ExceptionHandler(UnknownEngineException.class)
    public ResponseEntity<Map<String, Object>> unknownEngine(UnknownEngineException e) {
        log.warn("Rejected analysis request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage(), "engines", e.getEngineNames()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> invalidRequest(IllegalArgumentException e) {
        log.warn("Rejected analysis request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", String.valueOf(e.getMessage())));
    }
}
