package com.legendplatform.common.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ModelValidationTest {

    @Test
    @DisplayName("reliability levels are ordered and carry fixed weights")
    void reliabilityOrdering() {
        assertEquals(0.3, ReliabilityLevel.EXPERIMENTAL.weight());
        assertEquals(0.5, ReliabilityLevel.VARIABLE.weight());
        assertEquals(0.7, ReliabilityLevel.MEDIUM.weight());
        assertEquals(1.0, ReliabilityLevel.HIGH.weight());
        assertTrue(ReliabilityLevel.HIGH.isAtLeast(ReliabilityLevel.MEDIUM));
        assertFalse(ReliabilityLevel.VARIABLE.isAtLeast(ReliabilityLevel.MEDIUM));
        assertTrue(ReliabilityLevel.EXPERIMENTAL.isAtLeast(null));
        assertEquals(ReliabilityLevel.MEDIUM, ReliabilityLevel.fromValue(" medium "));
    }

    @Test
    @DisplayName("QualityMeta keeps unknown fields null and rejects out-of-range ratios")
    void qualityMeta() {
        QualityMeta q = QualityMeta.of(1000.0, 60.0, 0.98);
        assertNull(q.falsePositiveRisk());
        assertNull(QualityMeta.unknown().sampleSize());
        assertThrows(IllegalArgumentException.class, () -> QualityMeta.of(10.0, 1.0, 1.2));
        assertThrows(IllegalArgumentException.class, () -> q.withRisk(-0.1, null));
    }

    @Test
    @DisplayName("envelope facts are a read-only copy")
    void envelopeFactsCopied() {
        Map<String, Object> facts = new HashMap<>();
        facts.put("signal", "bullish");
        facts.put("note", null);
        ResultEnvelope envelope = new ResultEnvelope("E", "1D", Instant.EPOCH, facts, null);
        facts.put("signal", "bearish");

        assertEquals("bullish", envelope.fact("signal"));
        assertTrue(envelope.facts().containsKey("note"));
        assertEquals(QualityMeta.unknown(), envelope.quality());
        assertThrows(UnsupportedOperationException.class, () -> envelope.facts().put("x", 1));
    }

    @Test
    @DisplayName("outcome status and envelope must agree")
    void outcomeConsistency() {
        ResultEnvelope envelope = new ResultEnvelope("E", "1D", Instant.EPOCH, Map.of(), null);
        assertThrows(IllegalArgumentException.class, () -> new EngineOutcome(
            "E", ReliabilityLevel.HIGH, EngineType.HYBRID, OutcomeStatus.SUCCESS, null, null, 0L));
        assertThrows(IllegalArgumentException.class, () -> new EngineOutcome(
            "E", ReliabilityLevel.HIGH, EngineType.HYBRID, OutcomeStatus.FAILURE, envelope, "x", 0L));
    }

    @Test
    @DisplayName("analysis result counts successes and keeps only their envelopes")
    void analysisResultCounts() {
        AnalysisRequest request = AnalysisRequest.of("SPY", "1D", Instant.EPOCH);
        ResultEnvelope envelope = ResultEnvelope.of("A", request, Map.of(), null);
        AnalysisResult result = AnalysisResult.of(request, List.of(
                EngineOutcome.success("A", ReliabilityLevel.HIGH, EngineType.TRADITIONAL, envelope, 3L),
                EngineOutcome.failure("B", ReliabilityLevel.HIGH, EngineType.TRADITIONAL, "boom", 1L)),
            null, Instant.EPOCH, Instant.EPOCH.plusMillis(42));

        assertEquals(2, result.totalEngines());
        assertEquals(1, result.successfulEngines());
        assertEquals(42L, result.executionTimeMs());
        assertEquals(List.of(envelope), result.engineResults());
    }

    @Test
    @DisplayName("request and progress reject invalid input")
    void requestAndProgressValidation() {
        assertThrows(IllegalArgumentException.class, () -> AnalysisRequest.of(" ", "1D", Instant.EPOCH));
        assertThrows(NullPointerException.class, () -> AnalysisRequest.of("SPY", "1D", null));
        assertThrows(IllegalArgumentException.class, () -> EngineProgress.of("E", "fetch", 101.0, null));
    }

    @Test
    @DisplayName("convenience progress report clamps percent instead of throwing")
    void progressConvenienceClamps() {
        List<EngineProgress> seen = new ArrayList<>();
        ProgressSink sink = seen::add;

        sink.report("E", "fetch", 100.0000001, null);
        sink.report("E", "fetch", -3.0, null);
        sink.report("E", "fetch", Double.NaN, null);

        assertEquals(List.of(100.0, 0.0, 0.0), seen.stream().map(EngineProgress::percent).toList());
    }
}
