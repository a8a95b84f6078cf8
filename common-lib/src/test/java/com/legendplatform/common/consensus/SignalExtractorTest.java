package com.legendplatform.common.consensus;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SignalExtractorTest {

    private static final double EPS = 1e-9;

    @Test
    @DisplayName("explicit signal field beats primary_trend")
    void signalFieldWins() {
        Map<String, Object> facts = new LinkedHashMap<>();
        facts.put("primary_trend", "bearish");
        facts.put("signal", "bullish");

        SignalExtractor.Extraction e = SignalExtractor.extract(facts);
        assertEquals("signal", e.field());
        assertEquals(0.5, e.score(), EPS);
    }

    @Test
    @DisplayName("unrecognized value falls through to the next field")
    void unrecognizedValueSkipped() {
        SignalExtractor.Extraction e = SignalExtractor.extract(
            Map.of("signal", "spring_test_complete", "primary_trend", "bearish"));
        assertEquals("primary_trend", e.field());
        assertEquals(-0.5, e.score(), EPS);
    }

    @Test
    @DisplayName("labels are normalized before lookup")
    void normalization() {
        assertEquals(0.85,  SignalExtractor.extract(Map.of("signal", " Strong Bullish ")).score(), EPS);
        assertEquals(-0.85, SignalExtractor.extract(Map.of("position_bias", "STRONG-BEARISH")).score(), EPS);
        assertEquals(0.5,   SignalExtractor.extract(Map.of("momentum_signal", "uptrend")).score(), EPS);
    }

    @Test
    @DisplayName("numeric signal is clamped to [-1, 1]")
    void numericClamped() {
        assertEquals(1.0,  SignalExtractor.extract(Map.of("signal_score", 3.0)).score(), EPS);
        assertEquals(-1.0, SignalExtractor.extract(Map.of("signal", -7)).score(), EPS);
        assertEquals(0.42, SignalExtractor.extract(Map.of("signal_score", 0.42)).score(), EPS);
    }

    @Test
    @DisplayName("boolean values are not signals")
    void booleanIgnored() {
        assertFalse(SignalExtractor.extract(Map.of("signal", true)).hasSignal());
    }

    @Test
    @DisplayName("confidence defaults to 0.5 only when a signal was found")
    void defaultConfidence() {
        assertEquals(0.5, SignalExtractor.extract(Map.of("signal", "bullish")).confidence(), EPS);

        SignalExtractor.Extraction none = SignalExtractor.extract(Map.of("confidence", 0.9));
        assertFalse(none.hasSignal());
        assertEquals(0.0, none.confidence(), EPS);
        assertEquals(0.0, none.score(), EPS);
    }

    @Test
    @DisplayName("confidence precedence: confidence, strength, quality_score")
    void confidencePrecedence() {
        assertEquals(0.9, SignalExtractor.extract(
            Map.of("signal", "bullish", "confidence", 0.9, "strength", 0.2)).confidence(), EPS);
        assertEquals(0.2, SignalExtractor.extract(
            Map.of("signal", "bullish", "strength", 0.2, "quality_score", 0.7)).confidence(), EPS);
    }

    @Test
    @DisplayName("percent-scale confidence is rescaled, out-of-range is clamped")
    void percentConfidence() {
        assertEquals(0.875, SignalExtractor.extract(
            Map.of("signal", "bullish", "confidence", 87.5)).confidence(), EPS);
        assertEquals(1.0, SignalExtractor.extract(
            Map.of("signal", "bullish", "quality_score", 250)).confidence(), EPS);
        assertEquals(0.0, SignalExtractor.extract(
            Map.of("signal", "bullish", "confidence", -0.4)).confidence(), EPS);
    }

    @Test
    @DisplayName("null or empty facts → no signal")
    void emptyFacts() {
        assertFalse(SignalExtractor.extract(null).hasSignal());
        assertFalse(SignalExtractor.extract(Map.of()).hasSignal());
    }
}
