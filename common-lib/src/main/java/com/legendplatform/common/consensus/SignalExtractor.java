package com.legendplatform.common.consensus;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads a directional score and a confidence out of an engine's schema-less facts.
 *
 * <h3>Signal fields, in precedence order</h3>
 * <ol>
 *   <li>{@code signal}</li>
 *   <li>{@code position_bias}</li>
 *   <li>{@code primary_trend}</li>
 *   <li>{@code momentum_signal}</li>
 *   <li>{@code signal_score}</li>
 * </ol>
 * The first field whose value is recognized wins. A field holding an unrecognized value
 * is skipped, not treated as neutral. Recognized values are numbers (clamped to [-1, 1])
 * and the vocabulary in {@link #VOCABULARY} after normalization (trim, lower-case,
 * spaces and hyphens to underscores).
 *
 * <h3>Confidence fields, in precedence order</h3>
 * {@code confidence}, {@code strength}, {@code quality_score}. Values in (1, 100] are read
 * as percentages. The result is clamped to [0, 1]. When no confidence field is present the
 * default is {@value #DEFAULT_CONFIDENCE}, but only if a signal was found; otherwise 0.
 *
 * <p>This class is stateless and thread-safe.
 */
public final class SignalExtractor {

    public static final List<String> SIGNAL_FIELDS = List.of(
        "signal", "position_bias", "primary_trend", "momentum_signal", "signal_score");

    public static final List<String> CONFIDENCE_FIELDS = List.of(
        "confidence", "strength", "quality_score");

    static final double DEFAULT_CONFIDENCE = 0.5;

    static final Map<String, Double> VOCABULARY = Map.ofEntries(
        Map.entry("strong_bullish", 0.85),
        Map.entry("bullish",        0.5),
        Map.entry("neutral",        0.0),
        Map.entry("bearish",       -0.5),
        Map.entry("strong_bearish",-0.85),
        Map.entry("strong_buy",     0.85),
        Map.entry("buy",            0.5),
        Map.entry("hold",           0.0),
        Map.entry("sell",          -0.5),
        Map.entry("strong_sell",   -0.85),
        Map.entry("uptrend",        0.5),
        Map.entry("sideways",       0.0),
        Map.entry("downtrend",     -0.5)
    );

    /**
     * Score and confidence pulled from one envelope.
     *
     * @param score      directional score in [-1, 1]
     * @param confidence confidence in [0, 1]
     * @param field      fact name the score came from, {@code null} when none was recognized
     */
    public record Extraction(double score, double confidence, String field) {

        static final Extraction NONE = new Extraction(0.0, 0.0, null);

        public boolean hasSignal() {
            return field != null;
        }
    }

    private SignalExtractor() {}

    public static Extraction extract(Map<String, Object> facts) {
        if (facts == null || facts.isEmpty()) {
            return Extraction.NONE;
        }
        for (String field : SIGNAL_FIELDS) {
            Double score = toScore(facts.get(field));
            if (score != null) {
                return new Extraction(score, extractConfidence(facts), field);
            }
        }
        return Extraction.NONE;
    }

    /** Maps a single fact value to a score, or {@code null} when the value is not recognized. */
    static Double toScore(Object value) {
        if (value instanceof Number number) {
            double d = number.doubleValue();
            if (Double.isNaN(d)) return null;
            return clamp(d, -1.0, 1.0);
        }
        if (value instanceof CharSequence text) {
            String key = text.toString().trim().toLowerCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
            return VOCABULARY.get(key);
        }
        return null;
    }

    private static double extractConfidence(Map<String, Object> facts) {
        for (String field : CONFIDENCE_FIELDS) {
            if (facts.get(field) instanceof Number number) {
                double d = number.doubleValue();
                if (Double.isNaN(d)) continue;
                if (d > 1.0 && d <= 100.0) d = d / 100.0;
                return clamp(d, 0.0, 1.0);
            }
        }
        return DEFAULT_CONFIDENCE;
    }

    private static double clamp(double v, double min, double max) {
        return Math.max(min, Math.min(max, v));
    }
}
