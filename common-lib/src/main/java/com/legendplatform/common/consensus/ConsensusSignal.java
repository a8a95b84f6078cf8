package com.legendplatform.common.consensus;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Aggregated directional verdict derived from a weighted score in [-1, 1].
 *
 * <p>Score buckets:
 * <pre>
 *   score ≥  0.7          → STRONG_BULLISH
 *   0.3  ≤ score &lt;  0.7 → BULLISH
 *   -0.3 &lt; score &lt;  0.3 → NEUTRAL
 *   -0.7 &lt; score ≤ -0.3 → BEARISH
 *   score ≤ -0.7          → STRONG_BEARISH
 * </pre>
 * {@link #INSUFFICIENT_DATA} is never produced by {@link #fromScore(double)}; it is assigned
 * explicitly when no engine carries weight.
 */
public enum ConsensusSignal {
    STRONG_BEARISH,
    BEARISH,
    NEUTRAL,
    BULLISH,
    STRONG_BULLISH,
    INSUFFICIENT_DATA;

    public static final double STRONG_THRESHOLD = 0.7;
    public static final double THRESHOLD        = 0.3;

    /** Slack for threshold comparisons; scores are sums of products of decimal fractions. */
    static final double TOLERANCE = 1e-9;

    public static ConsensusSignal fromScore(double score) {
        if (atLeast(score, STRONG_THRESHOLD))   return STRONG_BULLISH;
        if (atLeast(score, THRESHOLD))          return BULLISH;
        if (!atLeast(-score, THRESHOLD))        return NEUTRAL;
        if (!atLeast(-score, STRONG_THRESHOLD)) return BEARISH;
        return STRONG_BEARISH;
    }

    static boolean atLeast(double value, double threshold) {
        return value >= threshold - TOLERANCE;
    }

    public boolean isBullish() {
        return this == BULLISH || this == STRONG_BULLISH;
    }

    public boolean isBearish() {
        return this == BEARISH || this == STRONG_BEARISH;
    }

    @JsonValue
    public String jsonValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
