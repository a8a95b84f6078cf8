package com.legendplatform.common.model;

/**
 * Receives {@link EngineProgress} updates. Calls from different engines may interleave.
 */
@FunctionalInterface
public interface ProgressSink {

    ProgressSink NOOP = progress -> { };

    void report(EngineProgress progress);

    /**
     * Builds and reports an {@link EngineProgress}. Never throws for an out-of-range
     * {@code percent}: it is clamped to [0, 100], and {@code NaN} reports 0.
     */
    default void report(String engineName, String stage, double percent, String note) {
        double clamped = Double.isNaN(percent) ? 0.0 : Math.max(0.0, Math.min(100.0, percent));
        report(EngineProgress.of(engineName, stage, clamped, note));
    }
}
