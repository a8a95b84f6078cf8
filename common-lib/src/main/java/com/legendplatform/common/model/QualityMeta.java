package com.legendplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Data-quality metadata attached to a {@link ResultEnvelope}.
 *
 * <p>Every field is nullable. {@code null} means "unknown", never zero.
 * Ratio fields ({@code dataCompleteness}, {@code falsePositiveRisk},
 * {@code manipulationSensitivity}) must lie in [0.0, 1.0] when present.
 */
public record QualityMeta(
    @JsonProperty("sampleSize")                Double sampleSize,
    @JsonProperty("freshnessSec")              Double freshnessSec,
    @JsonProperty("dataCompleteness")          Double dataCompleteness,
    @JsonProperty("falsePositiveRisk")         Double falsePositiveRisk,
    @JsonProperty("manipulationSensitivity")   Double manipulationSensitivity,
    @JsonProperty("historicalValidationYears") Double historicalValidationYears
) {
    private static final QualityMeta UNKNOWN = new QualityMeta(null, null, null, null, null, null);

    public QualityMeta {
        requireNonNegative("sampleSize", sampleSize);
        requireNonNegative("freshnessSec", freshnessSec);
        requireRatio("dataCompleteness", dataCompleteness);
        requireRatio("falsePositiveRisk", falsePositiveRisk);
        requireRatio("manipulationSensitivity", manipulationSensitivity);
        requireNonNegative("historicalValidationYears", historicalValidationYears);
    }

    public static QualityMeta unknown() {
        return UNKNOWN;
    }

    /** Sample size, freshness and completeness only; the risk fields stay unknown. */
    public static QualityMeta of(double sampleSize, double freshnessSec, double dataCompleteness) {
        return new QualityMeta(sampleSize, freshnessSec, dataCompleteness, null, null, null);
    }

    public QualityMeta withRisk(Double falsePositiveRisk, Double manipulationSensitivity) {
        return new QualityMeta(sampleSize, freshnessSec, dataCompleteness,
                               falsePositiveRisk, manipulationSensitivity, historicalValidationYears);
    }

    public QualityMeta withHistoricalValidationYears(Double years) {
        return new QualityMeta(sampleSize, freshnessSec, dataCompleteness,
                               falsePositiveRisk, manipulationSensitivity, years);
    }

    private static void requireRatio(String field, Double value) {
        if (value != null && (value.isNaN() || value < 0.0 || value > 1.0)) {
            throw new IllegalArgumentException(field + " must be within [0, 1], got " + value);
        }
    }

    private static void requireNonNegative(String field, Double value) {
        if (value != null && (value.isNaN() || value < 0.0)) {
            throw new IllegalArgumentException(field + " must be >= 0, got " + value);
        }
    }
}
