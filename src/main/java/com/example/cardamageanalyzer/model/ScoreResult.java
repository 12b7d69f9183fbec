package com.example.cardamageanalyzer.model;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Damage estimate for one image or for a whole batch. Both values are percentages and are
 * clamped into {@code [0, 100]} on construction, whatever the oracle answered.
 */
@Schema(description = "Damage estimate expressed as percentages")
public record ScoreResult(
        @Schema(description = "Estimated share of the vehicle surface that is damaged", example = "35") int damagePercentage,
        @Schema(description = "Confidence of the estimate", example = "82") int confidence) {

    public static final int MIN = 0;
    public static final int MAX = 100;

    public ScoreResult {
        damagePercentage = clamp(damagePercentage);
        confidence = clamp(confidence);
    }

    /**
     * Accepts raw (possibly fractional or out-of-range) oracle values. Fractions are rounded half
     * away from zero before clamping.
     */
    public static ScoreResult fromRaw(double damagePercentage, double confidence) {
        return new ScoreResult(roundHalfAwayFromZero(damagePercentage), roundHalfAwayFromZero(confidence));
    }

    static int roundHalfAwayFromZero(double value) {
        if (Double.isNaN(value)) {
            throw new IllegalArgumentException("Score value must be a number");
        }
        double rounded = Math.signum(value) * Math.floor(Math.abs(value) + 0.5);
        if (rounded > Integer.MAX_VALUE) {
            return Integer.MAX_VALUE;
        }
        if (rounded < Integer.MIN_VALUE) {
            return Integer.MIN_VALUE;
        }
        return (int) rounded;
    }

    private static int clamp(int value) {
        return Math.max(MIN, Math.min(MAX, value));
    }
}
