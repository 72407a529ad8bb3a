package com.metricsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Severity of a detected anomaly, ordered from least to most severe.
 *
 * <p>
 * Severity is always derived from a numeric distance; the two mapping
 * functions below are the only places thresholds live.
 * </p>
 *
 * @since 1.0.0
 */
public enum Severity {

    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * Map an absolute z-score to a severity. The cut-offs do not depend on the
     * configured sensitivity.
     *
     * @param zScore absolute z-score
     * @return severity bucket
     */
    public static Severity fromZScore(double zScore) {
        if (zScore >= 4) {
            return CRITICAL;
        }
        if (zScore >= 3) {
            return HIGH;
        }
        if (zScore >= 2) {
            return MEDIUM;
        }
        return LOW;
    }

    /**
     * Map a normalized IQR overshoot to a severity.
     *
     * @param distance overshoot beyond the fence, in units of IQR
     * @return severity bucket
     */
    public static Severity fromDistance(double distance) {
        if (distance >= 3) {
            return CRITICAL;
        }
        if (distance >= 2) {
            return HIGH;
        }
        if (distance >= 1) {
            return MEDIUM;
        }
        return LOW;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
