package com.metricsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Detection method that produced an {@link AnomalyDetail}.
 *
 * @since 1.0.0
 */
public enum AnomalyType {

    /** Distance from the baseline mean in standard deviations. */
    ZSCORE,

    /** Tukey fences around the interquartile range. */
    IQR,

    /** Slope of the most recent samples. */
    TREND;

    /**
     * @return lower-case name used in serialized output
     */
    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
