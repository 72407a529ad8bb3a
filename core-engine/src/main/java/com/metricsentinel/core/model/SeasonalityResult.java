package com.metricsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Result of a lag autocorrelation check.
 *
 * <p>
 * When the window is too short for the requested period only
 * {@code hasSeasonality=false} is reported; the numeric fields are
 * {@code null}.
 * </p>
 *
 * @since 1.0.0
 */
public final class SeasonalityResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final SeasonalityResult INSUFFICIENT = new SeasonalityResult(false, null, null);

    private final boolean seasonal;
    private final Double autocorrelation;
    private final Integer period;

    private SeasonalityResult(boolean seasonal, Double autocorrelation, Integer period) {
        this.seasonal = seasonal;
        this.autocorrelation = autocorrelation;
        this.period = period;
    }

    public static SeasonalityResult insufficientData() {
        return INSUFFICIENT;
    }

    public static SeasonalityResult of(boolean seasonal, double autocorrelation, int period) {
        return new SeasonalityResult(seasonal, autocorrelation, period);
    }

    @JsonProperty("hasSeasonality")
    public boolean hasSeasonality() {
        return seasonal;
    }

    public Double getAutocorrelation() {
        return autocorrelation;
    }

    public Integer getPeriod() {
        return period;
    }

    /**
     * @return absolute autocorrelation, or {@code null} when not computed
     */
    public Double getStrength() {
        return autocorrelation == null ? null : Math.abs(autocorrelation);
    }

    @Override
    public String toString() {
        return "SeasonalityResult{" +
                "hasSeasonality=" + seasonal +
                ", autocorrelation=" + autocorrelation +
                ", period=" + period +
                '}';
    }
}
