package com.metricsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Diagnostics for a {@link AnomalyType#TREND} anomaly.
 *
 * @since 1.0.0
 */
public final class TrendDetails implements AnomalyDetails {

    private static final long serialVersionUID = 1L;

    private final double slope;
    private final double intercept;
    private final double rSquared;
    private final double baselineStdDev;

    public TrendDetails(double slope, double intercept, double rSquared, double baselineStdDev) {
        this.slope = slope;
        this.intercept = intercept;
        this.rSquared = rSquared;
        this.baselineStdDev = baselineStdDev;
    }

    @Override
    public AnomalyType getType() {
        return AnomalyType.TREND;
    }

    public double getSlope() {
        return slope;
    }

    public double getIntercept() {
        return intercept;
    }

    @JsonProperty("rSquared")
    public double getRSquared() {
        return rSquared;
    }

    public double getBaselineStdDev() {
        return baselineStdDev;
    }

    @Override
    public String toString() {
        return String.format("TrendDetails{slope=%.3f, rSquared=%.3f, baselineStdDev=%.3f}",
                slope, rSquared, baselineStdDev);
    }
}
