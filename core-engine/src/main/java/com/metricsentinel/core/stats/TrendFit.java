package com.metricsentinel.core.stats;

/**
 * Ordinary least-squares line fitted to values against their sequence index.
 *
 * @since 1.0.0
 */
public final class TrendFit {

    private final double slope;
    private final double intercept;
    private final double rSquared;

    TrendFit(double slope, double intercept, double rSquared) {
        this.slope = slope;
        this.intercept = intercept;
        this.rSquared = rSquared;
    }

    public double getSlope() {
        return slope;
    }

    public double getIntercept() {
        return intercept;
    }

    public double getRSquared() {
        return rSquared;
    }

    @Override
    public String toString() {
        return "TrendFit{slope=" + slope + ", intercept=" + intercept + ", rSquared=" + rSquared + '}';
    }
}
