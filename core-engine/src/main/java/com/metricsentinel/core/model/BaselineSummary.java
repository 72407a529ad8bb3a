package com.metricsentinel.core.model;

import java.io.Serializable;

/**
 * Baseline fields reported alongside an {@link AnomalyEvaluation}.
 *
 * @since 1.0.0
 */
public final class BaselineSummary implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double mean;
    private final double standardDeviation;
    private final long lastUpdated;

    public BaselineSummary(double mean, double standardDeviation, long lastUpdated) {
        this.mean = mean;
        this.standardDeviation = standardDeviation;
        this.lastUpdated = lastUpdated;
    }

    public double getMean() {
        return mean;
    }

    public double getStandardDeviation() {
        return standardDeviation;
    }

    public long getLastUpdated() {
        return lastUpdated;
    }

    @Override
    public String toString() {
        return "BaselineSummary{mean=" + mean
                + ", standardDeviation=" + standardDeviation
                + ", lastUpdated=" + lastUpdated + '}';
    }
}
