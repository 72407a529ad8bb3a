package com.metricsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Diagnostics for a {@link AnomalyType#ZSCORE} anomaly.
 *
 * @since 1.0.0
 */
public final class ZScoreDetails implements AnomalyDetails {

    private static final long serialVersionUID = 1L;

    private final double zScore;
    private final double threshold;
    private final double mean;
    private final double standardDeviation;

    public ZScoreDetails(double zScore, double threshold, double mean, double standardDeviation) {
        this.zScore = zScore;
        this.threshold = threshold;
        this.mean = mean;
        this.standardDeviation = standardDeviation;
    }

    @Override
    public AnomalyType getType() {
        return AnomalyType.ZSCORE;
    }

    @JsonProperty("zScore")
    public double getZScore() {
        return zScore;
    }

    public double getThreshold() {
        return threshold;
    }

    public double getMean() {
        return mean;
    }

    public double getStandardDeviation() {
        return standardDeviation;
    }

    @Override
    public String toString() {
        return String.format("ZScoreDetails{zScore=%.3f, threshold=%.2f, mean=%.3f, stddev=%.3f}",
                zScore, threshold, mean, standardDeviation);
    }
}
