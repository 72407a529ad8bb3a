package com.metricsentinel.core.model;

/**
 * Diagnostics for an {@link AnomalyType#IQR} anomaly.
 *
 * @since 1.0.0
 */
public final class IqrDetails implements AnomalyDetails {

    private static final long serialVersionUID = 1L;

    private final double value;
    private final double lowerBound;
    private final double upperBound;
    private final double q1;
    private final double q3;
    private final double iqr;

    /** Overshoot beyond the violated fence, in units of IQR. */
    private final double distance;

    public IqrDetails(double value, double lowerBound, double upperBound,
                      double q1, double q3, double iqr, double distance) {
        this.value = value;
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
        this.q1 = q1;
        this.q3 = q3;
        this.iqr = iqr;
        this.distance = distance;
    }

    @Override
    public AnomalyType getType() {
        return AnomalyType.IQR;
    }

    public double getValue() {
        return value;
    }

    public double getLowerBound() {
        return lowerBound;
    }

    public double getUpperBound() {
        return upperBound;
    }

    public double getQ1() {
        return q1;
    }

    public double getQ3() {
        return q3;
    }

    public double getIqr() {
        return iqr;
    }

    public double getDistance() {
        return distance;
    }

    @Override
    public String toString() {
        return String.format("IqrDetails{value=%.3f, bounds=[%.3f, %.3f], iqr=%.3f, distance=%.3f}",
                value, lowerBound, upperBound, iqr, distance);
    }
}
