package com.metricsentinel.core.model;

/**
 * The learned statistics snapshot of a metric's window.
 *
 * <p>
 * A baseline is recomputed wholesale from the current window every time a
 * sample arrives once the window holds at least {@code minDataPoints}
 * samples. Only the latest snapshot per metric is kept.
 * </p>
 *
 * @since 1.0.0
 */
public final class Baseline extends Statistics {

    private static final long serialVersionUID = 1L;

    /** Epoch millis of the recomputation. */
    private final long lastUpdated;

    /** Window length at recomputation time. */
    private final int dataPoints;

    public Baseline(Statistics statistics, long lastUpdated, int dataPoints) {
        super(statistics);
        this.lastUpdated = lastUpdated;
        this.dataPoints = dataPoints;
    }

    public long getLastUpdated() {
        return lastUpdated;
    }

    public int getDataPoints() {
        return dataPoints;
    }

    /**
     * @return the subset of this baseline echoed back in evaluations
     */
    public BaselineSummary summary() {
        return new BaselineSummary(getMean(), getStandardDeviation(), lastUpdated);
    }

    @Override
    public String toString() {
        return "Baseline{" +
                "mean=" + getMean() +
                ", standardDeviation=" + getStandardDeviation() +
                ", dataPoints=" + dataPoints +
                ", lastUpdated=" + lastUpdated +
                '}';
    }
}
