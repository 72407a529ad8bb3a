package com.metricsentinel.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Descriptive statistics over a set of metric values.
 *
 * <p>
 * Variance and the standardized moments are <strong>population</strong>
 * figures (divided by N). Kurtosis is reported as excess kurtosis.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@link Baseline} extends this class and adds the
 * recomputation stamp.
 * </p>
 *
 * @since 1.0.0
 */
public class Statistics implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int count;
    private final double mean;
    private final double median;
    private final double standardDeviation;
    private final double variance;
    private final double min;
    private final double max;
    private final double range;
    private final double q1;
    private final double q3;
    private final double iqr;
    private final double skewness;
    private final double kurtosis;

    private Statistics(Builder b) {
        this.count = b.count;
        this.mean = b.mean;
        this.median = b.median;
        this.standardDeviation = b.standardDeviation;
        this.variance = b.variance;
        this.min = b.min;
        this.max = b.max;
        this.range = b.range;
        this.q1 = b.q1;
        this.q3 = b.q3;
        this.iqr = b.iqr;
        this.skewness = b.skewness;
        this.kurtosis = b.kurtosis;
    }

    /**
     * Copy constructor for subclasses.
     *
     * @param other statistics to copy; must not be {@code null}
     */
    protected Statistics(Statistics other) {
        Objects.requireNonNull(other, "Statistics must not be null");
        this.count = other.count;
        this.mean = other.mean;
        this.median = other.median;
        this.standardDeviation = other.standardDeviation;
        this.variance = other.variance;
        this.min = other.min;
        this.max = other.max;
        this.range = other.range;
        this.q1 = other.q1;
        this.q3 = other.q3;
        this.iqr = other.iqr;
        this.skewness = other.skewness;
        this.kurtosis = other.kurtosis;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public int getCount() {
        return count;
    }

    public double getMean() {
        return mean;
    }

    public double getMedian() {
        return median;
    }

    public double getStandardDeviation() {
        return standardDeviation;
    }

    public double getVariance() {
        return variance;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    public double getRange() {
        return range;
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

    public double getSkewness() {
        return skewness;
    }

    public double getKurtosis() {
        return kurtosis;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link Statistics}.
     */
    public static class Builder {
        private int count;
        private double mean;
        private double median;
        private double standardDeviation;
        private double variance;
        private double min;
        private double max;
        private double range;
        private double q1;
        private double q3;
        private double iqr;
        private double skewness;
        private double kurtosis;

        public Builder count(int v) {
            this.count = v;
            return this;
        }

        public Builder mean(double v) {
            this.mean = v;
            return this;
        }

        public Builder median(double v) {
            this.median = v;
            return this;
        }

        public Builder standardDeviation(double v) {
            this.standardDeviation = v;
            return this;
        }

        public Builder variance(double v) {
            this.variance = v;
            return this;
        }

        public Builder min(double v) {
            this.min = v;
            return this;
        }

        public Builder max(double v) {
            this.max = v;
            return this;
        }

        public Builder range(double v) {
            this.range = v;
            return this;
        }

        public Builder q1(double v) {
            this.q1 = v;
            return this;
        }

        public Builder q3(double v) {
            this.q3 = v;
            return this;
        }

        public Builder iqr(double v) {
            this.iqr = v;
            return this;
        }

        public Builder skewness(double v) {
            this.skewness = v;
            return this;
        }

        public Builder kurtosis(double v) {
            this.kurtosis = v;
            return this;
        }

        public Statistics build() {
            return new Statistics(this);
        }
    }

    @Override
    public String toString() {
        return "Statistics{" +
                "count=" + count +
                ", mean=" + mean +
                ", median=" + median +
                ", standardDeviation=" + standardDeviation +
                ", min=" + min +
                ", max=" + max +
                ", q1=" + q1 +
                ", q3=" + q3 +
                ", skewness=" + skewness +
                ", kurtosis=" + kurtosis +
                '}';
    }
}
