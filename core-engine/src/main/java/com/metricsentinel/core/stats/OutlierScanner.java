package com.metricsentinel.core.stats;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Stateless outlier checks over an ad-hoc series of values.
 *
 * <p>
 * Unlike the baseline statistics, these helpers drop non-finite values first
 * and use the <strong>sample</strong> variance (divide by N-1). They are meant
 * for one-off scans of short series that are not tracked as metrics.
 * </p>
 *
 * @since 1.0.0
 */
public final class OutlierScanner {

    /** Default z-score threshold for {@link #detectOutliers(double[])}. */
    public static final double DEFAULT_THRESHOLD = 3.0;

    private OutlierScanner() {
        // utility class
    }

    /**
     * @param values raw values, may be {@code null}
     * @return the finite values in their original order
     */
    public static double[] sanitize(double[] values) {
        if (values == null) {
            return new double[0];
        }
        return Arrays.stream(values).filter(Double::isFinite).toArray();
    }

    /**
     * @return mean of the finite values, {@code 0} if there are none
     */
    public static double mean(double[] values) {
        double[] nums = sanitize(values);
        if (nums.length == 0) {
            return 0;
        }
        double sum = 0;
        for (double v : nums) {
            sum += v;
        }
        return sum / nums.length;
    }

    /**
     * @return sample variance of the finite values, {@code 0} for fewer than
     *         two values
     */
    public static double variance(double[] values) {
        double[] nums = sanitize(values);
        if (nums.length <= 1) {
            return 0;
        }
        double m = mean(nums);
        double sum = 0;
        for (double v : nums) {
            sum += (v - m) * (v - m);
        }
        return sum / (nums.length - 1);
    }

    public static double stdDev(double[] values) {
        return Math.sqrt(variance(values));
    }

    public static OutlierScan detectOutliers(double[] values) {
        return detectOutliers(values, DEFAULT_THRESHOLD);
    }

    /**
     * Flag every value whose |z| is at least {@code threshold}.
     *
     * @param values    raw values; non-finite entries are dropped and the
     *                  reported indexes refer to the sanitized series
     * @param threshold z-score threshold
     * @return outliers with the series mean and standard deviation; no
     *         outliers when the standard deviation is zero
     */
    public static OutlierScan detectOutliers(double[] values, double threshold) {
        double[] nums = sanitize(values);
        if (nums.length == 0) {
            return new OutlierScan(List.of(), 0, 0);
        }
        double mean = mean(nums);
        double std = stdDev(nums);
        if (std == 0) {
            return new OutlierScan(List.of(), mean, std);
        }

        List<Outlier> outliers = new ArrayList<>();
        for (int i = 0; i < nums.length; i++) {
            double z = Math.abs((nums[i] - mean) / std);
            if (z >= threshold) {
                outliers.add(new Outlier(nums[i], i, z));
            }
        }
        return new OutlierScan(outliers, mean, std);
    }

    public static LastPointCheck isLastPointAnomalous(double[] values) {
        return isLastPointAnomalous(values, DEFAULT_THRESHOLD);
    }

    /**
     * Compare the last value against the mean and standard deviation of all
     * values before it.
     *
     * @param values raw values; non-finite entries are dropped
     * @param k      z-score threshold
     * @return the check; never anomalous with fewer than three values or a
     *         zero standard deviation
     */
    public static LastPointCheck isLastPointAnomalous(double[] values, double k) {
        double[] nums = sanitize(values);
        if (nums.length < 3) {
            return new LastPointCheck(false, mean(nums), stdDev(nums), null, null);
        }
        double[] history = Arrays.copyOf(nums, nums.length - 1);
        double last = nums[nums.length - 1];
        double mean = mean(history);
        double std = stdDev(history);
        if (std == 0) {
            return new LastPointCheck(false, mean, std, last, null);
        }
        double z = Math.abs((last - mean) / std);
        return new LastPointCheck(z >= k, mean, std, last, z);
    }

    // ---------------------------------------------------------------
    // Result types
    // ---------------------------------------------------------------

    /**
     * One flagged value of a scan.
     */
    public static final class Outlier {
        private final double value;
        private final int index;
        private final double zScore;

        Outlier(double value, int index, double zScore) {
            this.value = value;
            this.index = index;
            this.zScore = zScore;
        }

        public double getValue() {
            return value;
        }

        public int getIndex() {
            return index;
        }

        public double getZScore() {
            return zScore;
        }

        @Override
        public String toString() {
            return "Outlier{value=" + value + ", index=" + index + ", zScore=" + zScore + '}';
        }
    }

    /**
     * Result of {@link #detectOutliers(double[], double)}.
     */
    public static final class OutlierScan {
        private final List<Outlier> outliers;
        private final double mean;
        private final double stdDev;

        OutlierScan(List<Outlier> outliers, double mean, double stdDev) {
            this.outliers = Collections.unmodifiableList(outliers);
            this.mean = mean;
            this.stdDev = stdDev;
        }

        public List<Outlier> getOutliers() {
            return outliers;
        }

        public double getMean() {
            return mean;
        }

        public double getStdDev() {
            return stdDev;
        }
    }

    /**
     * Result of {@link #isLastPointAnomalous(double[], double)}.
     */
    public static final class LastPointCheck {
        private final boolean anomalous;
        private final double mean;
        private final double stdDev;
        private final Double last;
        private final Double zScore;

        LastPointCheck(boolean anomalous, double mean, double stdDev, Double last, Double zScore) {
            this.anomalous = anomalous;
            this.mean = mean;
            this.stdDev = stdDev;
            this.last = last;
            this.zScore = zScore;
        }

        public boolean isAnomalous() {
            return anomalous;
        }

        /** @return mean of the values preceding the last one */
        public double getMean() {
            return mean;
        }

        public double getStdDev() {
            return stdDev;
        }

        /** @return the last value, or {@code null} with fewer than three values */
        public Double getLast() {
            return last;
        }

        /** @return |z| of the last value, or {@code null} if not computed */
        public Double getZScore() {
            return zScore;
        }
    }
}
