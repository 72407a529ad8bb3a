package com.metricsentinel.core.stats;

import com.metricsentinel.core.model.Baseline;
import com.metricsentinel.core.model.DataPoint;
import com.metricsentinel.core.model.Statistics;
import com.metricsentinel.core.window.MetricWindow;

import java.util.Arrays;
import java.util.Collection;
import java.util.Objects;

/**
 * Computes descriptive statistics over a window of metric values.
 *
 * <p>
 * Variance and the standardized moments use the population form (divide by
 * N). Percentiles interpolate linearly between the two closest ranks. When
 * the standard deviation is zero, skewness and kurtosis are reported as
 * {@code 0} rather than NaN.
 * </p>
 *
 * <p>
 * The estimator is stateless and therefore thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public final class BaselineEstimator {

    /**
     * Compute statistics over sample values.
     *
     * @param values sample values, in any order
     * @return statistics, or {@code null} for a {@code null} or empty input
     */
    public Statistics calculateStatistics(double[] values) {
        if (values == null || values.length == 0) {
            return null;
        }

        int n = values.length;
        double[] sorted = values.clone();
        Arrays.sort(sorted);

        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        double mean = sum / n;

        double sumSquaredDiff = 0;
        for (double v : values) {
            double diff = v - mean;
            sumSquaredDiff += diff * diff;
        }
        double variance = sumSquaredDiff / n;
        double standardDeviation = Math.sqrt(variance);

        double min = Arrays.stream(values).min().getAsDouble();
        double max = Arrays.stream(values).max().getAsDouble();
        double q1 = percentile(sorted, 25);
        double q3 = percentile(sorted, 75);

        return Statistics.builder()
                .count(n)
                .mean(mean)
                .median(median(sorted))
                .standardDeviation(standardDeviation)
                .variance(variance)
                .min(min)
                .max(max)
                .range(max - min)
                .q1(q1)
                .q3(q3)
                .iqr(q3 - q1)
                .skewness(standardizedMoment(values, mean, standardDeviation, 3))
                .kurtosis(kurtosis(values, mean, standardDeviation))
                .build();
    }

    /**
     * Compute statistics over the values of the given samples.
     *
     * @param points samples
     * @return statistics, or {@code null} for a {@code null} or empty input
     */
    public Statistics calculateStatistics(Collection<DataPoint> points) {
        if (points == null || points.isEmpty()) {
            return null;
        }
        return calculateStatistics(points.stream().mapToDouble(DataPoint::getValue).toArray());
    }

    /**
     * Compute a baseline snapshot over the full content of a window.
     *
     * @param window the window; must not be {@code null}
     * @param now    recomputation time (epoch millis)
     * @return baseline, or {@code null} if the window is empty
     */
    public Baseline estimate(MetricWindow window, long now) {
        Objects.requireNonNull(window, "Window must not be null");
        Statistics stats = calculateStatistics(window.values());
        return stats == null ? null : new Baseline(stats, now, window.size());
    }

    // ---------------------------------------------------------------
    // Order statistics
    // ---------------------------------------------------------------

    /**
     * @param sorted non-empty values sorted ascending
     * @return middle element, or the mean of the two central elements
     */
    static double median(double[] sorted) {
        int n = sorted.length;
        if (n % 2 == 0) {
            return (sorted[n / 2 - 1] + sorted[n / 2]) / 2;
        }
        return sorted[n / 2];
    }

    /**
     * Linear-interpolation percentile on index {@code p/100 * (N-1)}.
     *
     * @param sorted     non-empty values sorted ascending
     * @param percentile percentile in [0, 100]
     * @return interpolated value
     */
    static double percentile(double[] sorted, double percentile) {
        double index = (percentile / 100) * (sorted.length - 1);
        int lower = (int) Math.floor(index);
        int upper = (int) Math.ceil(index);
        double weight = index - lower;

        if (upper >= sorted.length) {
            return sorted[sorted.length - 1];
        }
        return sorted[lower] * (1 - weight) + sorted[upper] * weight;
    }

    // ---------------------------------------------------------------
    // Moments
    // ---------------------------------------------------------------

    private static double standardizedMoment(double[] values, double mean, double stddev, int order) {
        if (stddev == 0) {
            return 0;
        }
        double sum = 0;
        for (double v : values) {
            sum += Math.pow((v - mean) / stddev, order);
        }
        return sum / values.length;
    }

    /** Excess kurtosis: fourth standardized moment minus 3. */
    private static double kurtosis(double[] values, double mean, double stddev) {
        if (stddev == 0) {
            return 0;
        }
        return standardizedMoment(values, mean, stddev, 4) - 3;
    }
}
