package com.metricsentinel.core.stats;

import com.metricsentinel.core.model.DataPoint;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Linear-regression trend over the most recent samples of a window.
 *
 * <p>
 * Values are regressed against their position ({@code 0..n-1}), not against
 * their timestamps.
 * </p>
 *
 * @since 1.0.0
 */
public final class TrendAnalyzer {

    /** Number of most recent samples the short-window trend is fitted to. */
    public static final int TREND_WINDOW = 5;

    /**
     * Fit a trend to the newest {@value #TREND_WINDOW} samples.
     *
     * @param window samples, oldest first; must not be {@code null}
     * @return the fit, or empty when fewer than {@value #TREND_WINDOW}
     *         samples are available
     */
    public Optional<TrendFit> recentTrend(List<DataPoint> window) {
        Objects.requireNonNull(window, "Window must not be null");
        if (window.size() < TREND_WINDOW) {
            return Optional.empty();
        }
        double[] values = window.subList(window.size() - TREND_WINDOW, window.size()).stream()
                .mapToDouble(DataPoint::getValue)
                .toArray();
        return Optional.of(fit(values));
    }

    /**
     * Fit {@code value = slope * index + intercept} by least squares.
     *
     * <p>
     * R² is {@code 1 - SSres/SStot}. A flat series has {@code SStot = 0};
     * R² is then reported as {@code 1} if the line fits exactly and
     * {@code 0} otherwise.
     * </p>
     *
     * @param values at least two values
     * @return fitted line
     * @throws IllegalArgumentException if fewer than two values are given
     */
    public TrendFit fit(double[] values) {
        Objects.requireNonNull(values, "Values must not be null");
        int n = values.length;
        if (n < 2) {
            throw new IllegalArgumentException("At least 2 values are required for a trend, got: " + n);
        }

        double sumX = 0;
        double sumY = 0;
        double sumXY = 0;
        double sumXX = 0;
        for (int i = 0; i < n; i++) {
            sumX += i;
            sumY += values[i];
            sumXY += i * values[i];
            sumXX += (double) i * i;
        }

        double slope = (n * sumXY - sumX * sumY) / (n * sumXX - sumX * sumX);
        double intercept = (sumY - slope * sumX) / n;

        double yMean = sumY / n;
        double ssRes = 0;
        double ssTot = 0;
        for (int i = 0; i < n; i++) {
            double residual = values[i] - (slope * i + intercept);
            double deviation = values[i] - yMean;
            ssRes += residual * residual;
            ssTot += deviation * deviation;
        }

        double rSquared;
        if (ssTot == 0) {
            rSquared = ssRes == 0 ? 1 : 0;
        } else {
            rSquared = 1 - ssRes / ssTot;
        }
        return new TrendFit(slope, intercept, rSquared);
    }
}
