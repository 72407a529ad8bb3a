package com.metricsentinel.core.stats;

import com.metricsentinel.core.model.SeasonalityResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Detects periodicity through the lag autocorrelation of a window.
 *
 * <p>
 * The autocorrelation at lag {@code p} is
 * {@code sum((x[i] - mean) * (x[i+p] - mean)) / ((N - p) * variance)} with
 * the population variance. A series is seasonal when the magnitude exceeds
 * {@value #SEASONALITY_THRESHOLD}.
 * </p>
 *
 * @since 1.0.0
 */
public final class SeasonalityAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(SeasonalityAnalyzer.class);

    /** Minimum |autocorrelation| for a series to count as seasonal. */
    public static final double SEASONALITY_THRESHOLD = 0.3;

    /**
     * @param values window values, oldest first; must not be {@code null}
     * @param period lag to test; must be positive
     * @return the result; {@link SeasonalityResult#insufficientData()} when
     *         fewer than {@code 2 * period} values are available
     * @throws IllegalArgumentException if {@code period} is not positive
     */
    public SeasonalityResult detect(double[] values, int period) {
        Objects.requireNonNull(values, "Values must not be null");
        if (period <= 0) {
            throw new IllegalArgumentException("period must be > 0, got: " + period);
        }

        int n = values.length;
        if (n < period * 2L) {
            LOG.trace("Seasonality skipped: {} value(s) < 2 * period {}", n, period);
            return SeasonalityResult.insufficientData();
        }

        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        double mean = sum / n;

        double sumSquaredDiff = 0;
        for (double v : values) {
            sumSquaredDiff += (v - mean) * (v - mean);
        }
        double variance = sumSquaredDiff / n;

        double autocorrelation = 0;
        // A flat series has no periodic component.
        if (variance != 0) {
            for (int i = 0; i < n - period; i++) {
                autocorrelation += (values[i] - mean) * (values[i + period] - mean);
            }
            autocorrelation /= (n - period) * variance;
        }

        boolean seasonal = Math.abs(autocorrelation) > SEASONALITY_THRESHOLD;
        if (seasonal) {
            LOG.debug("Seasonality detected: period={} autocorrelation={}", period, autocorrelation);
        }
        return SeasonalityResult.of(seasonal, autocorrelation, period);
    }
}
