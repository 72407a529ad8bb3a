package com.metricsentinel.core.stats;

/**
 * Pearson correlation between two metric windows.
 *
 * <p>
 * Values are paired by position: the i-th sample of one window with the i-th
 * sample of the other. Timestamps are not aligned.
 * </p>
 *
 * @since 1.0.0
 */
public final class CorrelationEngine {

    /**
     * @param a first series
     * @param b second series
     * @return the correlation coefficient; {@code 0} if either series is
     *         constant; {@code null} if either series is {@code null} or the
     *         lengths differ
     */
    public Double correlate(double[] a, double[] b) {
        if (a == null || b == null || a.length != b.length) {
            return null;
        }

        int n = a.length;
        double meanA = mean(a);
        double meanB = mean(b);

        double numerator = 0;
        double sumSqA = 0;
        double sumSqB = 0;
        for (int i = 0; i < n; i++) {
            double diffA = a[i] - meanA;
            double diffB = b[i] - meanB;
            numerator += diffA * diffB;
            sumSqA += diffA * diffA;
            sumSqB += diffB * diffB;
        }

        double denominator = Math.sqrt(sumSqA * sumSqB);
        return denominator == 0 ? 0.0 : numerator / denominator;
    }

    private static double mean(double[] values) {
        if (values.length == 0) {
            return 0;
        }
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }
}
