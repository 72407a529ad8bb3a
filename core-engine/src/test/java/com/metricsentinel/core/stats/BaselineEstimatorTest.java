package com.metricsentinel.core.stats;

import com.metricsentinel.core.model.Baseline;
import com.metricsentinel.core.model.DataPoint;
import com.metricsentinel.core.model.Statistics;
import com.metricsentinel.core.window.MetricWindow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link BaselineEstimator}.
 */
class BaselineEstimatorTest {

    private static final double EPS = 1e-9;

    private final BaselineEstimator estimator = new BaselineEstimator();

    @Test
    @DisplayName("Should compute reference statistics for 1..5")
    void shouldComputeReferenceStatistics() {
        Statistics stats = estimator.calculateStatistics(new double[] {1, 2, 3, 4, 5});

        assertThat(stats.getCount()).isEqualTo(5);
        assertThat(stats.getMean()).isCloseTo(3, within(EPS));
        assertThat(stats.getMedian()).isCloseTo(3, within(EPS));
        assertThat(stats.getVariance()).isCloseTo(2, within(EPS));
        assertThat(stats.getStandardDeviation()).isCloseTo(1.4142, within(1e-4));
        assertThat(stats.getQ1()).isCloseTo(2, within(EPS));
        assertThat(stats.getQ3()).isCloseTo(4, within(EPS));
        assertThat(stats.getIqr()).isCloseTo(2, within(EPS));
        assertThat(stats.getMin()).isEqualTo(1);
        assertThat(stats.getMax()).isEqualTo(5);
        assertThat(stats.getRange()).isEqualTo(4);
        assertThat(stats.getSkewness()).isCloseTo(0, within(EPS));
        assertThat(stats.getKurtosis()).isCloseTo(-1.3, within(EPS));
    }

    @Test
    @DisplayName("Should report zero spread and moments for a constant series")
    void shouldHandleConstantSeries() {
        Statistics stats = estimator.calculateStatistics(new double[] {7, 7, 7, 7, 7, 7});

        assertThat(stats.getStandardDeviation()).isZero();
        assertThat(stats.getVariance()).isZero();
        assertThat(stats.getSkewness()).isZero();
        assertThat(stats.getKurtosis()).isZero();
        assertThat(stats.getIqr()).isZero();
    }

    @Test
    @DisplayName("Should average the central pair for an even count")
    void shouldComputeEvenMedian() {
        Statistics stats = estimator.calculateStatistics(new double[] {4, 1, 3, 2});

        assertThat(stats.getMedian()).isCloseTo(2.5, within(EPS));
    }

    @Test
    @DisplayName("Should not depend on input order")
    void shouldSortBeforeOrderStatistics() {
        Statistics shuffled = estimator.calculateStatistics(new double[] {5, 1, 4, 2, 3});

        assertThat(shuffled.getQ1()).isCloseTo(2, within(EPS));
        assertThat(shuffled.getMedian()).isCloseTo(3, within(EPS));
        assertThat(shuffled.getQ3()).isCloseTo(4, within(EPS));
    }

    @Test
    @DisplayName("Should interpolate percentiles between ranks")
    void shouldInterpolatePercentile() {
        double[] sorted = {10, 20, 30, 40};

        assertThat(BaselineEstimator.percentile(sorted, 25)).isCloseTo(17.5, within(EPS));
        assertThat(BaselineEstimator.percentile(sorted, 0)).isCloseTo(10, within(EPS));
        assertThat(BaselineEstimator.percentile(sorted, 100)).isCloseTo(40, within(EPS));
    }

    @Test
    @DisplayName("Should clamp to the last element when the upper rank overruns")
    void shouldClampPercentile() {
        assertThat(BaselineEstimator.percentile(new double[] {10, 20, 30, 40}, 150)).isEqualTo(40);
    }

    @Test
    @DisplayName("Should report positive skew for a right tail")
    void shouldDetectRightSkew() {
        Statistics stats = estimator.calculateStatistics(new double[] {1, 1, 1, 1, 1, 1, 1, 1, 1, 50});

        assertThat(stats.getSkewness()).isGreaterThan(2);
        assertThat(stats.getKurtosis()).isGreaterThan(0);
    }

    @Test
    @DisplayName("Should return null for empty or null input")
    void shouldReturnNullForEmptyInput() {
        assertThat(estimator.calculateStatistics(new double[0])).isNull();
        assertThat(estimator.calculateStatistics((double[]) null)).isNull();
        assertThat(estimator.calculateStatistics(List.<DataPoint>of())).isNull();
    }

    @Test
    @DisplayName("Should extract values from data points")
    void shouldAcceptDataPoints() {
        Statistics stats = estimator.calculateStatistics(List.of(
                new DataPoint(2, 1), new DataPoint(4, 2), new DataPoint(6, 3)));

        assertThat(stats.getMean()).isCloseTo(4, within(EPS));
        assertThat(stats.getCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should stamp baselines with time and window length")
    void shouldStampBaseline() {
        MetricWindow window = new MetricWindow(10);
        for (int i = 1; i <= 5; i++) {
            window.append(new DataPoint(i, i));
        }

        Baseline baseline = estimator.estimate(window, 123_456L);

        assertThat(baseline.getLastUpdated()).isEqualTo(123_456L);
        assertThat(baseline.getDataPoints()).isEqualTo(5);
        assertThat(baseline.getMean()).isCloseTo(3, within(EPS));
    }
}
