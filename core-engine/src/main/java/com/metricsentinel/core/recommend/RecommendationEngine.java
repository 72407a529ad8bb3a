package com.metricsentinel.core.recommend;

import com.metricsentinel.core.model.AnomalyHistoryEntry;
import com.metricsentinel.core.model.Baseline;
import com.metricsentinel.core.model.SeasonalityResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Derives operator advisories from a metric's analysis state.
 *
 * <p>
 * Rules are checked in a fixed order and several may apply at once. Without a
 * baseline the only advisory is {@link #COLLECT_MORE_DATA}.
 * </p>
 *
 * @since 1.0.0
 */
public final class RecommendationEngine {

    public static final String COLLECT_MORE_DATA = "Collect more data to establish baseline";
    public static final String HIGH_ANOMALY_FREQUENCY =
            "High anomaly frequency detected - investigate root cause";
    public static final String HIGH_VARIABILITY =
            "High variability detected - consider data quality improvements";
    public static final String SKEWED_DISTRIBUTION =
            "Highly skewed distribution - consider log transformation";

    /** History size above which the anomaly frequency is considered high. */
    static final int HIGH_FREQUENCY_COUNT = 10;

    /** Coefficient of variation above which variability is considered high. */
    static final double HIGH_VARIABILITY_RATIO = 0.5;

    /** |skewness| above which a transformation is suggested. */
    static final double SKEWNESS_LIMIT = 2.0;

    /**
     * @param baseline       current baseline, or {@code null}
     * @param anomalyHistory recent anomalies; must not be {@code null}
     * @param seasonality    seasonality result; must not be {@code null}
     * @return unmodifiable ordered list of advisories
     */
    public List<String> generate(Baseline baseline, List<AnomalyHistoryEntry> anomalyHistory,
                                 SeasonalityResult seasonality) {
        Objects.requireNonNull(anomalyHistory, "Anomaly history must not be null");
        Objects.requireNonNull(seasonality, "Seasonality must not be null");

        if (baseline == null) {
            return List.of(COLLECT_MORE_DATA);
        }

        List<String> recommendations = new ArrayList<>();

        if (anomalyHistory.size() > HIGH_FREQUENCY_COUNT) {
            recommendations.add(HIGH_ANOMALY_FREQUENCY);
        }
        if (baseline.getStandardDeviation() > baseline.getMean() * HIGH_VARIABILITY_RATIO) {
            recommendations.add(HIGH_VARIABILITY);
        }
        if (seasonality.hasSeasonality()) {
            recommendations.add(seasonalPattern(seasonality.getPeriod()));
        }
        if (Math.abs(baseline.getSkewness()) > SKEWNESS_LIMIT) {
            recommendations.add(SKEWED_DISTRIBUTION);
        }

        return Collections.unmodifiableList(recommendations);
    }

    /**
     * @param period detected period
     * @return the seasonal-pattern advisory for that period
     */
    public static String seasonalPattern(Integer period) {
        return "Seasonal pattern detected (period: " + period + ") - adjust thresholds accordingly";
    }
}
