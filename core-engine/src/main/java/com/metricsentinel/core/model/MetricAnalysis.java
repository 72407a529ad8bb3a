package com.metricsentinel.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;

/**
 * Point-in-time report on one metric: baseline, window, recent anomalies,
 * seasonality and advisories.
 *
 * @since 1.0.0
 */
public final class MetricAnalysis implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String metricName;
    private final Baseline baseline;
    private final WindowSummary currentWindow;
    private final HistorySummary anomalyHistory;
    private final SeasonalityResult seasonality;
    private final List<String> recommendations;

    public MetricAnalysis(String metricName, Baseline baseline, WindowSummary currentWindow,
                          HistorySummary anomalyHistory, SeasonalityResult seasonality,
                          List<String> recommendations) {
        this.metricName = Objects.requireNonNull(metricName, "metricName must not be null");
        this.baseline = baseline;
        this.currentWindow = Objects.requireNonNull(currentWindow, "currentWindow must not be null");
        this.anomalyHistory = Objects.requireNonNull(anomalyHistory, "anomalyHistory must not be null");
        this.seasonality = Objects.requireNonNull(seasonality, "seasonality must not be null");
        this.recommendations = List.copyOf(recommendations);
    }

    public String getMetricName() {
        return metricName;
    }

    /**
     * @return the baseline, or {@code null} if none has been established
     */
    public Baseline getBaseline() {
        return baseline;
    }

    public WindowSummary getCurrentWindow() {
        return currentWindow;
    }

    public HistorySummary getAnomalyHistory() {
        return anomalyHistory;
    }

    public SeasonalityResult getSeasonality() {
        return seasonality;
    }

    public List<String> getRecommendations() {
        return recommendations;
    }

    /**
     * Size and newest sample of the current window.
     */
    public static final class WindowSummary implements Serializable {

        private static final long serialVersionUID = 1L;

        private final int size;
        private final Double latestValue;
        private final Long latestTimestamp;

        public WindowSummary(int size, Double latestValue, Long latestTimestamp) {
            this.size = size;
            this.latestValue = latestValue;
            this.latestTimestamp = latestTimestamp;
        }

        public int getSize() {
            return size;
        }

        /** @return newest value, or {@code null} for an empty window */
        public Double getLatestValue() {
            return latestValue;
        }

        /** @return newest timestamp, or {@code null} for an empty window */
        public Long getLatestTimestamp() {
            return latestTimestamp;
        }
    }

    /**
     * Count of the inspected history slice and its most recent entries.
     */
    public static final class HistorySummary implements Serializable {

        private static final long serialVersionUID = 1L;

        private final int count;
        private final List<AnomalyHistoryEntry> recent;

        public HistorySummary(int count, List<AnomalyHistoryEntry> recent) {
            this.count = count;
            this.recent = List.copyOf(recent);
        }

        public int getCount() {
            return count;
        }

        public List<AnomalyHistoryEntry> getRecent() {
            return recent;
        }
    }

    @Override
    public String toString() {
        return "MetricAnalysis{" +
                "metricName='" + metricName + '\'' +
                ", windowSize=" + currentWindow.getSize() +
                ", anomalies=" + anomalyHistory.getCount() +
                ", seasonality=" + seasonality +
                ", recommendations=" + recommendations +
                '}';
    }
}
