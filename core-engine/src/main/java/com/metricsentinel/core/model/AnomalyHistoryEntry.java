package com.metricsentinel.core.model;

import java.io.Serializable;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A triggered evaluation recorded in a metric's anomaly history.
 *
 * @since 1.0.0
 */
public final class AnomalyHistoryEntry implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double value;
    private final long timestamp;
    private final List<AnomalyDetail> anomalies;
    private final double confidence;

    public AnomalyHistoryEntry(double value, long timestamp, List<AnomalyDetail> anomalies, double confidence) {
        this.value = value;
        this.timestamp = timestamp;
        this.anomalies = List.copyOf(Objects.requireNonNull(anomalies, "anomalies must not be null"));
        this.confidence = confidence;
    }

    /**
     * Record a triggered evaluation.
     *
     * @param value      the evaluated sample value
     * @param timestamp  the sample timestamp (epoch millis)
     * @param evaluation the evaluation; must not be {@code null}
     * @return new history entry
     */
    public static AnomalyHistoryEntry of(double value, long timestamp, AnomalyEvaluation evaluation) {
        Objects.requireNonNull(evaluation, "evaluation must not be null");
        return new AnomalyHistoryEntry(value, timestamp, evaluation.getAnomalies(), evaluation.getConfidence());
    }

    public double getValue() {
        return value;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public List<AnomalyDetail> getAnomalies() {
        return anomalies;
    }

    public double getConfidence() {
        return confidence;
    }

    public Optional<Severity> maxSeverity() {
        return anomalies.stream()
                .map(AnomalyDetail::getSeverity)
                .max(Comparator.naturalOrder());
    }

    @Override
    public String toString() {
        return "AnomalyHistoryEntry{" +
                "value=" + value +
                ", timestamp=" + timestamp +
                ", confidence=" + confidence +
                ", anomalies=" + anomalies.size() +
                '}';
    }
}
