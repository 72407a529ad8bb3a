package com.metricsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of evaluating one sample against a metric's baseline.
 *
 * <p>
 * The evaluation is an anomaly when at least one detection method triggered.
 * Its confidence is the maximum confidence of the triggered methods, or
 * {@code 0} when none triggered.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalyEvaluation implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Reason reported when no baseline exists yet. */
    public static final String INSUFFICIENT_BASELINE = "Insufficient baseline data";

    private final boolean anomaly;
    private final String reason;
    private final List<AnomalyDetail> anomalies;
    private final double confidence;
    private final BaselineSummary baseline;

    private AnomalyEvaluation(String reason, List<AnomalyDetail> anomalies, BaselineSummary baseline) {
        this.reason = reason;
        this.anomalies = List.copyOf(anomalies);
        this.anomaly = !this.anomalies.isEmpty();
        this.confidence = this.anomalies.stream()
                .mapToDouble(AnomalyDetail::getConfidence)
                .max()
                .orElse(0);
        this.baseline = baseline;
    }

    /**
     * @return the evaluation returned before a baseline has been established
     */
    public static AnomalyEvaluation insufficientBaseline() {
        return new AnomalyEvaluation(INSUFFICIENT_BASELINE, List.of(), null);
    }

    /**
     * @param anomalies triggered details, in detection order; must not be
     *                  {@code null}
     * @param baseline  baseline the sample was compared against; must not be
     *                  {@code null}
     * @return evaluation over the given details
     */
    public static AnomalyEvaluation of(List<AnomalyDetail> anomalies, Baseline baseline) {
        Objects.requireNonNull(anomalies, "anomalies must not be null");
        Objects.requireNonNull(baseline, "baseline must not be null");
        return new AnomalyEvaluation(null, anomalies, baseline.summary());
    }

    @JsonProperty("isAnomaly")
    public boolean isAnomaly() {
        return anomaly;
    }

    /**
     * @return why no detection ran, or {@code null} when detection ran
     */
    public String getReason() {
        return reason;
    }

    /**
     * @return unmodifiable list of triggered details (possibly empty)
     */
    public List<AnomalyDetail> getAnomalies() {
        return anomalies;
    }

    public double getConfidence() {
        return confidence;
    }

    /**
     * @return baseline subset, or {@code null} when no baseline existed
     */
    public BaselineSummary getBaseline() {
        return baseline;
    }

    /**
     * @return the most severe triggered severity, empty when not an anomaly
     */
    public Optional<Severity> maxSeverity() {
        return anomalies.stream()
                .map(AnomalyDetail::getSeverity)
                .max(Comparator.naturalOrder());
    }

    @Override
    public String toString() {
        return "AnomalyEvaluation{" +
                "isAnomaly=" + anomaly +
                (reason != null ? ", reason='" + reason + '\'' : "") +
                ", confidence=" + confidence +
                ", anomalies=" + anomalies +
                '}';
    }
}
