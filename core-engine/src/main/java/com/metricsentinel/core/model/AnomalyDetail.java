package com.metricsentinel.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * One triggered detection method within an {@link AnomalyEvaluation}.
 *
 * <p>
 * The {@link #getType() type} is taken from the {@link AnomalyDetails}
 * payload, so tag and payload can never disagree.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalyDetail implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Severity severity;
    private final double confidence;
    private final AnomalyDetails details;

    /**
     * @param severity   severity bucket; must not be {@code null}
     * @param confidence detection strength in [0, 1]
     * @param details    method-specific payload; must not be {@code null}
     * @throws IllegalArgumentException if {@code confidence} is outside [0, 1]
     */
    public AnomalyDetail(Severity severity, double confidence, AnomalyDetails details) {
        this.severity = Objects.requireNonNull(severity, "severity must not be null");
        this.details = Objects.requireNonNull(details, "details must not be null");
        if (confidence < 0 || confidence > 1) {
            throw new IllegalArgumentException("confidence must be in [0, 1], got: " + confidence);
        }
        this.confidence = confidence;
    }

    public AnomalyType getType() {
        return details.getType();
    }

    public Severity getSeverity() {
        return severity;
    }

    public double getConfidence() {
        return confidence;
    }

    public AnomalyDetails getDetails() {
        return details;
    }

    @Override
    public String toString() {
        return "AnomalyDetail{" +
                "type=" + getType() +
                ", severity=" + severity +
                ", confidence=" + confidence +
                ", details=" + details +
                '}';
    }
}
