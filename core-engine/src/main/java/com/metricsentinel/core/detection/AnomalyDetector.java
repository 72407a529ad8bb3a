package com.metricsentinel.core.detection;

import com.metricsentinel.core.model.AnomalyDetail;
import com.metricsentinel.core.model.AnomalyType;

import java.util.Optional;

/**
 * Contract for a single anomaly detection method.
 * <p>
 * Implementations are <strong>stateless</strong>: everything they need is
 * carried by the {@link DetectionContext}, so one instance serves every
 * metric.
 * </p>
 */
public interface AnomalyDetector {

    /**
     * Evaluate a sample against its metric's baseline.
     *
     * @param context the sample, baseline and window
     * @return an {@link AnomalyDetail} if this method triggers, empty otherwise
     */
    Optional<AnomalyDetail> evaluate(DetectionContext context);

    /**
     * Return the method this detector implements.
     *
     * @return anomaly type
     */
    AnomalyType getType();
}
