package com.metricsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;

/**
 * Method-specific diagnostic payload of an {@link AnomalyDetail}.
 *
 * <p>
 * Each {@link AnomalyType} has exactly one implementation:
 * {@link ZScoreDetails}, {@link IqrDetails} and {@link TrendDetails}.
 * </p>
 *
 * @since 1.0.0
 */
public interface AnomalyDetails extends Serializable {

    /**
     * @return the detection method this payload belongs to
     */
    @JsonIgnore
    AnomalyType getType();
}
