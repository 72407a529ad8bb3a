package com.metricsentinel.core.serialization;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts analyzer results to JSON for external sinks.
 *
 * <p>
 * Handles {@link com.metricsentinel.core.model.AnomalyEvaluation},
 * {@link com.metricsentinel.core.model.AnomalyHistoryEntry},
 * {@link com.metricsentinel.core.model.MetricAnalysis},
 * {@link com.metricsentinel.core.model.Baseline} and the other model types.
 * Enum values are written lower-case and {@code null} fields are omitted.
 * </p>
 *
 * <p>
 * Instances are thread-safe once constructed.
 * </p>
 *
 * @since 1.0.0
 */
public class AnalysisJsonMapper {

    private static final Logger LOG = LoggerFactory.getLogger(AnalysisJsonMapper.class);

    private final ObjectMapper mapper;

    public AnalysisJsonMapper() {
        this.mapper = new ObjectMapper();
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        mapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
    }

    /**
     * Serialize a result to a JSON string.
     *
     * @param result the object to serialize
     * @return JSON text
     * @throws IllegalStateException if the object cannot be serialized
     */
    public String toJson(Object result) {
        try {
            return mapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize "
                    + (result == null ? "null" : result.getClass().getSimpleName()) + ": " + e.getMessage(), e);
        }
    }

    /**
     * Serialize a result to UTF-8 JSON bytes.
     *
     * <p>
     * Failures are logged and yield an empty array so that a sink can skip the
     * record without aborting.
     * </p>
     *
     * @param result the object to serialize
     * @return JSON bytes, or an empty array on failure
     */
    public byte[] toBytes(Object result) {
        try {
            return mapper.writeValueAsBytes(result);
        } catch (JsonProcessingException e) {
            LOG.error("Failed to serialize result: {}", e.getMessage(), e);
            return new byte[0];
        }
    }
}
