package com.metricsentinel.core.engine;

import com.metricsentinel.core.model.AnomalyHistoryEntry;
import com.metricsentinel.core.model.Severity;
import com.metricsentinel.core.serialization.AnalysisJsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * {@link AnomalyListener} that writes each anomaly as one JSON line through
 * SLF4J.
 *
 * <p>
 * Anomalies whose most severe method is {@link Severity#HIGH} or
 * {@link Severity#CRITICAL} are logged at WARN, all others at INFO. Route the
 * {@value #LOGGER_NAME} logger to the structured log sink.
 * </p>
 *
 * @since 1.0.0
 */
public class LoggingAnomalyListener implements AnomalyListener {

    /** Name of the logger anomalies are written to. */
    public static final String LOGGER_NAME = "com.metricsentinel.anomalies";

    private final Logger sink;
    private final AnalysisJsonMapper jsonMapper;

    public LoggingAnomalyListener() {
        this(LoggerFactory.getLogger(LOGGER_NAME), new AnalysisJsonMapper());
    }

    /**
     * @param sink       logger to write to; must not be {@code null}
     * @param jsonMapper encoder for the entries; must not be {@code null}
     */
    public LoggingAnomalyListener(Logger sink, AnalysisJsonMapper jsonMapper) {
        this.sink = Objects.requireNonNull(sink, "Logger must not be null");
        this.jsonMapper = Objects.requireNonNull(jsonMapper, "AnalysisJsonMapper must not be null");
    }

    @Override
    public void onAnomaly(String metricName, AnomalyHistoryEntry entry) {
        Severity severity = entry.maxSeverity().orElse(Severity.LOW);
        String json = jsonMapper.toJson(entry);
        if (severity.compareTo(Severity.HIGH) >= 0) {
            sink.warn("Anomaly detected metric={} severity={} entry={}", metricName, severity.wireName(), json);
        } else {
            sink.info("Anomaly detected metric={} severity={} entry={}", metricName, severity.wireName(), json);
        }
    }
}
