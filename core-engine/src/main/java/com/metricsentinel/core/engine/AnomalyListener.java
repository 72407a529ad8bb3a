package com.metricsentinel.core.engine;

import com.metricsentinel.core.model.AnomalyHistoryEntry;

/**
 * Receives every anomaly recorded by a {@link MetricAnalyzer}.
 *
 * <p>
 * Listeners are the hand-off point to external sinks (structured logs,
 * alerting). They are called synchronously on the detecting thread, after the
 * entry has been appended to the metric's history. Exceptions thrown by a
 * listener are logged by the analyzer and never propagate to the caller.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface AnomalyListener {

    /**
     * @param metricName the metric the anomaly was detected on
     * @param entry      the recorded anomaly
     */
    void onAnomaly(String metricName, AnomalyHistoryEntry entry);
}
