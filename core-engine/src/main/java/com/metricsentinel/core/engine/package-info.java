/**
 * The analyzer facade and its outbound listener seam.
 *
 * <p>
 * {@link com.metricsentinel.core.engine.MetricAnalyzer} composes windows,
 * baselines, detectors, history and reporting into the operations exposed to
 * ingestion and monitoring layers. Detected anomalies are handed to
 * {@link com.metricsentinel.core.engine.AnomalyListener}s such as
 * {@link com.metricsentinel.core.engine.LoggingAnomalyListener}.
 * </p>
 *
 * @since 1.0.0
 */
package com.metricsentinel.core.engine;
