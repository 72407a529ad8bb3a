/**
 * Domain model classes for Metric Sentinel.
 *
 * <p>
 * Every type in this package is immutable once constructed:
 * </p>
 * <ul>
 * <li>{@link com.metricsentinel.core.model.DataPoint}: one timestamped
 * sample</li>
 * <li>{@link com.metricsentinel.core.model.Statistics} /
 * {@link com.metricsentinel.core.model.Baseline}: descriptive statistics of a
 * window</li>
 * <li>{@link com.metricsentinel.core.model.AnomalyDetail} with its typed
 * {@link com.metricsentinel.core.model.AnomalyDetails} payloads: one
 * triggered detection method</li>
 * <li>{@link com.metricsentinel.core.model.AnomalyEvaluation}: outcome of a
 * detection request</li>
 * <li>{@link com.metricsentinel.core.model.AnomalyHistoryEntry},
 * {@link com.metricsentinel.core.model.SeasonalityResult},
 * {@link com.metricsentinel.core.model.MetricAnalysis}: reporting types</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.metricsentinel.core.model;
