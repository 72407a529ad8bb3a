/**
 * Pluggable anomaly detection methods.
 *
 * <p>
 * All methods implement the
 * {@link com.metricsentinel.core.detection.AnomalyDetector} interface and are
 * instantiated via {@link com.metricsentinel.core.detection.DetectorFactory}.
 * {@link com.metricsentinel.core.detection.AnomalyEvaluator} runs them
 * together. Built-in methods:
 * </p>
 * <ul>
 * <li>{@link com.metricsentinel.core.detection.ZScoreDetector}: distance from
 * the baseline mean in standard deviations</li>
 * <li>{@link com.metricsentinel.core.detection.IqrDetector}: 1.5 × IQR
 * fences</li>
 * <li>{@link com.metricsentinel.core.detection.TrendDetector}: slope of the
 * newest five samples</li>
 * </ul>
 *
 * <h3>Extending</h3>
 * <p>
 * To add a method, implement {@code AnomalyDetector}, add its
 * {@code AnomalyType} and typed details payload, and register it in
 * {@code DetectorFactory}.
 * </p>
 *
 * @since 1.0.0
 */
package com.metricsentinel.core.detection;
