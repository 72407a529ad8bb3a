/**
 * Closed-form statistics used by the analyzer.
 *
 * <ul>
 * <li>{@link com.metricsentinel.core.stats.BaselineEstimator}: descriptive
 * statistics of a window</li>
 * <li>{@link com.metricsentinel.core.stats.TrendAnalyzer}: least-squares
 * slope of the newest samples</li>
 * <li>{@link com.metricsentinel.core.stats.SeasonalityAnalyzer}: lag
 * autocorrelation</li>
 * <li>{@link com.metricsentinel.core.stats.CorrelationEngine}: Pearson
 * correlation of two windows</li>
 * <li>{@link com.metricsentinel.core.stats.OutlierScanner}: one-off z-score
 * scans of arbitrary series</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.metricsentinel.core.stats;
