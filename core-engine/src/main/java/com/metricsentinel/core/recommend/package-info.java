/**
 * Human-readable advisories derived from baselines, anomaly history and
 * seasonality.
 *
 * @since 1.0.0
 */
package com.metricsentinel.core.recommend;
