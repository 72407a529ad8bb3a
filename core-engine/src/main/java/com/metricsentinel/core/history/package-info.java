/**
 * Bounded per-metric anomaly history.
 *
 * @since 1.0.0
 */
package com.metricsentinel.core.history;
