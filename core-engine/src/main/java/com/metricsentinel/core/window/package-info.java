/**
 * Bounded per-metric sample history.
 *
 * @since 1.0.0
 */
package com.metricsentinel.core.window;
