/**
 * Analyzer configuration.
 *
 * <p>
 * {@link com.metricsentinel.core.config.AnalyzerConfig} is the typed,
 * immutable option set; {@link com.metricsentinel.core.config.AnalyzerConfigLoader}
 * reads it from YAML and validates it on load.
 * </p>
 *
 * @since 1.0.0
 */
package com.metricsentinel.core.config;
