/**
 * JSON encoding of analyzer results for logging and alerting sinks.
 *
 * @since 1.0.0
 */
package com.metricsentinel.core.serialization;
