package com.metricsentinel.core.detection;

import com.metricsentinel.core.model.Baseline;
import com.metricsentinel.core.model.DataPoint;

import java.util.List;
import java.util.Objects;

/**
 * Inputs of a single detection pass: the sample under test, the metric's
 * baseline and its current window.
 *
 * @since 1.0.0
 */
public final class DetectionContext {

    private final String metricName;
    private final double value;
    private final long timestamp;
    private final Baseline baseline;
    private final List<DataPoint> window;

    /**
     * @param metricName metric name; must not be {@code null}
     * @param value      sample value
     * @param timestamp  sample timestamp (epoch millis)
     * @param baseline   the metric's baseline; must not be {@code null}
     * @param window     the metric's window, oldest first; must not be
     *                   {@code null}
     */
    public DetectionContext(String metricName, double value, long timestamp,
                            Baseline baseline, List<DataPoint> window) {
        this.metricName = Objects.requireNonNull(metricName, "Metric name must not be null");
        this.value = value;
        this.timestamp = timestamp;
        this.baseline = Objects.requireNonNull(baseline, "Baseline must not be null");
        this.window = Objects.requireNonNull(window, "Window must not be null");
    }

    public String getMetricName() {
        return metricName;
    }

    public double getValue() {
        return value;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public Baseline getBaseline() {
        return baseline;
    }

    public List<DataPoint> getWindow() {
        return window;
    }
}
