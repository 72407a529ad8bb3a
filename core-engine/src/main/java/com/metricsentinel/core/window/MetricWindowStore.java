package com.metricsentinel.core.window;

import com.metricsentinel.core.model.DataPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns the bounded sample window of every metric, keyed by metric name.
 *
 * <p>
 * Windows are created lazily on the first sample of a metric. Values and
 * timestamps are stored exactly as supplied.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * The metric-to-window map is concurrent, so different metrics never contend.
 * Appends to the <em>same</em> metric must be serialized by the caller.
 * </p>
 *
 * @since 1.0.0
 */
public final class MetricWindowStore {

    private static final Logger LOG = LoggerFactory.getLogger(MetricWindowStore.class);

    private final int windowSize;
    private final Map<String, MetricWindow> windows = new ConcurrentHashMap<>();

    /**
     * @param windowSize capacity of every window; must be positive
     */
    public MetricWindowStore(int windowSize) {
        if (windowSize <= 0) {
            throw new IllegalArgumentException("windowSize must be > 0, got: " + windowSize);
        }
        this.windowSize = windowSize;
    }

    /**
     * Append a sample to a metric's window.
     *
     * @param metricName metric name; must not be {@code null}
     * @param value      sample value
     * @param timestamp  sample timestamp (epoch millis)
     * @return the metric's window after the append
     */
    public MetricWindow addDataPoint(String metricName, double value, long timestamp) {
        Objects.requireNonNull(metricName, "Metric name must not be null");
        MetricWindow window = windows.computeIfAbsent(metricName, name -> {
            LOG.debug("Creating window for metric [{}] with capacity {}", name, windowSize);
            return new MetricWindow(windowSize);
        });
        window.append(new DataPoint(value, timestamp));
        return window;
    }

    /**
     * @param metricName metric name
     * @return the metric's window, empty if no sample was ever recorded
     */
    public Optional<MetricWindow> get(String metricName) {
        Objects.requireNonNull(metricName, "Metric name must not be null");
        return Optional.ofNullable(windows.get(metricName));
    }

    /**
     * Drop a metric's window.
     *
     * @param metricName metric name
     * @return {@code true} if a window existed
     */
    public boolean remove(String metricName) {
        Objects.requireNonNull(metricName, "Metric name must not be null");
        return windows.remove(metricName) != null;
    }

    public int getWindowSize() {
        return windowSize;
    }
}
