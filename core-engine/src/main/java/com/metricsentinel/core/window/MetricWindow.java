package com.metricsentinel.core.window;

import com.metricsentinel.core.model.DataPoint;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Bounded FIFO of the most recent samples of one metric.
 *
 * <p>
 * Appending beyond {@code capacity} evicts the oldest sample. Arrival order
 * is preserved; there is no sampling or decimation.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * This class is <strong>not</strong> thread-safe. A window is expected to be
 * mutated by a single writer at a time.
 * </p>
 *
 * @since 1.0.0
 */
public final class MetricWindow {

    private final int capacity;

    /** Samples in arrival order, oldest first. */
    private final Deque<DataPoint> points;

    /**
     * @param capacity maximum number of samples retained; must be positive
     * @throws IllegalArgumentException if {@code capacity} is not positive
     */
    public MetricWindow(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0, got: " + capacity);
        }
        this.capacity = capacity;
        this.points = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    /**
     * Append a sample, evicting the oldest one if the window is full.
     *
     * @param point the sample
     * @return the window length after the append
     */
    public int append(DataPoint point) {
        points.addLast(point);
        if (points.size() > capacity) {
            points.pollFirst();
        }
        return points.size();
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public int getCapacity() {
        return capacity;
    }

    /**
     * @return the newest sample, empty if the window is empty
     */
    public Optional<DataPoint> latest() {
        return Optional.ofNullable(points.peekLast());
    }

    /**
     * @return sample values in arrival order
     */
    public double[] values() {
        double[] values = new double[points.size()];
        int i = 0;
        for (DataPoint p : points) {
            values[i++] = p.getValue();
        }
        return values;
    }

    /**
     * @return unmodifiable copy of all samples, oldest first
     */
    public List<DataPoint> snapshot() {
        return List.copyOf(points);
    }

    @Override
    public String toString() {
        return "MetricWindow{size=" + points.size() + ", capacity=" + capacity + '}';
    }
}
