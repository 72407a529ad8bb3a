package com.metricsentinel.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * A single timestamped observation of a metric.
 *
 * <p>
 * Instances are immutable once created. No validation is applied to the value
 * or timestamp: non-finite values are stored as-is and propagate through the
 * statistics computed from them.
 * </p>
 *
 * @since 1.0.0
 */
public final class DataPoint implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double value;

    /** Epoch milliseconds. */
    private final long timestamp;

    public DataPoint(double value, long timestamp) {
        this.value = value;
        this.timestamp = timestamp;
    }

    public double getValue() {
        return value;
    }

    public long getTimestamp() {
        return timestamp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DataPoint that))
            return false;
        return Double.compare(value, that.value) == 0 && timestamp == that.timestamp;
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, timestamp);
    }

    @Override
    public String toString() {
        return "DataPoint{value=" + value + ", timestamp=" + timestamp + '}';
    }
}
