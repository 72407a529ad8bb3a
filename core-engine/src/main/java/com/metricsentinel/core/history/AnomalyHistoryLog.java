package com.metricsentinel.core.history;

import com.metricsentinel.core.model.AnomalyHistoryEntry;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bounded per-metric log of detected anomalies.
 *
 * <p>
 * Each metric keeps at most {@code capacity} entries; appending to a full log
 * drops the oldest entry.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Metrics are partitioned in a concurrent map. Writes for the same metric must
 * be serialized by the caller.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalyHistoryLog {

    /** Entries returned by {@link #recent(String)}. */
    public static final int DEFAULT_LIMIT = 50;

    private final int capacity;
    private final Map<String, Deque<AnomalyHistoryEntry>> histories = new ConcurrentHashMap<>();

    /**
     * @param capacity maximum entries retained per metric; must be positive
     */
    public AnomalyHistoryLog(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0, got: " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * Append an entry to a metric's log.
     *
     * @param metricName metric name; must not be {@code null}
     * @param entry      entry to append; must not be {@code null}
     */
    public void append(String metricName, AnomalyHistoryEntry entry) {
        Objects.requireNonNull(metricName, "Metric name must not be null");
        Objects.requireNonNull(entry, "Entry must not be null");
        Deque<AnomalyHistoryEntry> history = histories.computeIfAbsent(metricName, k -> new ArrayDeque<>());
        history.addLast(entry);
        if (history.size() > capacity) {
            history.pollFirst();
        }
    }

    public List<AnomalyHistoryEntry> recent(String metricName) {
        return recent(metricName, DEFAULT_LIMIT);
    }

    /**
     * Return the newest {@code limit} entries of a metric, oldest first.
     *
     * @param metricName metric name; must not be {@code null}
     * @param limit      maximum number of entries; must not be negative
     * @return unmodifiable list, empty for an unknown metric
     */
    public List<AnomalyHistoryEntry> recent(String metricName, int limit) {
        Objects.requireNonNull(metricName, "Metric name must not be null");
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0, got: " + limit);
        }
        Deque<AnomalyHistoryEntry> history = histories.get(metricName);
        if (history == null || history.isEmpty() || limit == 0) {
            return List.of();
        }
        List<AnomalyHistoryEntry> all = new ArrayList<>(history);
        return List.copyOf(all.subList(Math.max(0, all.size() - limit), all.size()));
    }

    /**
     * Drop a metric's log.
     *
     * @param metricName metric name; must not be {@code null}
     */
    public void clear(String metricName) {
        Objects.requireNonNull(metricName, "Metric name must not be null");
        histories.remove(metricName);
    }

    public int getCapacity() {
        return capacity;
    }
}
