package com.metricsentinel.core.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Typed, immutable configuration of a
 * {@link com.metricsentinel.core.engine.MetricAnalyzer}.
 *
 * <p>
 * Every recognized option is a field with an explicit default. Options the
 * analyzer does not know are kept in {@link #getExtensions()} untouched, so
 * that callers can carry their own settings in the same document.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #defaults()}, the {@link Builder}, or
 * {@link AnalyzerConfigLoader} for YAML sources. The builder validates
 * inputs at {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnalyzerConfig {

    public static final int DEFAULT_WINDOW_SIZE = 100;
    public static final double DEFAULT_SENSITIVITY = 2.0;
    public static final int DEFAULT_MIN_DATA_POINTS = 10;
    public static final int DEFAULT_HISTORY_CAPACITY = 100;

    /** Upper bound for {@code historyCapacity}. */
    public static final int MAX_HISTORY_CAPACITY = 100;

    public static final int DEFAULT_SEASONALITY_PERIOD = 24;

    /** Maximum number of samples retained per metric. */
    private final int windowSize;

    /** Z-score threshold. */
    private final double sensitivity;

    /** Window length at which a baseline is first computed. */
    private final int minDataPoints;

    private final boolean enableTrendAnalysis;
    private final boolean enableSeasonalityDetection;

    /** Maximum number of anomaly history entries retained per metric. */
    private final int historyCapacity;

    /** Lag used by the analysis report's seasonality check. */
    private final int seasonalityPeriod;

    private final Map<String, Object> extensions;

    private AnalyzerConfig(Builder b) {
        this.windowSize = b.windowSize;
        this.sensitivity = b.sensitivity;
        this.minDataPoints = b.minDataPoints;
        this.enableTrendAnalysis = b.enableTrendAnalysis;
        this.enableSeasonalityDetection = b.enableSeasonalityDetection;
        this.historyCapacity = b.historyCapacity;
        this.seasonalityPeriod = b.seasonalityPeriod;
        this.extensions = Collections.unmodifiableMap(new LinkedHashMap<>(b.extensions));
    }

    /**
     * @return configuration with every option at its default
     */
    public static AnalyzerConfig defaults() {
        return new Builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder pre-populated with this configuration's values
     */
    public Builder toBuilder() {
        Builder b = new Builder()
                .windowSize(windowSize)
                .sensitivity(sensitivity)
                .minDataPoints(minDataPoints)
                .enableTrendAnalysis(enableTrendAnalysis)
                .enableSeasonalityDetection(enableSeasonalityDetection)
                .historyCapacity(historyCapacity)
                .seasonalityPeriod(seasonalityPeriod);
        extensions.forEach(b::extension);
        return b;
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public int getWindowSize() {
        return windowSize;
    }

    public double getSensitivity() {
        return sensitivity;
    }

    public int getMinDataPoints() {
        return minDataPoints;
    }

    public boolean isEnableTrendAnalysis() {
        return enableTrendAnalysis;
    }

    public boolean isEnableSeasonalityDetection() {
        return enableSeasonalityDetection;
    }

    public int getHistoryCapacity() {
        return historyCapacity;
    }

    public int getSeasonalityPeriod() {
        return seasonalityPeriod;
    }

    /**
     * @return unmodifiable map of unrecognized options, in declaration order
     */
    public Map<String, Object> getExtensions() {
        return extensions;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link AnalyzerConfig}.
     *
     * <p>
     * The {@link #build()} method validates that window size, minimum data
     * points, history capacity and seasonality period are positive, that the
     * history capacity does not exceed {@value AnalyzerConfig#MAX_HISTORY_CAPACITY}
     * and that the sensitivity is a positive finite number.
     * </p>
     */
    public static class Builder {
        private int windowSize = DEFAULT_WINDOW_SIZE;
        private double sensitivity = DEFAULT_SENSITIVITY;
        private int minDataPoints = DEFAULT_MIN_DATA_POINTS;
        private boolean enableTrendAnalysis = true;
        private boolean enableSeasonalityDetection = true;
        private int historyCapacity = DEFAULT_HISTORY_CAPACITY;
        private int seasonalityPeriod = DEFAULT_SEASONALITY_PERIOD;
        private final Map<String, Object> extensions = new LinkedHashMap<>();

        public Builder windowSize(int v) {
            this.windowSize = v;
            return this;
        }

        public Builder sensitivity(double v) {
            this.sensitivity = v;
            return this;
        }

        public Builder minDataPoints(int v) {
            this.minDataPoints = v;
            return this;
        }

        public Builder enableTrendAnalysis(boolean v) {
            this.enableTrendAnalysis = v;
            return this;
        }

        public Builder enableSeasonalityDetection(boolean v) {
            this.enableSeasonalityDetection = v;
            return this;
        }

        public Builder historyCapacity(int v) {
            this.historyCapacity = v;
            return this;
        }

        public Builder seasonalityPeriod(int v) {
            this.seasonalityPeriod = v;
            return this;
        }

        /**
         * Keep an option the analyzer itself does not interpret.
         *
         * @param key   option name; must not be {@code null}
         * @param value option value
         * @return this builder
         */
        public Builder extension(String key, Object value) {
            Objects.requireNonNull(key, "Extension key must not be null");
            extensions.put(key, value);
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link AnalyzerConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public AnalyzerConfig build() {
            requirePositive(windowSize, "windowSize");
            requirePositive(minDataPoints, "minDataPoints");
            requirePositive(historyCapacity, "historyCapacity");
            if (historyCapacity > MAX_HISTORY_CAPACITY) {
                throw new IllegalArgumentException("historyCapacity must be <= "
                        + MAX_HISTORY_CAPACITY + ", got: " + historyCapacity);
            }
            requirePositive(seasonalityPeriod, "seasonalityPeriod");
            if (!(sensitivity > 0) || Double.isInfinite(sensitivity)) {
                throw new IllegalArgumentException(
                        "sensitivity must be a finite number > 0, got: " + sensitivity);
            }
            return new AnalyzerConfig(this);
        }

        private static void requirePositive(int value, String name) {
            if (value <= 0) {
                throw new IllegalArgumentException(name + " must be > 0, got: " + value);
            }
        }
    }

    @Override
    public String toString() {
        return "AnalyzerConfig{" +
                "windowSize=" + windowSize +
                ", sensitivity=" + sensitivity +
                ", minDataPoints=" + minDataPoints +
                ", enableTrendAnalysis=" + enableTrendAnalysis +
                ", enableSeasonalityDetection=" + enableSeasonalityDetection +
                ", historyCapacity=" + historyCapacity +
                ", seasonalityPeriod=" + seasonalityPeriod +
                ", extensions=" + extensions.keySet() +
                '}';
    }
}
