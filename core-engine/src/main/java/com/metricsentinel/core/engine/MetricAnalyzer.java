package com.metricsentinel.core.engine;

import com.metricsentinel.core.config.AnalyzerConfig;
import com.metricsentinel.core.detection.AnomalyEvaluator;
import com.metricsentinel.core.detection.DetectorFactory;
import com.metricsentinel.core.history.AnomalyHistoryLog;
import com.metricsentinel.core.model.AnomalyEvaluation;
import com.metricsentinel.core.model.AnomalyHistoryEntry;
import com.metricsentinel.core.model.Baseline;
import com.metricsentinel.core.model.DataPoint;
import com.metricsentinel.core.model.MetricAnalysis;
import com.metricsentinel.core.model.SeasonalityResult;
import com.metricsentinel.core.recommend.RecommendationEngine;
import com.metricsentinel.core.stats.BaselineEstimator;
import com.metricsentinel.core.stats.CorrelationEngine;
import com.metricsentinel.core.stats.SeasonalityAnalyzer;
import com.metricsentinel.core.window.MetricWindow;
import com.metricsentinel.core.window.MetricWindowStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Entry point of the statistical engine.
 *
 * <p>
 * Callers push samples per metric name with {@link #addDataPoint} and ask
 * whether an observation deviates from the metric's learned behaviour with
 * {@link #detectAnomalies}. Every piece of state (windows, baselines,
 * anomaly histories) is owned by this instance and lives as long as it does.
 * </p>
 *
 * <h3>Ingestion</h3>
 * <p>
 * Each sample is appended to the metric's bounded window. Once the window
 * holds at least {@code minDataPoints} samples, the baseline is recomputed
 * from the whole window on every append.
 * </p>
 *
 * <h3>Detection</h3>
 * <p>
 * The sample is checked against the stored baseline by the detectors created
 * by {@link DetectorFactory}. Triggered evaluations are appended to the
 * metric's history and handed to every registered {@link AnomalyListener}.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * State is partitioned by metric name in concurrent maps, so work on distinct
 * metrics never contends. Mutations of the <strong>same</strong> metric
 * (append, detect, reset) must come from one writer at a time; callers that
 * fan in several writers for one metric need their own per-metric lock.
 * </p>
 *
 * @since 1.0.0
 */
public class MetricAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(MetricAnalyzer.class);

    /** History entries inspected by {@link #getAnalysis(String)}. */
    static final int ANALYSIS_HISTORY_LIMIT = AnomalyHistoryLog.DEFAULT_LIMIT;

    /** History entries echoed in an analysis report. */
    static final int ANALYSIS_RECENT_LIMIT = 5;

    private final AnalyzerConfig config;
    private final Clock clock;

    private final MetricWindowStore windowStore;
    private final Map<String, Baseline> baselines = new ConcurrentHashMap<>();
    private final AnomalyHistoryLog historyLog;

    private final BaselineEstimator baselineEstimator = new BaselineEstimator();
    private final AnomalyEvaluator evaluator;
    private final SeasonalityAnalyzer seasonalityAnalyzer = new SeasonalityAnalyzer();
    private final CorrelationEngine correlationEngine = new CorrelationEngine();
    private final RecommendationEngine recommendationEngine = new RecommendationEngine();

    private final List<AnomalyListener> listeners = new CopyOnWriteArrayList<>();

    public MetricAnalyzer() {
        this(AnalyzerConfig.defaults());
    }

    public MetricAnalyzer(AnalyzerConfig config) {
        this(config, Clock.systemUTC());
    }

    /**
     * @param config analyzer configuration; must not be {@code null}
     * @param clock  source of default timestamps and baseline stamps; must not
     *               be {@code null}
     */
    public MetricAnalyzer(AnalyzerConfig config, Clock clock) {
        this.config = Objects.requireNonNull(config, "AnalyzerConfig must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
        this.windowStore = new MetricWindowStore(config.getWindowSize());
        this.historyLog = new AnomalyHistoryLog(config.getHistoryCapacity());
        this.evaluator = new AnomalyEvaluator(DetectorFactory.createAll(config));
        LOG.info("Metric analyzer initialised: {}", config);
    }

    /**
     * Register a sink for detected anomalies.
     *
     * @param listener the listener; must not be {@code null}
     * @return this analyzer
     */
    public MetricAnalyzer addListener(AnomalyListener listener) {
        listeners.add(Objects.requireNonNull(listener, "AnomalyListener must not be null"));
        return this;
    }

    // ---------------------------------------------------------------
    // Ingestion
    // ---------------------------------------------------------------

    /**
     * Record a sample stamped with the current time.
     *
     * @see #addDataPoint(String, double, long)
     */
    public MetricAnalyzer addDataPoint(String metricName, double value) {
        return addDataPoint(metricName, value, clock.millis());
    }

    /**
     * Record a sample and refresh the metric's baseline when the window is
     * long enough.
     *
     * @param metricName metric name; must not be {@code null}
     * @param value      sample value; not validated
     * @param timestamp  sample timestamp (epoch millis)
     * @return this analyzer
     */
    public MetricAnalyzer addDataPoint(String metricName, double value, long timestamp) {
        MetricWindow window = windowStore.addDataPoint(metricName, value, timestamp);
        if (window.size() >= config.getMinDataPoints()) {
            updateBaseline(metricName, window);
        }
        return this;
    }

    private void updateBaseline(String metricName, MetricWindow window) {
        Baseline baseline = baselineEstimator.estimate(window, clock.millis());
        if (baseline != null) {
            baselines.put(metricName, baseline);
            LOG.trace("Metric [{}] baseline recomputed: {}", metricName, baseline);
        }
    }

    // ---------------------------------------------------------------
    // Detection
    // ---------------------------------------------------------------

    /**
     * Evaluate a sample stamped with the current time.
     *
     * @see #detectAnomalies(String, double, long)
     */
    public AnomalyEvaluation detectAnomalies(String metricName, double value) {
        return detectAnomalies(metricName, value, clock.millis());
    }

    /**
     * Check whether a sample deviates from the metric's baseline.
     *
     * <p>
     * The sample is <strong>not</strong> added to the window; call
     * {@link #addDataPoint} for that.
     * </p>
     *
     * @param metricName metric name; must not be {@code null}
     * @param value      sample value
     * @param timestamp  sample timestamp (epoch millis)
     * @return the evaluation; {@code isAnomaly=false} with reason
     *         {@value AnomalyEvaluation#INSUFFICIENT_BASELINE} before a
     *         baseline exists
     */
    public AnomalyEvaluation detectAnomalies(String metricName, double value, long timestamp) {
        Objects.requireNonNull(metricName, "Metric name must not be null");
        Baseline baseline = baselines.get(metricName);
        if (baseline == null) {
            LOG.trace("Metric [{}]: no baseline yet", metricName);
            return AnomalyEvaluation.insufficientBaseline();
        }

        AnomalyEvaluation evaluation = evaluator.evaluate(
                metricName, value, timestamp, baseline, getDataWindow(metricName));

        if (evaluation.isAnomaly()) {
            AnomalyHistoryEntry entry = AnomalyHistoryEntry.of(value, timestamp, evaluation);
            historyLog.append(metricName, entry);
            notifyListeners(metricName, entry);
        }
        return evaluation;
    }

    private void notifyListeners(String metricName, AnomalyHistoryEntry entry) {
        for (AnomalyListener listener : listeners) {
            try {
                listener.onAnomaly(metricName, entry);
            } catch (RuntimeException e) {
                LOG.warn("Anomaly listener {} failed for metric [{}]: {}",
                        listener.getClass().getName(), metricName, e.getMessage(), e);
            }
        }
    }

    // ---------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------

    /**
     * Build a full report on one metric.
     *
     * <p>
     * The report inspects the newest {@value #ANALYSIS_HISTORY_LIMIT} history
     * entries and echoes the newest {@value #ANALYSIS_RECENT_LIMIT} of them.
     * Seasonality uses the configured period, or is reported as absent when
     * seasonality detection is disabled.
     * </p>
     *
     * @param metricName metric name; must not be {@code null}
     * @return the analysis; never {@code null}, also for unknown metrics
     */
    public MetricAnalysis getAnalysis(String metricName) {
        Objects.requireNonNull(metricName, "Metric name must not be null");
        Baseline baseline = baselines.get(metricName);
        List<DataPoint> window = getDataWindow(metricName);
        List<AnomalyHistoryEntry> history = historyLog.recent(metricName, ANALYSIS_HISTORY_LIMIT);
        SeasonalityResult seasonality = config.isEnableSeasonalityDetection()
                ? detectSeasonality(metricName, config.getSeasonalityPeriod())
                : SeasonalityResult.insufficientData();

        Optional<DataPoint> latest = windowStore.get(metricName).flatMap(MetricWindow::latest);
        MetricAnalysis.WindowSummary windowSummary = new MetricAnalysis.WindowSummary(
                window.size(),
                latest.map(DataPoint::getValue).orElse(null),
                latest.map(DataPoint::getTimestamp).orElse(null));

        List<AnomalyHistoryEntry> recent = history.subList(
                Math.max(0, history.size() - ANALYSIS_RECENT_LIMIT), history.size());

        return new MetricAnalysis(
                metricName,
                baseline,
                windowSummary,
                new MetricAnalysis.HistorySummary(history.size(), recent),
                seasonality,
                recommendationEngine.generate(baseline, history, seasonality));
    }

    /**
     * @param metricName metric name; must not be {@code null}
     * @return the metric's latest baseline, empty if none was established
     */
    public Optional<Baseline> getBaseline(String metricName) {
        Objects.requireNonNull(metricName, "Metric name must not be null");
        return Optional.ofNullable(baselines.get(metricName));
    }

    /**
     * @return unmodifiable snapshot of every metric's baseline
     */
    public Map<String, Baseline> getAllBaselines() {
        return Map.copyOf(baselines);
    }

    public List<AnomalyHistoryEntry> getAnomalyHistory(String metricName) {
        return historyLog.recent(metricName);
    }

    /**
     * @param metricName metric name; must not be {@code null}
     * @param limit      maximum number of entries; must not be negative
     * @return the newest {@code limit} anomalies, oldest first
     */
    public List<AnomalyHistoryEntry> getAnomalyHistory(String metricName, int limit) {
        return historyLog.recent(metricName, limit);
    }

    /**
     * Correlate two metrics' windows position by position.
     *
     * @param metricA first metric; must not be {@code null}
     * @param metricB second metric; must not be {@code null}
     * @return the Pearson coefficient, {@code 0} for a constant window, or
     *         {@code null} if either window is missing or the lengths differ
     */
    public Double calculateCorrelation(String metricA, String metricB) {
        Optional<MetricWindow> a = windowStore.get(metricA);
        Optional<MetricWindow> b = windowStore.get(metricB);
        if (a.isEmpty() || b.isEmpty()) {
            return null;
        }
        return correlationEngine.correlate(a.get().values(), b.get().values());
    }

    /**
     * Check the metric's window for seasonality with the configured period.
     *
     * @see #detectSeasonality(String, int)
     */
    public SeasonalityResult detectSeasonality(String metricName) {
        return detectSeasonality(metricName, config.getSeasonalityPeriod());
    }

    /**
     * @param metricName metric name; must not be {@code null}
     * @param period     lag to test; must be positive
     * @return the result; no seasonality when the window is shorter than
     *         {@code 2 * period}
     */
    public SeasonalityResult detectSeasonality(String metricName, int period) {
        double[] values = windowStore.get(metricName)
                .map(MetricWindow::values)
                .orElseGet(() -> new double[0]);
        return seasonalityAnalyzer.detect(values, period);
    }

    /**
     * Forget everything known about a metric: window, baseline and history.
     *
     * @param metricName metric name; must not be {@code null}
     */
    public void resetBaseline(String metricName) {
        Objects.requireNonNull(metricName, "Metric name must not be null");
        baselines.remove(metricName);
        windowStore.remove(metricName);
        historyLog.clear(metricName);
        LOG.debug("Metric [{}] reset", metricName);
    }

    /**
     * @param metricName metric name; must not be {@code null}
     * @return unmodifiable snapshot of the window, empty for an unknown metric
     */
    public List<DataPoint> getDataWindow(String metricName) {
        return windowStore.get(metricName)
                .map(MetricWindow::snapshot)
                .orElse(List.of());
    }

    public AnalyzerConfig getConfig() {
        return config;
    }
}
