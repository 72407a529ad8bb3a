package com.metricsentinel.core.detection;

import com.metricsentinel.core.model.AnomalyDetail;
import com.metricsentinel.core.model.AnomalyType;
import com.metricsentinel.core.model.Severity;
import com.metricsentinel.core.model.TrendDetails;
import com.metricsentinel.core.stats.TrendAnalyzer;
import com.metricsentinel.core.stats.TrendFit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Short-window trend detector.
 *
 * <p>
 * Fits a line to the newest {@value TrendAnalyzer#TREND_WINDOW} samples of the
 * metric's window and fires when the slope magnitude exceeds twice the
 * baseline standard deviation. Trend anomalies are always
 * {@link Severity#HIGH}.
 * </p>
 *
 * <p>
 * The sample under evaluation only takes part if the caller already added it
 * to the window.
 * </p>
 *
 * @since 1.0.0
 */
public class TrendDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(TrendDetector.class);

    /** Slope limit in units of baseline standard deviation. */
    static final double SLOPE_FACTOR = 2.0;

    private final TrendAnalyzer trendAnalyzer;

    public TrendDetector() {
        this(new TrendAnalyzer());
    }

    public TrendDetector(TrendAnalyzer trendAnalyzer) {
        this.trendAnalyzer = Objects.requireNonNull(trendAnalyzer, "TrendAnalyzer must not be null");
    }

    @Override
    public Optional<AnomalyDetail> evaluate(DetectionContext context) {
        Objects.requireNonNull(context, "DetectionContext must not be null");

        Optional<TrendFit> optFit = trendAnalyzer.recentTrend(context.getWindow());
        if (optFit.isEmpty()) {
            LOG.trace("Metric [{}]: fewer than {} samples - trend skipped",
                    context.getMetricName(), TrendAnalyzer.TREND_WINDOW);
            return Optional.empty();
        }

        TrendFit fit = optFit.get();
        double stddev = context.getBaseline().getStandardDeviation();
        double limit = SLOPE_FACTOR * stddev;
        double slope = Math.abs(fit.getSlope());

        if (slope > limit) {
            LOG.debug("Metric [{}] trend fired: slope={} limit={} rSquared={}",
                    context.getMetricName(), fit.getSlope(), limit, fit.getRSquared());
            double confidence = limit == 0 ? 1.0 : Math.min(slope / limit, 1.0);
            return Optional.of(new AnomalyDetail(
                    Severity.HIGH,
                    confidence,
                    new TrendDetails(fit.getSlope(), fit.getIntercept(), fit.getRSquared(), stddev)));
        }

        return Optional.empty();
    }

    @Override
    public AnomalyType getType() {
        return AnomalyType.TREND;
    }
}
