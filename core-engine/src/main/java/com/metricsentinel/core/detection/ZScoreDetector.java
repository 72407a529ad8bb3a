package com.metricsentinel.core.detection;

import com.metricsentinel.core.model.AnomalyDetail;
import com.metricsentinel.core.model.AnomalyType;
import com.metricsentinel.core.model.Baseline;
import com.metricsentinel.core.model.Severity;
import com.metricsentinel.core.model.ZScoreDetails;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Z-score detector.
 *
 * <p>
 * Fires when a value lies more than {@code sensitivity} standard deviations
 * from the baseline mean. Confidence is {@code min(z / sensitivity, 1)};
 * severity follows {@link Severity#fromZScore(double)}.
 * </p>
 *
 * <p>
 * A baseline with zero standard deviation makes the z-score undefined; the
 * check is skipped in that case.
 * </p>
 *
 * @since 1.0.0
 */
public class ZScoreDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(ZScoreDetector.class);

    private final double sensitivity;

    /**
     * @param sensitivity z-score threshold; must be positive
     * @throws IllegalArgumentException if {@code sensitivity} is not positive
     */
    public ZScoreDetector(double sensitivity) {
        if (!(sensitivity > 0)) {
            throw new IllegalArgumentException("sensitivity must be > 0, got: " + sensitivity);
        }
        this.sensitivity = sensitivity;
    }

    @Override
    public Optional<AnomalyDetail> evaluate(DetectionContext context) {
        Objects.requireNonNull(context, "DetectionContext must not be null");
        Baseline baseline = context.getBaseline();
        double stddev = baseline.getStandardDeviation();

        if (stddev == 0) {
            LOG.trace("Metric [{}]: zero standard deviation - z-score skipped", context.getMetricName());
            return Optional.empty();
        }

        double mean = baseline.getMean();
        double zScore = Math.abs(context.getValue() - mean) / stddev;

        if (zScore > sensitivity) {
            LOG.debug("Metric [{}] z-score fired: value={} mean={} stddev={} z={}",
                    context.getMetricName(), context.getValue(), mean, stddev, zScore);
            return Optional.of(new AnomalyDetail(
                    Severity.fromZScore(zScore),
                    Math.min(zScore / sensitivity, 1.0),
                    new ZScoreDetails(zScore, sensitivity, mean, stddev)));
        }

        return Optional.empty();
    }

    @Override
    public AnomalyType getType() {
        return AnomalyType.ZSCORE;
    }

    public double getSensitivity() {
        return sensitivity;
    }
}
