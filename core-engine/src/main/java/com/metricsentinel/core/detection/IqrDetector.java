package com.metricsentinel.core.detection;

import com.metricsentinel.core.model.AnomalyDetail;
import com.metricsentinel.core.model.AnomalyType;
import com.metricsentinel.core.model.Baseline;
import com.metricsentinel.core.model.IqrDetails;
import com.metricsentinel.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Interquartile-range (Tukey fence) detector.
 *
 * <p>
 * Fires when a value falls outside {@code [q1 - 1.5*iqr, q3 + 1.5*iqr]}. The
 * overshoot beyond the violated fence, divided by the IQR, drives both the
 * confidence ({@code min(distance / 2, 1)}) and the severity
 * ({@link Severity#fromDistance(double)}).
 * </p>
 *
 * @since 1.0.0
 */
public class IqrDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(IqrDetector.class);

    /** Fence multiplier applied to the IQR. */
    static final double FENCE_FACTOR = 1.5;

    @Override
    public Optional<AnomalyDetail> evaluate(DetectionContext context) {
        Objects.requireNonNull(context, "DetectionContext must not be null");
        Baseline baseline = context.getBaseline();
        double value = context.getValue();
        double iqr = baseline.getIqr();
        double lowerBound = baseline.getQ1() - FENCE_FACTOR * iqr;
        double upperBound = baseline.getQ3() + FENCE_FACTOR * iqr;

        if (!(value < lowerBound || value > upperBound)) {
            return Optional.empty();
        }

        double distance = value < lowerBound
                ? (lowerBound - value) / iqr
                : (value - upperBound) / iqr;

        LOG.debug("Metric [{}] IQR fired: value={} bounds=[{}, {}] distance={}",
                context.getMetricName(), value, lowerBound, upperBound, distance);

        return Optional.of(new AnomalyDetail(
                Severity.fromDistance(distance),
                Math.min(distance / 2, 1.0),
                new IqrDetails(value, lowerBound, upperBound,
                        baseline.getQ1(), baseline.getQ3(), iqr, distance)));
    }

    @Override
    public AnomalyType getType() {
        return AnomalyType.IQR;
    }
}
