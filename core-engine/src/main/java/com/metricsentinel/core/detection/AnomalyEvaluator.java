package com.metricsentinel.core.detection;

import com.metricsentinel.core.model.AnomalyDetail;
import com.metricsentinel.core.model.AnomalyEvaluation;
import com.metricsentinel.core.model.Baseline;
import com.metricsentinel.core.model.DataPoint;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs every configured {@link AnomalyDetector} against one sample.
 *
 * <p>
 * Methods are independent and combined with OR semantics: any triggered
 * method makes the sample an anomaly. Details are reported in detector order.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalyEvaluator {

    private final List<AnomalyDetector> detectors;

    /**
     * @param detectors detectors in evaluation order; must not be {@code null}
     */
    public AnomalyEvaluator(List<AnomalyDetector> detectors) {
        this.detectors = List.copyOf(Objects.requireNonNull(detectors, "Detectors must not be null"));
    }

    /**
     * Evaluate a sample.
     *
     * @param metricName metric name; must not be {@code null}
     * @param value      sample value
     * @param timestamp  sample timestamp (epoch millis)
     * @param baseline   current baseline, or {@code null} if none exists
     * @param window     current window, oldest first; must not be {@code null}
     * @return the evaluation; an insufficient-baseline result when
     *         {@code baseline} is {@code null}
     */
    public AnomalyEvaluation evaluate(String metricName, double value, long timestamp,
                                      Baseline baseline, List<DataPoint> window) {
        if (baseline == null) {
            return AnomalyEvaluation.insufficientBaseline();
        }

        DetectionContext context = new DetectionContext(metricName, value, timestamp, baseline, window);
        List<AnomalyDetail> anomalies = new ArrayList<>();
        for (AnomalyDetector detector : detectors) {
            detector.evaluate(context).ifPresent(anomalies::add);
        }
        return AnomalyEvaluation.of(anomalies, baseline);
    }
}
