package com.metricsentinel.core.detection;

import com.metricsentinel.core.config.AnalyzerConfig;
import com.metricsentinel.core.model.AnomalyType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Factory that creates {@link AnomalyDetector} instances from an
 * {@link AnalyzerConfig}.
 *
 * <p>
 * This is the single point of extension when adding a detection method:
 * add the {@link AnomalyType} constant and create the corresponding detector
 * here.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorFactory {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorFactory.class);

    private DetectorFactory() {
        // utility class
    }

    /**
     * Create the detector for one method.
     *
     * @param type   the method; must not be {@code null}
     * @param config analyzer configuration; must not be {@code null}
     * @return a new detector
     */
    public static AnomalyDetector create(AnomalyType type, AnalyzerConfig config) {
        Objects.requireNonNull(type, "AnomalyType must not be null");
        Objects.requireNonNull(config, "AnalyzerConfig must not be null");

        return switch (type) {
            case ZSCORE -> new ZScoreDetector(config.getSensitivity());
            case IQR -> new IqrDetector();
            case TREND -> new TrendDetector();
        };
    }

    /**
     * Create every detector enabled by the configuration, in evaluation order:
     * z-score, IQR, then trend when trend analysis is enabled.
     *
     * <p>
     * The returned list is <strong>unmodifiable</strong>.
     * </p>
     *
     * @param config analyzer configuration; must not be {@code null}
     * @return unmodifiable list of detectors
     */
    public static List<AnomalyDetector> createAll(AnalyzerConfig config) {
        Objects.requireNonNull(config, "AnalyzerConfig must not be null");
        List<AnomalyDetector> detectors = new ArrayList<>();
        detectors.add(create(AnomalyType.ZSCORE, config));
        detectors.add(create(AnomalyType.IQR, config));
        if (config.isEnableTrendAnalysis()) {
            detectors.add(create(AnomalyType.TREND, config));
        }
        LOG.info("Created {} detector(s): {}", detectors.size(),
                detectors.stream().map(AnomalyDetector::getType).toList());
        return Collections.unmodifiableList(detectors);
    }
}
