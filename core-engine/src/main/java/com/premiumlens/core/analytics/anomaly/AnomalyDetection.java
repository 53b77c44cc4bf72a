package com.premiumlens.core.analytics.anomaly;

import com.premiumlens.core.analytics.FiniteSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Entry point of anomaly detection over a numeric series.
 *
 * <p>
 * Non-finite values are skipped; a series with fewer than
 * {@link AnomalyOptions#getMinDataPoints()} finite values is not scanned.
 * Returned indices are positions in the caller's series.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalyDetection {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyDetection.class);

    private AnomalyDetection() {
        // utility class
    }

    public static List<AnomalyPoint> detect(double[] series, AnomalyOptions options) {
        return detect(FiniteSeries.of(series), options);
    }

    public static List<AnomalyPoint> detect(List<Double> series, AnomalyOptions options) {
        return detect(FiniteSeries.of(series), options);
    }

    /**
     * Summarize a scan.
     *
     * @param series    the scanned series
     * @param anomalies the scan's result
     */
    public static AnomalySummary summarize(double[] series, List<AnomalyPoint> anomalies) {
        Objects.requireNonNull(anomalies, "Anomalies must not be null");
        FiniteSeries finite = FiniteSeries.of(series);
        long high = anomalies.stream().filter(a -> a.getType() == AnomalyType.HIGH).count();
        return new AnomalySummary(finite.size(), anomalies.size(), high, anomalies.size() - high,
                SeriesStatistics.of(finite.values()));
    }

    private static List<AnomalyPoint> detect(FiniteSeries series, AnomalyOptions options) {
        Objects.requireNonNull(options, "AnomalyOptions must not be null");
        if (series.size() < options.getMinDataPoints()) {
            LOG.debug("Only {} finite value(s), need {} for {}", series.size(), options.getMinDataPoints(),
                    options.getMethod());
            return List.of();
        }
        AnomalyDetector detector = DetectorFactory.create(options.getMethod(), options.getThreshold());
        return detector.detect(series);
    }
}
