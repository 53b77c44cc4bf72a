package com.premiumlens.core.analytics.anomaly;

import com.premiumlens.core.analytics.FiniteSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Median-absolute-deviation detector.
 *
 * <p>
 * Score = {@code 1.4826 · |x − median| / MAD}, the modified z-score; the
 * constant makes MAD comparable to a standard deviation for normal data. A
 * series with {@code MAD = 0} has no anomalies.
 * </p>
 *
 * @since 1.0.0
 */
public class MadDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(MadDetector.class);

    static final double CONSISTENCY_CONSTANT = 1.4826;

    private final double threshold;

    public MadDetector(double threshold) {
        this.threshold = DetectorFactory.requirePositive(threshold);
    }

    @Override
    public List<AnomalyPoint> detect(FiniteSeries series) {
        Objects.requireNonNull(series, "Series must not be null");
        SeriesStatistics stats = SeriesStatistics.of(series.values());
        if (stats.getMad() == 0) {
            return List.of();
        }

        List<AnomalyPoint> anomalies = new ArrayList<>();
        for (int i = 0; i < series.size(); i++) {
            double value = series.value(i);
            double score = CONSISTENCY_CONSTANT * Math.abs(value - stats.getMedian()) / stats.getMad();
            if (score > threshold) {
                AnomalyType type = value > stats.getMedian() ? AnomalyType.HIGH : AnomalyType.LOW;
                LOG.debug("MAD anomaly at {}: value={} median={} score={}", series.index(i), value,
                        stats.getMedian(), score);
                anomalies.add(new AnomalyPoint(series.index(i), value, score, type, AnomalyMethod.MAD));
            }
        }
        return anomalies;
    }

    @Override
    public AnomalyMethod getMethod() {
        return AnomalyMethod.MAD;
    }

    @Override
    public double getThreshold() {
        return threshold;
    }
}
