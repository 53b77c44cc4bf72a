package com.premiumlens.core.analytics.anomaly;

import com.premiumlens.core.analytics.FiniteSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Z-score detector with leave-one-out statistics.
 *
 * <p>
 * Each value is scored against the mean and population standard deviation
 * of the <i>other</i> values, so a single extreme value cannot inflate the
 * spread it is measured against. When the other values are all equal their
 * spread is 0, so the value is scored with its whole-series z instead and
 * flagged only if that score exceeds the threshold as well.
 * </p>
 *
 * <p>
 * A series whose whole-series standard deviation is 0 has no anomalies.
 * </p>
 *
 * @since 1.0.0
 */
public class ZScoreDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(ZScoreDetector.class);

    private final double threshold;

    /**
     * @param threshold z above which a value is flagged
     * @throws IllegalArgumentException if {@code threshold <= 0}
     */
    public ZScoreDetector(double threshold) {
        this.threshold = DetectorFactory.requirePositive(threshold);
    }

    @Override
    public List<AnomalyPoint> detect(FiniteSeries series) {
        Objects.requireNonNull(series, "Series must not be null");
        double[] values = series.values();
        SeriesStatistics whole = SeriesStatistics.of(values);
        if (values.length < 2 || whole.getStdDev() == 0) {
            return List.of();
        }

        List<AnomalyPoint> anomalies = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            double value = values[i];
            SeriesStatistics others = SeriesStatistics.of(without(values, i));
            double deviation = value - others.getMean();

            if (deviation == 0) {
                continue;
            }
            double score = others.getStdDev() == 0
                    ? Math.abs(value - whole.getMean()) / whole.getStdDev()
                    : Math.abs(deviation) / others.getStdDev();
            if (score <= threshold) {
                continue;
            }
            AnomalyType type = deviation > 0 ? AnomalyType.HIGH : AnomalyType.LOW;
            LOG.debug("Z-score anomaly at {}: value={} mean={} stddev={} z={}",
                    series.index(i), value, others.getMean(), others.getStdDev(), score);
            anomalies.add(new AnomalyPoint(series.index(i), value, score, type, AnomalyMethod.ZSCORE));
        }
        return anomalies;
    }

    @Override
    public AnomalyMethod getMethod() {
        return AnomalyMethod.ZSCORE;
    }

    @Override
    public double getThreshold() {
        return threshold;
    }

    private static double[] without(double[] values, int skip) {
        double[] rest = new double[values.length - 1];
        System.arraycopy(values, 0, rest, 0, skip);
        System.arraycopy(values, skip + 1, rest, skip, values.length - skip - 1);
        return rest;
    }
}
