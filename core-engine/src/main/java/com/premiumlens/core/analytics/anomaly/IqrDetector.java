package com.premiumlens.core.analytics.anomaly;

import com.premiumlens.core.analytics.FiniteSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Interquartile-range detector.
 *
 * <p>
 * Flags values outside {@code [Q1 − t·IQR, Q3 + t·IQR]}. The score is the
 * distance past the violated fence in units of IQR. A series with
 * {@code IQR = 0} has no anomalies.
 * </p>
 *
 * @since 1.0.0
 */
public class IqrDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(IqrDetector.class);

    private final double threshold;

    public IqrDetector(double threshold) {
        this.threshold = DetectorFactory.requirePositive(threshold);
    }

    @Override
    public List<AnomalyPoint> detect(FiniteSeries series) {
        Objects.requireNonNull(series, "Series must not be null");
        SeriesStatistics stats = SeriesStatistics.of(series.values());
        double iqr = stats.getIqr();
        if (iqr == 0) {
            return List.of();
        }
        double lower = stats.getQ1() - threshold * iqr;
        double upper = stats.getQ3() + threshold * iqr;

        List<AnomalyPoint> anomalies = new ArrayList<>();
        for (int i = 0; i < series.size(); i++) {
            double value = series.value(i);
            if (value > upper) {
                anomalies.add(new AnomalyPoint(series.index(i), value, (value - upper) / iqr,
                        AnomalyType.HIGH, AnomalyMethod.IQR));
            } else if (value < lower) {
                anomalies.add(new AnomalyPoint(series.index(i), value, (lower - value) / iqr,
                        AnomalyType.LOW, AnomalyMethod.IQR));
            }
        }
        LOG.debug("IQR scan: fences [{}, {}], {} anomal(y/ies)", lower, upper, anomalies.size());
        return anomalies;
    }

    @Override
    public AnomalyMethod getMethod() {
        return AnomalyMethod.IQR;
    }

    @Override
    public double getThreshold() {
        return threshold;
    }
}
