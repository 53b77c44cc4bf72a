package com.premiumlens.core.analytics.anomaly;

import com.premiumlens.core.analytics.FiniteSeries;

import java.util.List;

/**
 * Contract for all anomaly detectors.
 * <p>
 * Implementations are <strong>stateless</strong>: a detector is configured
 * once with its threshold and can scan any number of series, concurrently if
 * needed.
 * </p>
 *
 * @since 1.0.0
 */
public interface AnomalyDetector {

    /**
     * Scan a series and return the values that fail the test.
     *
     * @param series finite values with their source positions
     * @return flagged points in series order, indexed by source position;
     *         empty when the series shows no spread
     */
    List<AnomalyPoint> detect(FiniteSeries series);

    /**
     * @return the test this detector applies
     */
    AnomalyMethod getMethod();

    /**
     * @return the score above which a value is flagged
     */
    double getThreshold();
}
