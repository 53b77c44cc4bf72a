package com.premiumlens.core.analytics.trend;

/**
 * Estimator used to fit a trend.
 *
 * @since 1.0.0
 */
public enum TrendMethod {
    /** Ordinary least squares line. */
    LINEAR,
    /** Centered moving average. */
    MOVING_AVERAGE,
    /** Exponential moving average. */
    EXPONENTIAL,
    /** Least-squares polynomial. */
    POLYNOMIAL
}
