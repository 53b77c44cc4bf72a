package com.premiumlens.core.analytics.trend;

/**
 * @since 1.0.0
 */
public enum TrendDirection {
    INCREASING, DECREASING, STABLE
}
