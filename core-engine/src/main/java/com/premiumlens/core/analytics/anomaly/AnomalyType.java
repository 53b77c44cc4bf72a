package com.premiumlens.core.analytics.anomaly;

/**
 * @since 1.0.0
 */
public enum AnomalyType {
    /** Above the expected range. */
    HIGH,
    /** Below the expected range. */
    LOW
}
