/**
 * Anomaly detection over a numeric series.
 *
 * <p>
 * Three stateless detectors implement
 * {@link com.premiumlens.core.analytics.anomaly.AnomalyDetector}: z-score
 * (leave-one-out), interquartile range and median absolute deviation. Use
 * {@link com.premiumlens.core.analytics.anomaly.AnomalyDetection} as the
 * entry point.
 * </p>
 *
 * @since 1.0.0
 */
package com.premiumlens.core.analytics.anomaly;
