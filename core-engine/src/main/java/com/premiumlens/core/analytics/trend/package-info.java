/**
 * Trend fitting over a numeric series: least-squares line and polynomial,
 * moving average and exponential smoothing, with optional forecast points.
 *
 * @since 1.0.0
 */
package com.premiumlens.core.analytics.trend;
