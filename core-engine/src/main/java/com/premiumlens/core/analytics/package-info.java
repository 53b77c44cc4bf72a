/**
 * Series analytics over KPI values: trend fitting and anomaly detection.
 * Both sub-packages skip non-finite values and report positions in the
 * caller's series.
 *
 * @since 1.0.0
 */
package com.premiumlens.core.analytics;
