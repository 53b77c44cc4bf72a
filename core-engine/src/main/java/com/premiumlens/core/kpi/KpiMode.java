package com.premiumlens.core.kpi;

/**
 * Whether KPIs describe the cumulative position or the week-over-week change.
 *
 * @since 1.0.0
 */
public enum KpiMode {
    /** Cumulative values of the selected period. */
    CURRENT,
    /** Change against the previous period, recomputed from delta sums. */
    INCREMENT
}
