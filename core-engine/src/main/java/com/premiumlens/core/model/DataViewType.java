package com.premiumlens.core.model;

/**
 * How KPI values are reported for the selected period.
 */
public enum DataViewType {
    /** Cumulative values as of the selected week. */
    CURRENT,
    /** Week-over-week change against the preceding week. */
    INCREMENT
}
