package com.premiumlens.core.model;

/**
 * Whether a query looks at one selected week or a multi-week trend.
 */
public enum ViewMode {
    SINGLE,
    TREND
}
