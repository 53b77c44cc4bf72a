package com.premiumlens.core.kpi;

/**
 * Sign of a period-over-period change.
 *
 * @since 1.0.0
 */
public enum ChangeDirection {
    UP, DOWN, FLAT
}
