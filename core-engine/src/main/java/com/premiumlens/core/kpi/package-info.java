/**
 * KPI calculation: aggregation of record measures, the formula table, time
 * progress, increment mode, per-dimension and per-week breakdowns, the
 * formula catalog, period comparison and an optional memoization layer.
 *
 * <p>
 * {@link com.premiumlens.core.kpi.KpiEngine} is pure; only
 * {@link com.premiumlens.core.kpi.KpiCache} holds state.
 * </p>
 *
 * @since 1.0.0
 */
package com.premiumlens.core.kpi;
