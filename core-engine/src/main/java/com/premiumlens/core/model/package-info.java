/**
 * Domain model shared by every engine component.
 *
 * <ul>
 * <li>{@link com.premiumlens.core.model.InsuranceRecord}: one validated
 * policy-week observation</li>
 * <li>{@link com.premiumlens.core.model.FilterState}: AND-combination of
 * per-dimension inclusion sets plus view settings</li>
 * <li>{@link com.premiumlens.core.model.KpiResult}: flat KPI snapshot,
 * keyed by {@link com.premiumlens.core.model.KpiKey}</li>
 * </ul>
 *
 * <p>
 * Categorical columns with a fixed vocabulary are enums implementing
 * {@link com.premiumlens.core.model.LabeledValue}; free-text dimensions
 * (organization, customer category, business type, terminal source) stay
 * strings and are canonicalized by the normalizer.
 * </p>
 *
 * @since 1.0.0
 */
package com.premiumlens.core.model;
