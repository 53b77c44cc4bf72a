package com.premiumlens.core.filter;

/**
 * The independently selectable filter dimensions of a
 * {@link com.premiumlens.core.model.FilterState}.
 *
 * @since 1.0.0
 */
public enum FilterDimension {
    YEAR,
    WEEK,
    ORGANIZATION,
    INSURANCE_TYPE,
    BUSINESS_TYPE,
    COVERAGE_TYPE,
    CUSTOMER_CATEGORY,
    VEHICLE_GRADE,
    TERMINAL_SOURCE,
    RENEWAL_STATUS,
    NEW_ENERGY
}
