package com.premiumlens.core.ingest;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The 26 columns every weekly extract must carry, in canonical export order.
 * Column order in an actual file is free.
 *
 * @since 1.0.0
 */
public enum CsvColumn {
    SNAPSHOT_DATE("snapshot_date"),
    POLICY_START_YEAR("policy_start_year"),
    BUSINESS_TYPE_CATEGORY("business_type_category"),
    CHENGDU_BRANCH("chengdu_branch"),
    THIRD_LEVEL_ORGANIZATION("third_level_organization"),
    CUSTOMER_CATEGORY_3("customer_category_3"),
    INSURANCE_TYPE("insurance_type"),
    IS_NEW_ENERGY_VEHICLE("is_new_energy_vehicle"),
    COVERAGE_TYPE("coverage_type"),
    IS_TRANSFERRED_VEHICLE("is_transferred_vehicle"),
    RENEWAL_STATUS("renewal_status"),
    VEHICLE_INSURANCE_GRADE("vehicle_insurance_grade"),
    HIGHWAY_RISK_GRADE("highway_risk_grade"),
    LARGE_TRUCK_SCORE("large_truck_score"),
    SMALL_TRUCK_SCORE("small_truck_score"),
    TERMINAL_SOURCE("terminal_source"),
    SIGNED_PREMIUM_YUAN("signed_premium_yuan"),
    MATURED_PREMIUM_YUAN("matured_premium_yuan"),
    POLICY_COUNT("policy_count"),
    CLAIM_CASE_COUNT("claim_case_count"),
    REPORTED_CLAIM_PAYMENT_YUAN("reported_claim_payment_yuan"),
    EXPENSE_AMOUNT_YUAN("expense_amount_yuan"),
    COMMERCIAL_PREMIUM_BEFORE_DISCOUNT_YUAN("commercial_premium_before_discount_yuan"),
    PREMIUM_PLAN_YUAN("premium_plan_yuan"),
    MARGINAL_CONTRIBUTION_AMOUNT_YUAN("marginal_contribution_amount_yuan"),
    WEEK_NUMBER("week_number");

    private static final Set<String> HEADERS;

    static {
        Set<String> headers = new LinkedHashSet<>();
        for (CsvColumn column : values()) {
            headers.add(column.header());
        }
        HEADERS = Collections.unmodifiableSet(headers);
    }

    private final String header;

    CsvColumn(String header) {
        this.header = header;
    }

    /**
     * @return the header name as it appears in the CSV
     */
    public String header() {
        return header;
    }

    /**
     * @return every required header name in canonical order
     */
    public static Set<String> headers() {
        return HEADERS;
    }
}
