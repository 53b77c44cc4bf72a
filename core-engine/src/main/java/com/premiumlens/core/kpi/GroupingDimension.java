package com.premiumlens.core.kpi;

import com.premiumlens.core.model.InsuranceRecord;
import com.premiumlens.core.model.LabeledValue;

import java.util.Objects;

/**
 * Dimensions a record set can be partitioned by for per-group KPIs.
 *
 * @since 1.0.0
 */
public enum GroupingDimension {
    YEAR,
    WEEK,
    BRANCH,
    ORGANIZATION,
    CUSTOMER_CATEGORY,
    INSURANCE_TYPE,
    BUSINESS_TYPE,
    COVERAGE_TYPE,
    RENEWAL_STATUS,
    NEW_ENERGY,
    TRANSFERRED,
    VEHICLE_GRADE,
    HIGHWAY_RISK_GRADE,
    TERMINAL_SOURCE;

    /** Group key of records without a value on a nullable dimension. */
    public static final String UNSPECIFIED = "(unspecified)";

    /**
     * @param record source record; must not be {@code null}
     * @return the record's group key as display text, never {@code null}
     */
    public String keyOf(InsuranceRecord record) {
        Objects.requireNonNull(record, "Record must not be null");
        return switch (this) {
            case YEAR -> String.valueOf(record.getPolicyStartYear());
            case WEEK -> String.valueOf(record.getWeekNumber());
            case BRANCH -> label(record.getChengduBranch());
            case ORGANIZATION -> record.getThirdLevelOrganization();
            case CUSTOMER_CATEGORY -> record.getCustomerCategory();
            case INSURANCE_TYPE -> label(record.getInsuranceType());
            case BUSINESS_TYPE -> record.getBusinessTypeCategory();
            case COVERAGE_TYPE -> label(record.getCoverageType());
            case RENEWAL_STATUS -> label(record.getRenewalStatus());
            case NEW_ENERGY -> String.valueOf(record.isNewEnergyVehicle());
            case TRANSFERRED -> String.valueOf(record.isTransferredVehicle());
            case VEHICLE_GRADE -> label(record.getVehicleInsuranceGrade());
            case HIGHWAY_RISK_GRADE -> label(record.getHighwayRiskGrade());
            case TERMINAL_SOURCE -> record.getTerminalSource();
        };
    }

    private static String label(LabeledValue value) {
        return value == null ? UNSPECIFIED : value.label();
    }
}
