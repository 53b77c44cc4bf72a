package com.premiumlens.core.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.LocalDate;
import java.util.Objects;

/**
 * One policy-week observation parsed from a weekly CSV extract.
 *
 * <p>
 * Instances are created once per valid CSV row and never mutated. JSON
 * property names follow the CSV column names so that a record serializes
 * back to the shape it was read from.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. Dimension strings, the snapshot date and the
 * categorical enums are <strong>required</strong>; the four grade fields and
 * {@code premiumPlanYuan} are nullable.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
@JsonPropertyOrder({
        "snapshot_date", "policy_start_year", "week_number", "chengdu_branch",
        "third_level_organization", "customer_category_3", "insurance_type",
        "business_type_category", "coverage_type", "renewal_status",
        "is_new_energy_vehicle", "is_transferred_vehicle", "vehicle_insurance_grade",
        "highway_risk_grade", "large_truck_score", "small_truck_score", "terminal_source",
        "signed_premium_yuan", "matured_premium_yuan", "policy_count", "claim_case_count",
        "reported_claim_payment_yuan", "expense_amount_yuan",
        "commercial_premium_before_discount_yuan", "premium_plan_yuan",
        "marginal_contribution_amount_yuan" })
public final class InsuranceRecord {

    // ---------------------------------------------------------------
    // Time
    // ---------------------------------------------------------------
    private final LocalDate snapshotDate;
    private final int policyStartYear;
    private final int weekNumber;

    // ---------------------------------------------------------------
    // Dimensions
    // ---------------------------------------------------------------
    private final Branch chengduBranch;
    private final String thirdLevelOrganization;
    private final String customerCategory;
    private final InsuranceType insuranceType;
    private final String businessTypeCategory;
    private final CoverageType coverageType;
    private final RenewalStatus renewalStatus;
    private final boolean newEnergyVehicle;
    private final boolean transferredVehicle;
    private final VehicleGrade vehicleInsuranceGrade;
    private final HighwayRiskGrade highwayRiskGrade;
    private final TruckScore largeTruckScore;
    private final TruckScore smallTruckScore;
    private final String terminalSource;

    // ---------------------------------------------------------------
    // Measures
    // ---------------------------------------------------------------
    private final double signedPremiumYuan;
    private final double maturedPremiumYuan;
    private final long policyCount;
    private final long claimCaseCount;
    private final double reportedClaimPaymentYuan;
    private final double expenseAmountYuan;
    private final double commercialPremiumBeforeDiscountYuan;
    private final Double premiumPlanYuan;
    private final double marginalContributionAmountYuan;

    private InsuranceRecord(Builder b) {
        this.snapshotDate = Objects.requireNonNull(b.snapshotDate, "snapshotDate must not be null");
        this.policyStartYear = b.policyStartYear;
        this.weekNumber = b.weekNumber;
        this.chengduBranch = Objects.requireNonNull(b.chengduBranch, "chengduBranch must not be null");
        this.thirdLevelOrganization = Objects.requireNonNull(b.thirdLevelOrganization,
                "thirdLevelOrganization must not be null");
        this.customerCategory = Objects.requireNonNull(b.customerCategory, "customerCategory must not be null");
        this.insuranceType = Objects.requireNonNull(b.insuranceType, "insuranceType must not be null");
        this.businessTypeCategory = Objects.requireNonNull(b.businessTypeCategory,
                "businessTypeCategory must not be null");
        this.coverageType = Objects.requireNonNull(b.coverageType, "coverageType must not be null");
        this.renewalStatus = Objects.requireNonNull(b.renewalStatus, "renewalStatus must not be null");
        this.newEnergyVehicle = b.newEnergyVehicle;
        this.transferredVehicle = b.transferredVehicle;
        this.vehicleInsuranceGrade = b.vehicleInsuranceGrade;
        this.highwayRiskGrade = b.highwayRiskGrade;
        this.largeTruckScore = b.largeTruckScore;
        this.smallTruckScore = b.smallTruckScore;
        this.terminalSource = Objects.requireNonNull(b.terminalSource, "terminalSource must not be null");
        this.signedPremiumYuan = b.signedPremiumYuan;
        this.maturedPremiumYuan = b.maturedPremiumYuan;
        this.policyCount = b.policyCount;
        this.claimCaseCount = b.claimCaseCount;
        this.reportedClaimPaymentYuan = b.reportedClaimPaymentYuan;
        this.expenseAmountYuan = b.expenseAmountYuan;
        this.commercialPremiumBeforeDiscountYuan = b.commercialPremiumBeforeDiscountYuan;
        this.premiumPlanYuan = b.premiumPlanYuan;
        this.marginalContributionAmountYuan = b.marginalContributionAmountYuan;
    }

    /**
     * Create a new {@link Builder}.
     *
     * @return builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Create a builder pre-populated with this record's values.
     *
     * @return builder holding a copy of every field
     */
    public Builder toBuilder() {
        return new Builder()
                .snapshotDate(snapshotDate)
                .policyStartYear(policyStartYear)
                .weekNumber(weekNumber)
                .chengduBranch(chengduBranch)
                .thirdLevelOrganization(thirdLevelOrganization)
                .customerCategory(customerCategory)
                .insuranceType(insuranceType)
                .businessTypeCategory(businessTypeCategory)
                .coverageType(coverageType)
                .renewalStatus(renewalStatus)
                .newEnergyVehicle(newEnergyVehicle)
                .transferredVehicle(transferredVehicle)
                .vehicleInsuranceGrade(vehicleInsuranceGrade)
                .highwayRiskGrade(highwayRiskGrade)
                .largeTruckScore(largeTruckScore)
                .smallTruckScore(smallTruckScore)
                .terminalSource(terminalSource)
                .signedPremiumYuan(signedPremiumYuan)
                .maturedPremiumYuan(maturedPremiumYuan)
                .policyCount(policyCount)
                .claimCaseCount(claimCaseCount)
                .reportedClaimPaymentYuan(reportedClaimPaymentYuan)
                .expenseAmountYuan(expenseAmountYuan)
                .commercialPremiumBeforeDiscountYuan(commercialPremiumBeforeDiscountYuan)
                .premiumPlanYuan(premiumPlanYuan)
                .marginalContributionAmountYuan(marginalContributionAmountYuan);
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    @JsonProperty("snapshot_date")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd")
    public LocalDate getSnapshotDate() {
        return snapshotDate;
    }

    @JsonProperty("policy_start_year")
    public int getPolicyStartYear() {
        return policyStartYear;
    }

    @JsonProperty("week_number")
    public int getWeekNumber() {
        return weekNumber;
    }

    @JsonProperty("chengdu_branch")
    public Branch getChengduBranch() {
        return chengduBranch;
    }

    @JsonProperty("third_level_organization")
    public String getThirdLevelOrganization() {
        return thirdLevelOrganization;
    }

    @JsonProperty("customer_category_3")
    public String getCustomerCategory() {
        return customerCategory;
    }

    @JsonProperty("insurance_type")
    public InsuranceType getInsuranceType() {
        return insuranceType;
    }

    @JsonProperty("business_type_category")
    public String getBusinessTypeCategory() {
        return businessTypeCategory;
    }

    @JsonProperty("coverage_type")
    public CoverageType getCoverageType() {
        return coverageType;
    }

    @JsonProperty("renewal_status")
    public RenewalStatus getRenewalStatus() {
        return renewalStatus;
    }

    @JsonProperty("is_new_energy_vehicle")
    public boolean isNewEnergyVehicle() {
        return newEnergyVehicle;
    }

    @JsonProperty("is_transferred_vehicle")
    public boolean isTransferredVehicle() {
        return transferredVehicle;
    }

    @JsonProperty("vehicle_insurance_grade")
    public VehicleGrade getVehicleInsuranceGrade() {
        return vehicleInsuranceGrade;
    }

    @JsonProperty("highway_risk_grade")
    public HighwayRiskGrade getHighwayRiskGrade() {
        return highwayRiskGrade;
    }

    @JsonProperty("large_truck_score")
    public TruckScore getLargeTruckScore() {
        return largeTruckScore;
    }

    @JsonProperty("small_truck_score")
    public TruckScore getSmallTruckScore() {
        return smallTruckScore;
    }

    @JsonProperty("terminal_source")
    public String getTerminalSource() {
        return terminalSource;
    }

    @JsonProperty("signed_premium_yuan")
    public double getSignedPremiumYuan() {
        return signedPremiumYuan;
    }

    @JsonProperty("matured_premium_yuan")
    public double getMaturedPremiumYuan() {
        return maturedPremiumYuan;
    }

    @JsonProperty("policy_count")
    public long getPolicyCount() {
        return policyCount;
    }

    @JsonProperty("claim_case_count")
    public long getClaimCaseCount() {
        return claimCaseCount;
    }

    @JsonProperty("reported_claim_payment_yuan")
    public double getReportedClaimPaymentYuan() {
        return reportedClaimPaymentYuan;
    }

    @JsonProperty("expense_amount_yuan")
    public double getExpenseAmountYuan() {
        return expenseAmountYuan;
    }

    @JsonProperty("commercial_premium_before_discount_yuan")
    public double getCommercialPremiumBeforeDiscountYuan() {
        return commercialPremiumBeforeDiscountYuan;
    }

    /**
     * @return planned premium in yuan, or {@code null} when the extract left
     *         the column blank
     */
    @JsonProperty("premium_plan_yuan")
    public Double getPremiumPlanYuan() {
        return premiumPlanYuan;
    }

    @JsonProperty("marginal_contribution_amount_yuan")
    public double getMarginalContributionAmountYuan() {
        return marginalContributionAmountYuan;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link InsuranceRecord}.
     *
     * <p>
     * Calling {@link #build()} without one of the required fields throws
     * {@link NullPointerException}.
     * </p>
     */
    public static class Builder {
        private LocalDate snapshotDate;
        private int policyStartYear;
        private int weekNumber;
        private Branch chengduBranch;
        private String thirdLevelOrganization;
        private String customerCategory;
        private InsuranceType insuranceType;
        private String businessTypeCategory;
        private CoverageType coverageType;
        private RenewalStatus renewalStatus;
        private boolean newEnergyVehicle;
        private boolean transferredVehicle;
        private VehicleGrade vehicleInsuranceGrade;
        private HighwayRiskGrade highwayRiskGrade;
        private TruckScore largeTruckScore;
        private TruckScore smallTruckScore;
        private String terminalSource;
        private double signedPremiumYuan;
        private double maturedPremiumYuan;
        private long policyCount;
        private long claimCaseCount;
        private double reportedClaimPaymentYuan;
        private double expenseAmountYuan;
        private double commercialPremiumBeforeDiscountYuan;
        private Double premiumPlanYuan;
        private double marginalContributionAmountYuan;

        public Builder snapshotDate(LocalDate v) {
            this.snapshotDate = v;
            return this;
        }

        public Builder policyStartYear(int v) {
            this.policyStartYear = v;
            return this;
        }

        public Builder weekNumber(int v) {
            this.weekNumber = v;
            return this;
        }

        public Builder chengduBranch(Branch v) {
            this.chengduBranch = v;
            return this;
        }

        public Builder thirdLevelOrganization(String v) {
            this.thirdLevelOrganization = v;
            return this;
        }

        public Builder customerCategory(String v) {
            this.customerCategory = v;
            return this;
        }

        public Builder insuranceType(InsuranceType v) {
            this.insuranceType = v;
            return this;
        }

        public Builder businessTypeCategory(String v) {
            this.businessTypeCategory = v;
            return this;
        }

        public Builder coverageType(CoverageType v) {
            this.coverageType = v;
            return this;
        }

        public Builder renewalStatus(RenewalStatus v) {
            this.renewalStatus = v;
            return this;
        }

        public Builder newEnergyVehicle(boolean v) {
            this.newEnergyVehicle = v;
            return this;
        }

        public Builder transferredVehicle(boolean v) {
            this.transferredVehicle = v;
            return this;
        }

        public Builder vehicleInsuranceGrade(VehicleGrade v) {
            this.vehicleInsuranceGrade = v;
            return this;
        }

        public Builder highwayRiskGrade(HighwayRiskGrade v) {
            this.highwayRiskGrade = v;
            return this;
        }

        public Builder largeTruckScore(TruckScore v) {
            this.largeTruckScore = v;
            return this;
        }

        public Builder smallTruckScore(TruckScore v) {
            this.smallTruckScore = v;
            return this;
        }

        public Builder terminalSource(String v) {
            this.terminalSource = v;
            return this;
        }

        public Builder signedPremiumYuan(double v) {
            this.signedPremiumYuan = v;
            return this;
        }

        public Builder maturedPremiumYuan(double v) {
            this.maturedPremiumYuan = v;
            return this;
        }

        public Builder policyCount(long v) {
            this.policyCount = v;
            return this;
        }

        public Builder claimCaseCount(long v) {
            this.claimCaseCount = v;
            return this;
        }

        public Builder reportedClaimPaymentYuan(double v) {
            this.reportedClaimPaymentYuan = v;
            return this;
        }

        public Builder expenseAmountYuan(double v) {
            this.expenseAmountYuan = v;
            return this;
        }

        public Builder commercialPremiumBeforeDiscountYuan(double v) {
            this.commercialPremiumBeforeDiscountYuan = v;
            return this;
        }

        public Builder premiumPlanYuan(Double v) {
            this.premiumPlanYuan = v;
            return this;
        }

        public Builder marginalContributionAmountYuan(double v) {
            this.marginalContributionAmountYuan = v;
            return this;
        }

        /**
         * Build the record.
         *
         * @return a new {@link InsuranceRecord}
         * @throws NullPointerException if a required field is missing
         */
        public InsuranceRecord build() {
            return new InsuranceRecord(this);
        }
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof InsuranceRecord that))
            return false;
        return policyStartYear == that.policyStartYear
                && weekNumber == that.weekNumber
                && newEnergyVehicle == that.newEnergyVehicle
                && transferredVehicle == that.transferredVehicle
                && Double.compare(signedPremiumYuan, that.signedPremiumYuan) == 0
                && Double.compare(maturedPremiumYuan, that.maturedPremiumYuan) == 0
                && policyCount == that.policyCount
                && claimCaseCount == that.claimCaseCount
                && Double.compare(reportedClaimPaymentYuan, that.reportedClaimPaymentYuan) == 0
                && Double.compare(expenseAmountYuan, that.expenseAmountYuan) == 0
                && Double.compare(commercialPremiumBeforeDiscountYuan,
                        that.commercialPremiumBeforeDiscountYuan) == 0
                && Double.compare(marginalContributionAmountYuan, that.marginalContributionAmountYuan) == 0
                && snapshotDate.equals(that.snapshotDate)
                && chengduBranch == that.chengduBranch
                && thirdLevelOrganization.equals(that.thirdLevelOrganization)
                && customerCategory.equals(that.customerCategory)
                && insuranceType == that.insuranceType
                && businessTypeCategory.equals(that.businessTypeCategory)
                && coverageType == that.coverageType
                && renewalStatus == that.renewalStatus
                && vehicleInsuranceGrade == that.vehicleInsuranceGrade
                && highwayRiskGrade == that.highwayRiskGrade
                && largeTruckScore == that.largeTruckScore
                && smallTruckScore == that.smallTruckScore
                && terminalSource.equals(that.terminalSource)
                && Objects.equals(premiumPlanYuan, that.premiumPlanYuan);
    }

    @Override
    public int hashCode() {
        return Objects.hash(snapshotDate, policyStartYear, weekNumber, chengduBranch,
                thirdLevelOrganization, customerCategory, insuranceType, businessTypeCategory,
                coverageType, renewalStatus, newEnergyVehicle, transferredVehicle,
                vehicleInsuranceGrade, highwayRiskGrade, largeTruckScore, smallTruckScore,
                terminalSource, signedPremiumYuan, maturedPremiumYuan, policyCount, claimCaseCount,
                reportedClaimPaymentYuan, expenseAmountYuan, commercialPremiumBeforeDiscountYuan,
                premiumPlanYuan, marginalContributionAmountYuan);
    }

    @Override
    public String toString() {
        return "InsuranceRecord{" +
                "snapshotDate=" + snapshotDate +
                ", year=" + policyStartYear +
                ", week=" + weekNumber +
                ", organization='" + thirdLevelOrganization + '\'' +
                ", customerCategory='" + customerCategory + '\'' +
                ", insuranceType=" + insuranceType +
                ", businessType='" + businessTypeCategory + '\'' +
                ", signedPremiumYuan=" + signedPremiumYuan +
                ", maturedPremiumYuan=" + maturedPremiumYuan +
                ", policyCount=" + policyCount +
                '}';
    }
}
