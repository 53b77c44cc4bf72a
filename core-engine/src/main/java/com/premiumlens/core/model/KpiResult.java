package com.premiumlens.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Flat snapshot of every KPI computed from one record set.
 *
 * <p>
 * Absolute metrics are plain numbers and are always defined. Ratio, average
 * and progress metrics are {@code null} exactly when their denominator is
 * zero; they are never {@code NaN} or infinite. Monetary absolutes are in
 * 万元 (ten-thousand yuan), averages in yuan, ratios in percent (the
 * autonomy coefficient is a plain factor).
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public final class KpiResult {

    private final Double lossRatio;
    private final Double expenseRatio;
    private final Double maturityRatio;
    private final Double contributionMarginRatio;
    private final Double variableCostRatio;
    private final Double maturedClaimRatio;
    private final Double autonomyCoefficient;
    private final Double premiumProgress;
    private final Double policyCountProgress;

    private final double signedPremium;
    private final double maturedPremium;
    private final long policyCount;
    private final long claimCaseCount;
    private final double reportedClaimPayment;
    private final double expenseAmount;
    private final double contributionMarginAmount;

    private final Double annualPremiumTarget;
    private final Long annualPolicyCountTarget;

    private final Double averagePremium;
    private final Double averageClaim;
    private final Double averageExpense;
    private final Double averageContribution;

    private KpiResult(Builder b) {
        this.lossRatio = b.lossRatio;
        this.expenseRatio = b.expenseRatio;
        this.maturityRatio = b.maturityRatio;
        this.contributionMarginRatio = b.contributionMarginRatio;
        this.variableCostRatio = b.variableCostRatio;
        this.maturedClaimRatio = b.maturedClaimRatio;
        this.autonomyCoefficient = b.autonomyCoefficient;
        this.premiumProgress = b.premiumProgress;
        this.policyCountProgress = b.policyCountProgress;
        this.signedPremium = b.signedPremium;
        this.maturedPremium = b.maturedPremium;
        this.policyCount = b.policyCount;
        this.claimCaseCount = b.claimCaseCount;
        this.reportedClaimPayment = b.reportedClaimPayment;
        this.expenseAmount = b.expenseAmount;
        this.contributionMarginAmount = b.contributionMarginAmount;
        this.annualPremiumTarget = b.annualPremiumTarget;
        this.annualPolicyCountTarget = b.annualPolicyCountTarget;
        this.averagePremium = b.averagePremium;
        this.averageClaim = b.averageClaim;
        this.averageExpense = b.averageExpense;
        this.averageContribution = b.averageContribution;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Keyed access to a metric.
     *
     * @param key metric key; must not be {@code null}
     * @return the metric value as a {@link Double}, or {@code null} when the
     *         metric is undefined for this record set
     */
    public Double get(KpiKey key) {
        Objects.requireNonNull(key, "KPI key must not be null");
        Double value = switch (key) {
            case LOSS_RATIO -> lossRatio;
            case EXPENSE_RATIO -> expenseRatio;
            case MATURITY_RATIO -> maturityRatio;
            case CONTRIBUTION_MARGIN_RATIO -> contributionMarginRatio;
            case VARIABLE_COST_RATIO -> variableCostRatio;
            case MATURED_CLAIM_RATIO -> maturedClaimRatio;
            case AUTONOMY_COEFFICIENT -> autonomyCoefficient;
            case PREMIUM_PROGRESS -> premiumProgress;
            case POLICY_COUNT_PROGRESS -> policyCountProgress;
            case SIGNED_PREMIUM -> Double.valueOf(signedPremium);
            case MATURED_PREMIUM -> Double.valueOf(maturedPremium);
            case POLICY_COUNT -> Double.valueOf(policyCount);
            case CLAIM_CASE_COUNT -> Double.valueOf(claimCaseCount);
            case REPORTED_CLAIM_PAYMENT -> Double.valueOf(reportedClaimPayment);
            case EXPENSE_AMOUNT -> Double.valueOf(expenseAmount);
            case CONTRIBUTION_MARGIN_AMOUNT -> Double.valueOf(contributionMarginAmount);
            case ANNUAL_PREMIUM_TARGET -> annualPremiumTarget;
            case ANNUAL_POLICY_COUNT_TARGET -> annualPolicyCountTarget == null
                    ? null
                    : Double.valueOf(annualPolicyCountTarget);
            case AVERAGE_PREMIUM -> averagePremium;
            case AVERAGE_CLAIM -> averageClaim;
            case AVERAGE_EXPENSE -> averageExpense;
            case AVERAGE_CONTRIBUTION -> averageContribution;
        };
        return value;
    }

    /**
     * @return unmodifiable map of every key to its value ({@code null} values
     *         included)
     */
    public Map<KpiKey, Double> asMap() {
        Map<KpiKey, Double> values = new EnumMap<>(KpiKey.class);
        for (KpiKey key : KpiKey.values()) {
            values.put(key, get(key));
        }
        return Collections.unmodifiableMap(values);
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    @JsonProperty("loss_ratio")
    public Double getLossRatio() {
        return lossRatio;
    }

    @JsonProperty("expense_ratio")
    public Double getExpenseRatio() {
        return expenseRatio;
    }

    @JsonProperty("maturity_ratio")
    public Double getMaturityRatio() {
        return maturityRatio;
    }

    @JsonProperty("contribution_margin_ratio")
    public Double getContributionMarginRatio() {
        return contributionMarginRatio;
    }

    @JsonProperty("variable_cost_ratio")
    public Double getVariableCostRatio() {
        return variableCostRatio;
    }

    @JsonProperty("matured_claim_ratio")
    public Double getMaturedClaimRatio() {
        return maturedClaimRatio;
    }

    @JsonProperty("autonomy_coefficient")
    public Double getAutonomyCoefficient() {
        return autonomyCoefficient;
    }

    @JsonProperty("premium_progress")
    public Double getPremiumProgress() {
        return premiumProgress;
    }

    @JsonProperty("policy_count_progress")
    public Double getPolicyCountProgress() {
        return policyCountProgress;
    }

    @JsonProperty("signed_premium")
    public double getSignedPremium() {
        return signedPremium;
    }

    @JsonProperty("matured_premium")
    public double getMaturedPremium() {
        return maturedPremium;
    }

    @JsonProperty("policy_count")
    public long getPolicyCount() {
        return policyCount;
    }

    @JsonProperty("claim_case_count")
    public long getClaimCaseCount() {
        return claimCaseCount;
    }

    @JsonProperty("reported_claim_payment")
    public double getReportedClaimPayment() {
        return reportedClaimPayment;
    }

    @JsonProperty("expense_amount")
    public double getExpenseAmount() {
        return expenseAmount;
    }

    @JsonProperty("contribution_margin_amount")
    public double getContributionMarginAmount() {
        return contributionMarginAmount;
    }

    @JsonProperty("annual_premium_target")
    public Double getAnnualPremiumTarget() {
        return annualPremiumTarget;
    }

    @JsonProperty("annual_policy_count_target")
    public Long getAnnualPolicyCountTarget() {
        return annualPolicyCountTarget;
    }

    @JsonProperty("average_premium")
    public Double getAveragePremium() {
        return averagePremium;
    }

    @JsonProperty("average_claim")
    public Double getAverageClaim() {
        return averageClaim;
    }

    @JsonProperty("average_expense")
    public Double getAverageExpense() {
        return averageExpense;
    }

    @JsonProperty("average_contribution")
    public Double getAverageContribution() {
        return averageContribution;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link KpiResult}. Unset ratio metrics stay
     * {@code null}; unset absolutes stay 0.
     */
    public static class Builder {
        private Double lossRatio;
        private Double expenseRatio;
        private Double maturityRatio;
        private Double contributionMarginRatio;
        private Double variableCostRatio;
        private Double maturedClaimRatio;
        private Double autonomyCoefficient;
        private Double premiumProgress;
        private Double policyCountProgress;
        private double signedPremium;
        private double maturedPremium;
        private long policyCount;
        private long claimCaseCount;
        private double reportedClaimPayment;
        private double expenseAmount;
        private double contributionMarginAmount;
        private Double annualPremiumTarget;
        private Long annualPolicyCountTarget;
        private Double averagePremium;
        private Double averageClaim;
        private Double averageExpense;
        private Double averageContribution;

        public Builder lossRatio(Double v) {
            this.lossRatio = v;
            return this;
        }

        public Builder expenseRatio(Double v) {
            this.expenseRatio = v;
            return this;
        }

        public Builder maturityRatio(Double v) {
            this.maturityRatio = v;
            return this;
        }

        public Builder contributionMarginRatio(Double v) {
            this.contributionMarginRatio = v;
            return this;
        }

        public Builder variableCostRatio(Double v) {
            this.variableCostRatio = v;
            return this;
        }

        public Builder maturedClaimRatio(Double v) {
            this.maturedClaimRatio = v;
            return this;
        }

        public Builder autonomyCoefficient(Double v) {
            this.autonomyCoefficient = v;
            return this;
        }

        public Builder premiumProgress(Double v) {
            this.premiumProgress = v;
            return this;
        }

        public Builder policyCountProgress(Double v) {
            this.policyCountProgress = v;
            return this;
        }

        public Builder signedPremium(double v) {
            this.signedPremium = v;
            return this;
        }

        public Builder maturedPremium(double v) {
            this.maturedPremium = v;
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

        public Builder reportedClaimPayment(double v) {
            this.reportedClaimPayment = v;
            return this;
        }

        public Builder expenseAmount(double v) {
            this.expenseAmount = v;
            return this;
        }

        public Builder contributionMarginAmount(double v) {
            this.contributionMarginAmount = v;
            return this;
        }

        public Builder annualPremiumTarget(Double v) {
            this.annualPremiumTarget = v;
            return this;
        }

        public Builder annualPolicyCountTarget(Long v) {
            this.annualPolicyCountTarget = v;
            return this;
        }

        public Builder averagePremium(Double v) {
            this.averagePremium = v;
            return this;
        }

        public Builder averageClaim(Double v) {
            this.averageClaim = v;
            return this;
        }

        public Builder averageExpense(Double v) {
            this.averageExpense = v;
            return this;
        }

        public Builder averageContribution(Double v) {
            this.averageContribution = v;
            return this;
        }

        public KpiResult build() {
            return new KpiResult(this);
        }
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof KpiResult that))
            return false;
        return asMap().equals(that.asMap());
    }

    @Override
    public int hashCode() {
        return asMap().hashCode();
    }

    @Override
    public String toString() {
        return "KpiResult" + asMap();
    }
}
