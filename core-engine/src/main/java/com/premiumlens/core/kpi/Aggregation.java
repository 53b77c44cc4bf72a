package com.premiumlens.core.kpi;

import com.premiumlens.core.model.InsuranceRecord;

import java.util.Collection;
import java.util.Objects;

/**
 * The nine summed measures every KPI is derived from, in yuan and plain
 * counts.
 *
 * <p>
 * Sums are additive: for any partition of a record set,
 * {@code of(a).plus(of(b)).equals(of(a ∪ b))} up to floating-point
 * rounding. The premium plan sums only the records that carry one.
 * </p>
 *
 * @since 1.0.0
 */
public final class Aggregation {

    /** The aggregation of an empty record set. */
    public static final Aggregation ZERO = new Aggregation(0, 0, 0, 0, 0, 0, 0, 0, 0);

    private final double signedPremiumYuan;
    private final double maturedPremiumYuan;
    private final long policyCount;
    private final long claimCaseCount;
    private final double reportedClaimPaymentYuan;
    private final double expenseAmountYuan;
    private final double commercialPremiumBeforeDiscountYuan;
    private final double premiumPlanYuan;
    private final double marginalContributionAmountYuan;

    Aggregation(double signedPremiumYuan, double maturedPremiumYuan, long policyCount, long claimCaseCount,
            double reportedClaimPaymentYuan, double expenseAmountYuan, double commercialPremiumBeforeDiscountYuan,
            double premiumPlanYuan, double marginalContributionAmountYuan) {
        this.signedPremiumYuan = signedPremiumYuan;
        this.maturedPremiumYuan = maturedPremiumYuan;
        this.policyCount = policyCount;
        this.claimCaseCount = claimCaseCount;
        this.reportedClaimPaymentYuan = reportedClaimPaymentYuan;
        this.expenseAmountYuan = expenseAmountYuan;
        this.commercialPremiumBeforeDiscountYuan = commercialPremiumBeforeDiscountYuan;
        this.premiumPlanYuan = premiumPlanYuan;
        this.marginalContributionAmountYuan = marginalContributionAmountYuan;
    }

    /**
     * Sum the measures of a record set in one pass.
     *
     * @param records source records; must not be {@code null}
     * @return the sums, {@link #ZERO} for an empty set
     */
    public static Aggregation of(Collection<InsuranceRecord> records) {
        Objects.requireNonNull(records, "Records must not be null");
        double signed = 0;
        double matured = 0;
        long policies = 0;
        long claims = 0;
        double claimPayment = 0;
        double expense = 0;
        double beforeDiscount = 0;
        double plan = 0;
        double contribution = 0;
        for (InsuranceRecord r : records) {
            signed += r.getSignedPremiumYuan();
            matured += r.getMaturedPremiumYuan();
            policies += r.getPolicyCount();
            claims += r.getClaimCaseCount();
            claimPayment += r.getReportedClaimPaymentYuan();
            expense += r.getExpenseAmountYuan();
            beforeDiscount += r.getCommercialPremiumBeforeDiscountYuan();
            if (r.getPremiumPlanYuan() != null) {
                plan += r.getPremiumPlanYuan();
            }
            contribution += r.getMarginalContributionAmountYuan();
        }
        return new Aggregation(signed, matured, policies, claims, claimPayment, expense, beforeDiscount, plan,
                contribution);
    }

    public Aggregation plus(Aggregation other) {
        Objects.requireNonNull(other, "Aggregation must not be null");
        return new Aggregation(
                signedPremiumYuan + other.signedPremiumYuan,
                maturedPremiumYuan + other.maturedPremiumYuan,
                policyCount + other.policyCount,
                claimCaseCount + other.claimCaseCount,
                reportedClaimPaymentYuan + other.reportedClaimPaymentYuan,
                expenseAmountYuan + other.expenseAmountYuan,
                commercialPremiumBeforeDiscountYuan + other.commercialPremiumBeforeDiscountYuan,
                premiumPlanYuan + other.premiumPlanYuan,
                marginalContributionAmountYuan + other.marginalContributionAmountYuan);
    }

    /**
     * Field-wise difference; the increment-mode delta sums.
     */
    public Aggregation minus(Aggregation other) {
        Objects.requireNonNull(other, "Aggregation must not be null");
        return new Aggregation(
                signedPremiumYuan - other.signedPremiumYuan,
                maturedPremiumYuan - other.maturedPremiumYuan,
                policyCount - other.policyCount,
                claimCaseCount - other.claimCaseCount,
                reportedClaimPaymentYuan - other.reportedClaimPaymentYuan,
                expenseAmountYuan - other.expenseAmountYuan,
                commercialPremiumBeforeDiscountYuan - other.commercialPremiumBeforeDiscountYuan,
                premiumPlanYuan - other.premiumPlanYuan,
                marginalContributionAmountYuan - other.marginalContributionAmountYuan);
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public double getSignedPremiumYuan() {
        return signedPremiumYuan;
    }

    public double getMaturedPremiumYuan() {
        return maturedPremiumYuan;
    }

    public long getPolicyCount() {
        return policyCount;
    }

    public long getClaimCaseCount() {
        return claimCaseCount;
    }

    public double getReportedClaimPaymentYuan() {
        return reportedClaimPaymentYuan;
    }

    public double getExpenseAmountYuan() {
        return expenseAmountYuan;
    }

    public double getCommercialPremiumBeforeDiscountYuan() {
        return commercialPremiumBeforeDiscountYuan;
    }

    public double getPremiumPlanYuan() {
        return premiumPlanYuan;
    }

    public double getMarginalContributionAmountYuan() {
        return marginalContributionAmountYuan;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Aggregation that))
            return false;
        return Double.compare(signedPremiumYuan, that.signedPremiumYuan) == 0
                && Double.compare(maturedPremiumYuan, that.maturedPremiumYuan) == 0
                && policyCount == that.policyCount
                && claimCaseCount == that.claimCaseCount
                && Double.compare(reportedClaimPaymentYuan, that.reportedClaimPaymentYuan) == 0
                && Double.compare(expenseAmountYuan, that.expenseAmountYuan) == 0
                && Double.compare(commercialPremiumBeforeDiscountYuan, that.commercialPremiumBeforeDiscountYuan) == 0
                && Double.compare(premiumPlanYuan, that.premiumPlanYuan) == 0
                && Double.compare(marginalContributionAmountYuan, that.marginalContributionAmountYuan) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(signedPremiumYuan, maturedPremiumYuan, policyCount, claimCaseCount,
                reportedClaimPaymentYuan, expenseAmountYuan, commercialPremiumBeforeDiscountYuan, premiumPlanYuan,
                marginalContributionAmountYuan);
    }

    @Override
    public String toString() {
        return "Aggregation{" +
                "signedPremiumYuan=" + signedPremiumYuan +
                ", maturedPremiumYuan=" + maturedPremiumYuan +
                ", policyCount=" + policyCount +
                ", claimCaseCount=" + claimCaseCount +
                ", reportedClaimPaymentYuan=" + reportedClaimPaymentYuan +
                ", expenseAmountYuan=" + expenseAmountYuan +
                ", commercialPremiumBeforeDiscountYuan=" + commercialPremiumBeforeDiscountYuan +
                ", premiumPlanYuan=" + premiumPlanYuan +
                ", marginalContributionAmountYuan=" + marginalContributionAmountYuan +
                '}';
    }
}
