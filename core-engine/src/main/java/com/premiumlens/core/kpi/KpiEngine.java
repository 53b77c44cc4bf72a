package com.premiumlens.core.kpi;

import com.premiumlens.core.filter.FilterEngine;
import com.premiumlens.core.model.DataViewType;
import com.premiumlens.core.model.FilterState;
import com.premiumlens.core.model.InsuranceRecord;
import com.premiumlens.core.model.KpiResult;
import com.premiumlens.core.model.RecordSets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Computes {@link KpiResult}s from record sets.
 *
 * <h3>Formulas</h3>
 * <p>
 * Every metric is derived from one {@link Aggregation}. Ratios are in percent
 * (the autonomy coefficient is a plain factor), monetary absolutes in 万元,
 * averages in yuan. Values are not rounded. A ratio whose denominator is zero
 * is {@code null}; {@code NaN} and infinities never leave this class.
 * </p>
 *
 * <h3>Increment mode</h3>
 * <p>
 * The delta sums {@code current − previous} are computed first and every
 * metric, ratios included, is derived from them. Ratio values are never
 * subtracted from one another.
 * </p>
 *
 * <p>
 * All methods are pure; no result is cached here (see {@link KpiCache}).
 * </p>
 *
 * @since 1.0.0
 */
public final class KpiEngine {

    private static final Logger LOG = LoggerFactory.getLogger(KpiEngine.class);

    /** Yuan per 万元. */
    static final double TEN_THOUSAND = 10_000d;

    private KpiEngine() {
        // utility class
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Cumulative KPIs of one record set. The mode of {@code options} is not
     * consulted here; see {@link #calculateIncrement} and
     * {@link #calculateForFilters}.
     *
     * @param records source records; must not be {@code null}
     * @param options calculation options; must not be {@code null}
     * @return the KPIs, empty only when {@code records} is empty
     */
    public static Optional<KpiResult> calculate(Collection<InsuranceRecord> records, KpiOptions options) {
        Objects.requireNonNull(records, "Records must not be null");
        Objects.requireNonNull(options, "KpiOptions must not be null");
        if (records.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(compute(Aggregation.of(records), options, timeProgress(records, options)));
    }

    /**
     * Week-over-week KPIs. The time progress is taken from {@code current}.
     *
     * @param current  records of the selected period
     * @param previous records of the comparison period, possibly empty
     * @param options  calculation options
     * @return KPIs of the delta sums, empty when {@code current} is empty
     */
    public static Optional<KpiResult> calculateIncrement(Collection<InsuranceRecord> current,
            Collection<InsuranceRecord> previous, KpiOptions options) {
        Objects.requireNonNull(current, "Current records must not be null");
        Objects.requireNonNull(previous, "Previous records must not be null");
        Objects.requireNonNull(options, "KpiOptions must not be null");
        if (current.isEmpty()) {
            return Optional.empty();
        }
        Aggregation delta = Aggregation.of(current).minus(Aggregation.of(previous));
        LOG.debug("Increment over {} current / {} previous record(s)", current.size(), previous.size());
        return Optional.of(compute(delta, options, timeProgress(current, options)));
    }

    /**
     * Filter and calculate in one step.
     *
     * <p>
     * Increment mode applies when the filter's data view is
     * {@link DataViewType#INCREMENT} or the options ask for
     * {@link KpiMode#INCREMENT}; the comparison period is
     * {@link FilterState#previousPeriod()}. Without a previous period the
     * cumulative KPIs are returned. The filter's reference week is used as the
     * time-progress week unless the options name one.
     * </p>
     *
     * @return the KPIs, empty when no record passes the filter
     */
    public static Optional<KpiResult> calculateForFilters(Collection<InsuranceRecord> records, FilterState state,
            KpiOptions options) {
        Objects.requireNonNull(state, "FilterState must not be null");
        Objects.requireNonNull(options, "KpiOptions must not be null");

        KpiOptions effective = options;
        if (options.getCurrentWeekNumber().isEmpty() && state.referenceWeek().isPresent()) {
            effective = options.toBuilder().currentWeekNumber(state.referenceWeek().get()).build();
        }
        List<InsuranceRecord> current = FilterEngine.filter(records, state);

        boolean increment = state.getDataViewType() == DataViewType.INCREMENT
                || options.getMode() == KpiMode.INCREMENT;
        if (!increment) {
            return calculate(current, effective);
        }
        Optional<FilterState> previousState = state.previousPeriod();
        if (previousState.isEmpty()) {
            LOG.debug("No previous period for {}, falling back to cumulative KPIs", state);
            return calculate(current, effective);
        }
        List<InsuranceRecord> previous = FilterEngine.filter(records, previousState.get());
        return calculateIncrement(current, previous, effective);
    }

    /**
     * KPIs per group of {@code dimension}, in first-seen group order. The
     * source collection is neither reordered nor modified.
     *
     * @return ordered map of group key to KPIs; empty for an empty set
     */
    public static Map<String, KpiResult> calculateByDimension(Collection<InsuranceRecord> records,
            GroupingDimension dimension, KpiOptions options) {
        Objects.requireNonNull(dimension, "GroupingDimension must not be null");
        Objects.requireNonNull(options, "KpiOptions must not be null");
        Map<String, List<InsuranceRecord>> groups = RecordSets.groupBy(records, dimension::keyOf);

        Map<String, KpiResult> results = new LinkedHashMap<>();
        groups.forEach((key, group) -> results.put(key, calculate(group, options).orElseThrow()));
        LOG.debug("Calculated KPIs for {} group(s) of {}", results.size(), dimension);
        return results;
    }

    /**
     * One KPI snapshot per week, other dimensions filtered by {@code state}.
     *
     * <p>
     * Each week uses itself as the time-progress week. In
     * {@link KpiMode#INCREMENT} mode week <i>n</i> is compared with week
     * <i>n−1</i>. Weeks without data are left out of the result.
     * </p>
     *
     * @param weeks weeks to compute, in any order
     * @return map sorted by week
     */
    public static SortedMap<Integer, KpiResult> calculateWeeklySeries(Collection<InsuranceRecord> records,
            FilterState state, Collection<Integer> weeks, KpiOptions options) {
        Objects.requireNonNull(weeks, "Weeks must not be null");
        Objects.requireNonNull(options, "KpiOptions must not be null");

        SortedMap<Integer, KpiResult> series = new TreeMap<>();
        for (int week : new TreeSet<>(weeks)) {
            KpiOptions weekOptions = options.toBuilder().currentWeekNumber(week).build();
            List<InsuranceRecord> current = FilterEngine.forWeek(records, state, week);
            Optional<KpiResult> result = options.getMode() == KpiMode.INCREMENT && week > 1
                    ? calculateIncrement(current, FilterEngine.forWeek(records, state, week - 1), weekOptions)
                    : calculate(current, weekOptions);
            result.ifPresent(r -> series.put(week, r));
        }
        return series;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    static KpiResult compute(Aggregation sums, KpiOptions options, double timeProgress) {
        double signed = sums.getSignedPremiumYuan();
        double matured = sums.getMaturedPremiumYuan();
        double claimPayment = sums.getReportedClaimPaymentYuan();
        double expense = sums.getExpenseAmountYuan();
        double contribution = sums.getMarginalContributionAmountYuan();
        long policies = sums.getPolicyCount();
        long claims = sums.getClaimCaseCount();

        Double lossRatio = percent(claimPayment, matured);
        Double expenseRatio = percent(expense, signed);
        Double maturityRatio = percent(matured, signed);
        Double contributionMarginRatio = percent(contribution, matured);

        Double variableCostRatio = expenseRatio == null && lossRatio == null
                ? null
                : orZero(expenseRatio) + orZero(lossRatio);

        // claim frequency scaled by the maturity share
        Double claimFrequency = divide(claims, policies);
        Double maturedClaimRatio = claimFrequency == null || maturityRatio == null
                ? null
                : claimFrequency * (maturityRatio / 100) * 100;

        double plan = options.getAnnualTargetYuan().orElse(sums.getPremiumPlanYuan());
        Double premiumProgress = progress(divide(signed, plan), timeProgress);
        Long policyTarget = options.getAnnualPolicyCountTarget().orElse(null);
        Double policyCountProgress = policyTarget == null
                ? null
                : progress(divide(policies, policyTarget), timeProgress);

        return KpiResult.builder()
                .lossRatio(lossRatio)
                .expenseRatio(expenseRatio)
                .maturityRatio(maturityRatio)
                .contributionMarginRatio(contributionMarginRatio)
                .variableCostRatio(variableCostRatio)
                .maturedClaimRatio(maturedClaimRatio)
                .autonomyCoefficient(divide(signed, sums.getCommercialPremiumBeforeDiscountYuan()))
                .premiumProgress(premiumProgress)
                .policyCountProgress(policyCountProgress)
                .signedPremium(signed / TEN_THOUSAND)
                .maturedPremium(matured / TEN_THOUSAND)
                .policyCount(policies)
                .claimCaseCount(claims)
                .reportedClaimPayment(claimPayment / TEN_THOUSAND)
                .expenseAmount(expense / TEN_THOUSAND)
                .contributionMarginAmount(contribution / TEN_THOUSAND)
                .annualPremiumTarget(plan > 0 ? plan / TEN_THOUSAND : null)
                .annualPolicyCountTarget(policyTarget)
                .averagePremium(divide(signed, policies))
                .averageClaim(divide(claimPayment, claims))
                .averageExpense(divide(expense, policies))
                .averageContribution(divide(contribution, policies))
                .build();
    }

    /**
     * Time progress at the options' week/year, defaulting to the latest week
     * and year present in {@code records}.
     */
    static double timeProgress(Collection<InsuranceRecord> records, KpiOptions options) {
        int week = options.getCurrentWeekNumber().orElseGet(() -> records.stream()
                .mapToInt(InsuranceRecord::getWeekNumber).max().orElse(1));
        int year = options.getYear().orElseGet(() -> records.stream()
                .mapToInt(InsuranceRecord::getPolicyStartYear).max().orElseThrow());
        return TimeProgress.forWeek(year, week);
    }

    private static Double divide(double numerator, double denominator) {
        if (denominator == 0) {
            return null;
        }
        double value = numerator / denominator;
        return Double.isFinite(value) ? value : null;
    }

    private static Double percent(double numerator, double denominator) {
        Double ratio = divide(numerator, denominator);
        return ratio == null ? null : ratio * 100;
    }

    private static Double progress(Double completion, double timeProgress) {
        if (completion == null || timeProgress <= 0) {
            return null;
        }
        return completion / timeProgress * 100;
    }

    private static double orZero(Double value) {
        return value == null ? 0 : value;
    }
}
