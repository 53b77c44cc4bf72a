package com.premiumlens.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Every metric carried by a {@link KpiResult}.
 *
 * <p>
 * Each key knows its JSON name, its {@link Category} and its
 * {@link Polarity}, i.e. whether a rise is good or bad news for the
 * business.
 * </p>
 *
 * @since 1.0.0
 */
public enum KpiKey {

    // ratios (%)
    LOSS_RATIO("loss_ratio", Category.RATIO, Polarity.LOWER_IS_BETTER),
    EXPENSE_RATIO("expense_ratio", Category.RATIO, Polarity.LOWER_IS_BETTER),
    MATURITY_RATIO("maturity_ratio", Category.RATIO, Polarity.HIGHER_IS_BETTER),
    CONTRIBUTION_MARGIN_RATIO("contribution_margin_ratio", Category.RATIO, Polarity.HIGHER_IS_BETTER),
    VARIABLE_COST_RATIO("variable_cost_ratio", Category.RATIO, Polarity.LOWER_IS_BETTER),
    MATURED_CLAIM_RATIO("matured_claim_ratio", Category.RATIO, Polarity.LOWER_IS_BETTER),
    AUTONOMY_COEFFICIENT("autonomy_coefficient", Category.RATIO, Polarity.HIGHER_IS_BETTER),
    PREMIUM_PROGRESS("premium_progress", Category.RATIO, Polarity.HIGHER_IS_BETTER),
    POLICY_COUNT_PROGRESS("policy_count_progress", Category.RATIO, Polarity.HIGHER_IS_BETTER),

    // absolutes (万元 for money, plain counts otherwise)
    SIGNED_PREMIUM("signed_premium", Category.ABSOLUTE, Polarity.HIGHER_IS_BETTER),
    MATURED_PREMIUM("matured_premium", Category.ABSOLUTE, Polarity.HIGHER_IS_BETTER),
    POLICY_COUNT("policy_count", Category.ABSOLUTE, Polarity.HIGHER_IS_BETTER),
    CLAIM_CASE_COUNT("claim_case_count", Category.ABSOLUTE, Polarity.LOWER_IS_BETTER),
    REPORTED_CLAIM_PAYMENT("reported_claim_payment", Category.ABSOLUTE, Polarity.LOWER_IS_BETTER),
    EXPENSE_AMOUNT("expense_amount", Category.ABSOLUTE, Polarity.LOWER_IS_BETTER),
    CONTRIBUTION_MARGIN_AMOUNT("contribution_margin_amount", Category.ABSOLUTE, Polarity.HIGHER_IS_BETTER),

    // targets
    ANNUAL_PREMIUM_TARGET("annual_premium_target", Category.TARGET, Polarity.NEUTRAL),
    ANNUAL_POLICY_COUNT_TARGET("annual_policy_count_target", Category.TARGET, Polarity.NEUTRAL),

    // per-policy / per-claim averages (yuan)
    AVERAGE_PREMIUM("average_premium", Category.AVERAGE, Polarity.HIGHER_IS_BETTER),
    AVERAGE_CLAIM("average_claim", Category.AVERAGE, Polarity.LOWER_IS_BETTER),
    AVERAGE_EXPENSE("average_expense", Category.AVERAGE, Polarity.LOWER_IS_BETTER),
    AVERAGE_CONTRIBUTION("average_contribution", Category.AVERAGE, Polarity.HIGHER_IS_BETTER);

    /** Metric family. */
    public enum Category {
        RATIO, ABSOLUTE, TARGET, AVERAGE
    }

    /** Which direction of change counts as an improvement. */
    public enum Polarity {
        HIGHER_IS_BETTER, LOWER_IS_BETTER, NEUTRAL
    }

    private final String jsonName;
    private final Category category;
    private final Polarity polarity;

    KpiKey(String jsonName, Category category, Polarity polarity) {
        this.jsonName = jsonName;
        this.category = category;
        this.polarity = polarity;
    }

    @JsonValue
    public String jsonName() {
        return jsonName;
    }

    public Category category() {
        return category;
    }

    public Polarity polarity() {
        return polarity;
    }

    /**
     * Resolve a key from its JSON name.
     *
     * @param jsonName e.g. {@code "loss_ratio"}
     * @return the matching key
     * @throws IllegalArgumentException if no key has that name
     */
    public static KpiKey fromJsonName(String jsonName) {
        for (KpiKey key : values()) {
            if (key.jsonName.equals(jsonName)) {
                return key;
            }
        }
        throw new IllegalArgumentException("Unknown KPI key: '" + jsonName + "'");
    }
}
