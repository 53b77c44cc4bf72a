package com.premiumlens.core.kpi;

import com.premiumlens.core.model.KpiKey;

import java.util.Objects;
import java.util.Optional;

/**
 * Human-readable definition of one KPI: how it is computed and what it means
 * for the business.
 *
 * @since 1.0.0
 */
public final class KpiFormula {

    private final KpiKey key;
    private final String name;
    private final String formula;
    private final String description;
    private final String numerator;
    private final String denominator;
    private final String unit;
    private final String businessMeaning;
    private final String example;

    KpiFormula(KpiKey key, String name, String formula, String description, String numerator, String denominator,
            String unit, String businessMeaning, String example) {
        this.key = Objects.requireNonNull(key, "KPI key must not be null");
        this.name = Objects.requireNonNull(name, "Name must not be null");
        this.formula = Objects.requireNonNull(formula, "Formula must not be null");
        this.description = Objects.requireNonNull(description, "Description must not be null");
        this.numerator = numerator;
        this.denominator = denominator;
        this.unit = Objects.requireNonNull(unit, "Unit must not be null");
        this.businessMeaning = Objects.requireNonNull(businessMeaning, "Business meaning must not be null");
        this.example = Objects.requireNonNull(example, "Example must not be null");
    }

    public KpiKey getKey() {
        return key;
    }

    public String getName() {
        return name;
    }

    public String getFormula() {
        return formula;
    }

    public String getDescription() {
        return description;
    }

    /**
     * @return numerator description, empty for metrics that are not a
     *         quotient
     */
    public Optional<String> getNumerator() {
        return Optional.ofNullable(numerator);
    }

    public Optional<String> getDenominator() {
        return Optional.ofNullable(denominator);
    }

    /**
     * @return display unit; empty text for a plain factor
     */
    public String getUnit() {
        return unit;
    }

    public String getBusinessMeaning() {
        return businessMeaning;
    }

    public String getExample() {
        return example;
    }

    @Override
    public String toString() {
        return "KpiFormula{key=" + key + ", name='" + name + "', formula='" + formula + "'}";
    }
}
