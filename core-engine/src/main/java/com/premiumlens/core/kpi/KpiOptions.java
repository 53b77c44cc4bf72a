package com.premiumlens.core.kpi;

import java.util.Objects;
import java.util.Optional;

/**
 * Caller-supplied parameters of a KPI calculation.
 *
 * <ul>
 * <li>{@code annualTargetYuan}: premium plan overriding the summed
 * {@code premium_plan_yuan} of the records.</li>
 * <li>{@code annualPolicyCountTarget}: enables
 * {@code policy_count_progress}.</li>
 * <li>{@code currentWeekNumber} / {@code year}: the reference point of the
 * time progress; when absent the latest week and year of the record set are
 * used.</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class KpiOptions {

    private static final KpiOptions DEFAULTS = builder().build();

    private final Double annualTargetYuan;
    private final Long annualPolicyCountTarget;
    private final KpiMode mode;
    private final Integer currentWeekNumber;
    private final Integer year;

    private KpiOptions(Builder b) {
        this.annualTargetYuan = b.annualTargetYuan;
        this.annualPolicyCountTarget = b.annualPolicyCountTarget;
        this.mode = Objects.requireNonNull(b.mode, "KpiMode must not be null");
        this.currentWeekNumber = b.currentWeekNumber;
        this.year = b.year;
    }

    /**
     * Cumulative mode, no targets, reference week taken from the data.
     */
    public static KpiOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .annualTargetYuan(annualTargetYuan)
                .annualPolicyCountTarget(annualPolicyCountTarget)
                .mode(mode)
                .currentWeekNumber(currentWeekNumber)
                .year(year);
    }

    public Optional<Double> getAnnualTargetYuan() {
        return Optional.ofNullable(annualTargetYuan);
    }

    public Optional<Long> getAnnualPolicyCountTarget() {
        return Optional.ofNullable(annualPolicyCountTarget);
    }

    public KpiMode getMode() {
        return mode;
    }

    public Optional<Integer> getCurrentWeekNumber() {
        return Optional.ofNullable(currentWeekNumber);
    }

    public Optional<Integer> getYear() {
        return Optional.ofNullable(year);
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static class Builder {
        private Double annualTargetYuan;
        private Long annualPolicyCountTarget;
        private KpiMode mode = KpiMode.CURRENT;
        private Integer currentWeekNumber;
        private Integer year;

        /**
         * @throws IllegalArgumentException if the target is negative or not
         *                                  finite
         */
        public Builder annualTargetYuan(Double v) {
            if (v != null && (!Double.isFinite(v) || v < 0)) {
                throw new IllegalArgumentException("annualTargetYuan must be a finite value >= 0, got: " + v);
            }
            this.annualTargetYuan = v;
            return this;
        }

        public Builder annualPolicyCountTarget(Long v) {
            if (v != null && v < 0) {
                throw new IllegalArgumentException("annualPolicyCountTarget must be >= 0, got: " + v);
            }
            this.annualPolicyCountTarget = v;
            return this;
        }

        public Builder mode(KpiMode v) {
            this.mode = v;
            return this;
        }

        public Builder currentWeekNumber(Integer v) {
            if (v != null && v < 1) {
                throw new IllegalArgumentException("currentWeekNumber must be >= 1, got: " + v);
            }
            this.currentWeekNumber = v;
            return this;
        }

        public Builder year(Integer v) {
            this.year = v;
            return this;
        }

        public KpiOptions build() {
            return new KpiOptions(this);
        }
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof KpiOptions that))
            return false;
        return Objects.equals(annualTargetYuan, that.annualTargetYuan)
                && Objects.equals(annualPolicyCountTarget, that.annualPolicyCountTarget)
                && mode == that.mode
                && Objects.equals(currentWeekNumber, that.currentWeekNumber)
                && Objects.equals(year, that.year);
    }

    @Override
    public int hashCode() {
        return Objects.hash(annualTargetYuan, annualPolicyCountTarget, mode, currentWeekNumber, year);
    }

    @Override
    public String toString() {
        return "KpiOptions{" +
                "annualTargetYuan=" + annualTargetYuan +
                ", annualPolicyCountTarget=" + annualPolicyCountTarget +
                ", mode=" + mode +
                ", currentWeekNumber=" + currentWeekNumber +
                ", year=" + year +
                '}';
    }
}
