package com.premiumlens.core.ingest;

import com.premiumlens.core.model.InsuranceRecord;

import java.util.List;
import java.util.Optional;

/**
 * Result of validating a single CSV row: a record when the row had no errors,
 * plus every error and warning raised along the way.
 *
 * @since 1.0.0
 */
public final class RowOutcome {

    private final InsuranceRecord record;
    private final List<String> errors;
    private final List<String> warnings;

    RowOutcome(InsuranceRecord record, List<String> errors, List<String> warnings) {
        this.record = record;
        this.errors = List.copyOf(errors);
        this.warnings = List.copyOf(warnings);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    /**
     * @return the validated record, empty when the row has errors
     */
    public Optional<InsuranceRecord> getRecord() {
        return Optional.ofNullable(record);
    }

    public List<String> getErrors() {
        return errors;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    @Override
    public String toString() {
        return "RowOutcome{valid=" + isValid() + ", errors=" + errors + ", warnings=" + warnings + '}';
    }
}
