package com.premiumlens.core.ingest;

import com.premiumlens.core.model.InsuranceRecord;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of parsing one CSV file.
 *
 * <p>
 * {@code data} holds every row that passed validation, in file order.
 * {@code errors} and {@code warnings} are capped lists meant for display;
 * {@link #getStats()} always carries the uncapped counts.
 * </p>
 *
 * @since 1.0.0
 */
public final class ParseResult {

    private final List<InsuranceRecord> data;
    private final List<RowError> errors;
    private final List<String> warnings;
    private final ParseStats stats;
    private final String encoding;
    private final Duration elapsed;

    public ParseResult(List<InsuranceRecord> data, List<RowError> errors, List<String> warnings,
            ParseStats stats, String encoding, Duration elapsed) {
        this.data = List.copyOf(Objects.requireNonNull(data, "data must not be null"));
        this.errors = List.copyOf(Objects.requireNonNull(errors, "errors must not be null"));
        this.warnings = List.copyOf(Objects.requireNonNull(warnings, "warnings must not be null"));
        this.stats = Objects.requireNonNull(stats, "stats must not be null");
        this.encoding = encoding;
        this.elapsed = Objects.requireNonNull(elapsed, "elapsed must not be null");
    }

    /**
     * @return {@code true} when at least one row produced a valid record
     */
    public boolean isSuccess() {
        return !data.isEmpty();
    }

    public List<InsuranceRecord> getData() {
        return data;
    }

    public List<RowError> getErrors() {
        return errors;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public ParseStats getStats() {
        return stats;
    }

    /**
     * @return detected charset name, or {@code null} when the parse started
     *         from already decoded text
     */
    public String getEncoding() {
        return encoding;
    }

    public Duration getElapsed() {
        return elapsed;
    }

    @Override
    public String toString() {
        return "ParseResult{success=" + isSuccess() + ", stats=" + stats + ", encoding=" + encoding
                + ", reportedErrors=" + errors.size() + ", reportedWarnings=" + warnings.size()
                + ", elapsed=" + elapsed + '}';
    }
}
