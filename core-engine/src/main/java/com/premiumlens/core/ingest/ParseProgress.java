package com.premiumlens.core.ingest;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Progress snapshot delivered between chunks of a parse.
 *
 * <p>
 * {@code totalRows} is an estimate taken from the line count of the decoded
 * text; it never drops below {@code processedRows}.
 * </p>
 *
 * @since 1.0.0
 */
public final class ParseProgress {

    private final long processedRows;
    private final long totalRows;
    private final ParsePhase currentPhase;
    private final Duration estimatedTimeRemaining;

    public ParseProgress(long processedRows, long totalRows, ParsePhase currentPhase,
            Duration estimatedTimeRemaining) {
        this.processedRows = processedRows;
        this.totalRows = Math.max(totalRows, processedRows);
        this.currentPhase = Objects.requireNonNull(currentPhase, "currentPhase must not be null");
        this.estimatedTimeRemaining = estimatedTimeRemaining;
    }

    public long getProcessedRows() {
        return processedRows;
    }

    public long getTotalRows() {
        return totalRows;
    }

    /**
     * @return completion in percent, 100 once the parse is complete
     */
    public double getPercentage() {
        if (currentPhase == ParsePhase.COMPLETE) {
            return 100.0;
        }
        return totalRows == 0 ? 0.0 : processedRows * 100.0 / totalRows;
    }

    public ParsePhase getCurrentPhase() {
        return currentPhase;
    }

    /**
     * @return remaining time extrapolated from the throughput so far, empty
     *         before the first chunk completes
     */
    public Optional<Duration> getEstimatedTimeRemaining() {
        return Optional.ofNullable(estimatedTimeRemaining);
    }

    @Override
    public String toString() {
        return String.format("ParseProgress{%s %d/%d (%.1f%%), eta=%s}",
                currentPhase, processedRows, totalRows, getPercentage(), estimatedTimeRemaining);
    }
}
