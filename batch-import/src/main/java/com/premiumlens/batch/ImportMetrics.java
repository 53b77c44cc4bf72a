package com.premiumlens.batch;

import com.premiumlens.core.ingest.FileImportResult;
import com.premiumlens.core.ingest.ParseResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer meters for a batch import run.
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 * <li>{@code premium_lens.files_processed_total{status}}: files by outcome,
 * {@code imported}, {@code empty} (parsed without a valid row) or
 * {@code failed}</li>
 * <li>{@code premium_lens.rows_valid_total}: rows kept</li>
 * <li>{@code premium_lens.rows_invalid_total}: rows rejected</li>
 * <li>{@code premium_lens.file_parse_latency}: parse time per file</li>
 * </ul>
 */
public class ImportMetrics {

    static final String FILES_PROCESSED = "premium_lens.files_processed_total";

    private final MeterRegistry registry;
    private final Counter rowsValid;
    private final Counter rowsInvalid;
    private final Timer parseLatency;

    public ImportMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "MeterRegistry must not be null");
        this.rowsValid = registry.counter("premium_lens.rows_valid_total");
        this.rowsInvalid = registry.counter("premium_lens.rows_invalid_total");
        this.parseLatency = Timer.builder("premium_lens.file_parse_latency")
                .description("Time spent decoding and parsing one file")
                .register(registry);
    }

    public void recordFile(FileImportResult file) {
        Objects.requireNonNull(file, "FileImportResult must not be null");
        registry.counter(FILES_PROCESSED, "status", statusOf(file)).increment();
        file.getResult().ifPresent(this::recordParse);
    }

    public double filesProcessed(String status) {
        Counter counter = registry.find(FILES_PROCESSED).tag("status", status).counter();
        return counter == null ? 0 : counter.count();
    }

    public double rowsValid() {
        return rowsValid.count();
    }

    public double rowsInvalid() {
        return rowsInvalid.count();
    }

    public long parsesTimed() {
        return parseLatency.count();
    }

    /**
     * One-line digest for the run summary log.
     */
    public String summary() {
        return String.format("files imported=%.0f empty=%.0f failed=%.0f, rows valid=%.0f invalid=%.0f, "
                + "parse time total=%.0fms max=%.0fms",
                filesProcessed("imported"), filesProcessed("empty"), filesProcessed("failed"),
                rowsValid(), rowsInvalid(),
                parseLatency.totalTime(TimeUnit.MILLISECONDS), parseLatency.max(TimeUnit.MILLISECONDS));
    }

    static String statusOf(FileImportResult file) {
        if (file.getFailure().isPresent()) {
            return "failed";
        }
        return file.isSuccess() ? "imported" : "empty";
    }

    private void recordParse(ParseResult result) {
        rowsValid.increment(result.getStats().getValidRows());
        rowsInvalid.increment(result.getStats().getInvalidRows());
        parseLatency.record(result.getElapsed());
    }
}
