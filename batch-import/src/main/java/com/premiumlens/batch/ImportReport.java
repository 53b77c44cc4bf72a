package com.premiumlens.batch;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.premiumlens.core.ingest.BatchImportResult;
import com.premiumlens.core.ingest.FileImportResult;
import com.premiumlens.core.ingest.ImportMode;
import com.premiumlens.core.ingest.ParseResult;
import com.premiumlens.core.ingest.ParseStats;
import com.premiumlens.core.ingest.RowError;
import com.premiumlens.core.kpi.KpiFormula;
import com.premiumlens.core.kpi.KpiFormulaCatalog;
import com.premiumlens.core.model.KpiKey;
import com.premiumlens.core.model.KpiResult;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * JSON document written at the end of a batch import run.
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "generated_at", "mode", "files", "totals", "kpi_week", "kpi", "formula_keys" })
public final class ImportReport {

    private final Instant generatedAt;
    private final ImportMode mode;
    private final List<FileEntry> files;
    private final Totals totals;
    private final Integer kpiWeek;
    private final KpiResult kpi;
    private final List<KpiKey> formulaKeys;

    private ImportReport(Instant generatedAt, ImportMode mode, List<FileEntry> files, Totals totals,
            Integer kpiWeek, KpiResult kpi, List<KpiKey> formulaKeys) {
        this.generatedAt = generatedAt;
        this.mode = mode;
        this.files = files;
        this.totals = totals;
        this.kpiWeek = kpiWeek;
        this.kpi = kpi;
        this.formulaKeys = formulaKeys;
    }

    /**
     * @param batch       finished batch
     * @param kpiWeek     week the KPI snapshot covers, {@code null} when no
     *                    record was imported
     * @param kpi         KPI snapshot of that week, {@code null} when no
     *                    record was imported
     * @param mode        scheduling mode of the run
     * @param generatedAt report timestamp
     */
    public static ImportReport of(BatchImportResult batch, Integer kpiWeek, KpiResult kpi, ImportMode mode,
            Instant generatedAt) {
        Objects.requireNonNull(batch, "BatchImportResult must not be null");
        Objects.requireNonNull(mode, "ImportMode must not be null");
        Objects.requireNonNull(generatedAt, "generatedAt must not be null");

        List<FileEntry> files = batch.getFiles().stream().map(FileEntry::new).toList();
        List<KpiKey> keys = KpiFormulaCatalog.all().stream().map(KpiFormula::getKey).toList();
        return new ImportReport(generatedAt, mode, files, new Totals(batch), kpiWeek, kpi, keys);
    }

    @JsonProperty("generated_at")
    public Instant getGeneratedAt() {
        return generatedAt;
    }

    @JsonProperty("mode")
    public ImportMode getMode() {
        return mode;
    }

    @JsonProperty("files")
    public List<FileEntry> getFiles() {
        return files;
    }

    @JsonProperty("totals")
    public Totals getTotals() {
        return totals;
    }

    @JsonProperty("kpi_week")
    public Integer getKpiWeek() {
        return kpiWeek;
    }

    @JsonProperty("kpi")
    public KpiResult getKpi() {
        return kpi;
    }

    @JsonProperty("formula_keys")
    public List<KpiKey> getFormulaKeys() {
        return formulaKeys;
    }

    // ---------------------------------------------------------------
    // Nested sections
    // ---------------------------------------------------------------

    /**
     * Outcome of one file. A failed file carries only its failure message.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({ "source", "status", "failure", "encoding", "stats", "elapsed_ms", "errors",
            "warning_count" })
    public static final class FileEntry {

        private final String source;
        private final String status;
        private final String failure;
        private final String encoding;
        private final ParseStats stats;
        private final Long elapsedMs;
        private final List<RowError> errors;
        private final Integer warningCount;

        FileEntry(FileImportResult file) {
            this.source = file.getSourceName();
            this.status = ImportMetrics.statusOf(file);
            this.failure = file.getFailure().orElse(null);
            ParseResult result = file.getResult().orElse(null);
            this.encoding = result == null ? null : result.getEncoding();
            this.stats = result == null ? null : result.getStats();
            this.elapsedMs = result == null ? null : result.getElapsed().toMillis();
            this.errors = result == null ? null : result.getErrors();
            this.warningCount = result == null ? null : result.getWarnings().size();
        }

        @JsonProperty("source")
        public String getSource() {
            return source;
        }

        @JsonProperty("status")
        public String getStatus() {
            return status;
        }

        @JsonProperty("failure")
        public String getFailure() {
            return failure;
        }

        @JsonProperty("encoding")
        public String getEncoding() {
            return encoding;
        }

        @JsonProperty("stats")
        public ParseStats getStats() {
            return stats;
        }

        @JsonProperty("elapsed_ms")
        public Long getElapsedMs() {
            return elapsedMs;
        }

        @JsonProperty("errors")
        public List<RowError> getErrors() {
            return errors;
        }

        @JsonProperty("warning_count")
        public Integer getWarningCount() {
            return warningCount;
        }
    }

    /**
     * Row and file counts over the whole batch.
     */
    @JsonPropertyOrder({ "files", "succeeded_files", "total_rows", "valid_rows", "invalid_rows",
            "duplicates_removed", "records" })
    public static final class Totals {

        private final int files;
        private final long succeededFiles;
        private final int totalRows;
        private final int validRows;
        private final int invalidRows;
        private final int duplicatesRemoved;
        private final int records;

        Totals(BatchImportResult batch) {
            this.files = batch.getFiles().size();
            this.succeededFiles = batch.getSucceededFiles();
            this.totalRows = batch.getTotalRows();
            this.validRows = batch.getValidRows();
            this.invalidRows = batch.getInvalidRows();
            this.duplicatesRemoved = batch.getDuplicatesRemoved();
            this.records = batch.getRecords().size();
        }

        @JsonProperty("files")
        public int getFiles() {
            return files;
        }

        @JsonProperty("succeeded_files")
        public long getSucceededFiles() {
            return succeededFiles;
        }

        @JsonProperty("total_rows")
        public int getTotalRows() {
            return totalRows;
        }

        @JsonProperty("valid_rows")
        public int getValidRows() {
            return validRows;
        }

        @JsonProperty("invalid_rows")
        public int getInvalidRows() {
            return invalidRows;
        }

        @JsonProperty("duplicates_removed")
        public int getDuplicatesRemoved() {
            return duplicatesRemoved;
        }

        @JsonProperty("records")
        public int getRecords() {
            return records;
        }
    }
}
