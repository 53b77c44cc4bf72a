package com.premiumlens.core.ingest;

import com.premiumlens.core.model.InsuranceRecord;

import java.util.List;
import java.util.Objects;

/**
 * Aggregate outcome of a batch import.
 *
 * @since 1.0.0
 */
public final class BatchImportResult {

    private final List<FileImportResult> files;
    private final List<InsuranceRecord> records;
    private final int duplicatesRemoved;

    BatchImportResult(List<FileImportResult> files, List<InsuranceRecord> records, int duplicatesRemoved) {
        this.files = List.copyOf(Objects.requireNonNull(files, "files must not be null"));
        this.records = List.copyOf(Objects.requireNonNull(records, "records must not be null"));
        this.duplicatesRemoved = duplicatesRemoved;
    }

    /**
     * @return per-file results in submission order
     */
    public List<FileImportResult> getFiles() {
        return files;
    }

    /**
     * @return valid records of every file, merged and de-duplicated
     */
    public List<InsuranceRecord> getRecords() {
        return records;
    }

    public int getDuplicatesRemoved() {
        return duplicatesRemoved;
    }

    public int getTotalRows() {
        return files.stream().flatMap(f -> f.getResult().stream())
                .mapToInt(r -> r.getStats().getTotalRows()).sum();
    }

    public int getValidRows() {
        return files.stream().flatMap(f -> f.getResult().stream())
                .mapToInt(r -> r.getStats().getValidRows()).sum();
    }

    public int getInvalidRows() {
        return files.stream().flatMap(f -> f.getResult().stream())
                .mapToInt(r -> r.getStats().getInvalidRows()).sum();
    }

    /**
     * @return number of files that yielded at least one valid record
     */
    public long getSucceededFiles() {
        return files.stream().filter(FileImportResult::isSuccess).count();
    }

    /**
     * @return {@code true} when at least one file yielded valid records
     */
    public boolean isSuccess() {
        return getSucceededFiles() > 0;
    }

    @Override
    public String toString() {
        return "BatchImportResult{files=" + files.size() +
                ", succeeded=" + getSucceededFiles() +
                ", rows=" + getTotalRows() +
                ", valid=" + getValidRows() +
                ", invalid=" + getInvalidRows() +
                ", records=" + records.size() +
                ", duplicatesRemoved=" + duplicatesRemoved +
                '}';
    }
}
