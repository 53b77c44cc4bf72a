package com.premiumlens.core.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * CSV ingestion settings, bound from the {@code ingest} section of the engine
 * YAML.
 *
 * @since 1.0.0
 */
public class IngestSettings {

    /** Rows processed between two progress reports. */
    private int chunkSize = 1000;

    /** Row errors kept in a parse result; further errors are only counted. */
    private int maxReportedErrors = 20;

    /** Row warnings kept in a parse result. */
    private int maxReportedWarnings = 100;

    /** Prefix length, in bytes, scored by the encoding detector. */
    private int encodingSampleBytes = 256 * 1024;

    /** Candidate charsets in tie-break order. */
    private List<String> candidateEncodings = new ArrayList<>(List.of("utf-8", "gb18030", "gbk", "gb2312"));

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public int getChunkSize() {
        return chunkSize;
    }

    public void setChunkSize(int chunkSize) {
        this.chunkSize = chunkSize;
    }

    public int getMaxReportedErrors() {
        return maxReportedErrors;
    }

    public void setMaxReportedErrors(int maxReportedErrors) {
        this.maxReportedErrors = maxReportedErrors;
    }

    public int getMaxReportedWarnings() {
        return maxReportedWarnings;
    }

    public void setMaxReportedWarnings(int maxReportedWarnings) {
        this.maxReportedWarnings = maxReportedWarnings;
    }

    public int getEncodingSampleBytes() {
        return encodingSampleBytes;
    }

    public void setEncodingSampleBytes(int encodingSampleBytes) {
        this.encodingSampleBytes = encodingSampleBytes;
    }

    /**
     * @return unmodifiable list of candidate charset names
     */
    public List<String> getCandidateEncodings() {
        return Collections.unmodifiableList(candidateEncodings);
    }

    public void setCandidateEncodings(List<String> candidateEncodings) {
        this.candidateEncodings = candidateEncodings != null
                ? new ArrayList<>(candidateEncodings)
                : new ArrayList<>();
    }

    /**
     * Collect every problem with these settings.
     *
     * @param errors sink for human-readable problems
     */
    void collectErrors(List<String> errors) {
        if (chunkSize < 1) {
            errors.add("ingest.chunkSize must be >= 1, got: " + chunkSize);
        }
        if (maxReportedErrors < 0) {
            errors.add("ingest.maxReportedErrors must be >= 0, got: " + maxReportedErrors);
        }
        if (maxReportedWarnings < 0) {
            errors.add("ingest.maxReportedWarnings must be >= 0, got: " + maxReportedWarnings);
        }
        if (encodingSampleBytes < 1024) {
            errors.add("ingest.encodingSampleBytes must be >= 1024, got: " + encodingSampleBytes);
        }
        if (candidateEncodings.isEmpty()) {
            errors.add("ingest.candidateEncodings must list at least one charset");
        }
    }

    @Override
    public String toString() {
        return "IngestSettings{" +
                "chunkSize=" + chunkSize +
                ", maxReportedErrors=" + maxReportedErrors +
                ", maxReportedWarnings=" + maxReportedWarnings +
                ", encodingSampleBytes=" + encodingSampleBytes +
                ", candidateEncodings=" + candidateEncodings +
                '}';
    }
}
