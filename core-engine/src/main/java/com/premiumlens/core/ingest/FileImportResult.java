package com.premiumlens.core.ingest;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one file in a batch: either a {@link ParseResult} or the
 * structural failure that prevented parsing.
 *
 * @since 1.0.0
 */
public final class FileImportResult {

    private final String sourceName;
    private final ParseResult result;
    private final String failure;

    private FileImportResult(String sourceName, ParseResult result, String failure) {
        this.sourceName = Objects.requireNonNull(sourceName, "sourceName must not be null");
        this.result = result;
        this.failure = failure;
    }

    static FileImportResult parsed(String sourceName, ParseResult result) {
        return new FileImportResult(sourceName, Objects.requireNonNull(result, "result must not be null"), null);
    }

    static FileImportResult failed(String sourceName, String failure) {
        return new FileImportResult(sourceName, null, Objects.requireNonNull(failure, "failure must not be null"));
    }

    public String getSourceName() {
        return sourceName;
    }

    /**
     * @return the parse result, empty when the file failed structurally
     */
    public Optional<ParseResult> getResult() {
        return Optional.ofNullable(result);
    }

    /**
     * @return failure message, empty when the file was parsed
     */
    public Optional<String> getFailure() {
        return Optional.ofNullable(failure);
    }

    /**
     * @return {@code true} when the file parsed and yielded at least one valid
     *         record
     */
    public boolean isSuccess() {
        return result != null && result.isSuccess();
    }

    @Override
    public String toString() {
        return "FileImportResult{source='" + sourceName + '\''
                + (result != null ? ", result=" + result : ", failure='" + failure + '\'') + '}';
    }
}
