package com.premiumlens.core.ingest;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Row counts of one parse. Blank lines are not counted.
 *
 * @since 1.0.0
 */
public final class ParseStats {

    private final int totalRows;
    private final int validRows;
    private final int invalidRows;

    public ParseStats(int totalRows, int validRows, int invalidRows) {
        this.totalRows = totalRows;
        this.validRows = validRows;
        this.invalidRows = invalidRows;
    }

    @JsonProperty("totalRows")
    public int getTotalRows() {
        return totalRows;
    }

    @JsonProperty("validRows")
    public int getValidRows() {
        return validRows;
    }

    @JsonProperty("invalidRows")
    public int getInvalidRows() {
        return invalidRows;
    }

    @Override
    public String toString() {
        return "ParseStats{total=" + totalRows + ", valid=" + validRows + ", invalid=" + invalidRows + '}';
    }
}
