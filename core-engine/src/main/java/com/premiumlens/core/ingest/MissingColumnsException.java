package com.premiumlens.core.ingest;

import java.util.List;

/**
 * Thrown before any row is read when the header lacks required columns.
 *
 * @since 1.0.0
 */
public class MissingColumnsException extends IngestException {

    private static final long serialVersionUID = 1L;

    private final List<String> missingColumns;

    public MissingColumnsException(List<String> missingColumns) {
        super("CSV header is missing required column(s): " + String.join(", ", missingColumns));
        this.missingColumns = List.copyOf(missingColumns);
    }

    /**
     * @return missing column names in canonical column order
     */
    public List<String> getMissingColumns() {
        return missingColumns;
    }
}
