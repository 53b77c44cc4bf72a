package com.premiumlens.core.ingest;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Every validation error of one rejected row.
 *
 * @since 1.0.0
 */
public final class RowError {

    private final int row;
    private final List<String> messages;

    /**
     * @param row      1-based line number in the file (header is line 1)
     * @param messages error messages, at least one
     */
    public RowError(int row, List<String> messages) {
        this.row = row;
        this.messages = List.copyOf(Objects.requireNonNull(messages, "messages must not be null"));
    }

    @JsonProperty("row")
    public int getRow() {
        return row;
    }

    @JsonProperty("messages")
    public List<String> getMessages() {
        return messages;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RowError that))
            return false;
        return row == that.row && messages.equals(that.messages);
    }

    @Override
    public int hashCode() {
        return Objects.hash(row, messages);
    }

    @Override
    public String toString() {
        return "Row " + row + ": " + String.join("; ", messages);
    }
}
