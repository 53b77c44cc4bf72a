package com.premiumlens.core.ingest;

/**
 * Structural failure that prevents a file from being parsed at all, such as
 * an unreadable or empty input. Row-level problems are never reported this
 * way; they end up in the {@link ParseResult}.
 *
 * @since 1.0.0
 */
public class IngestException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public IngestException(String message) {
        super(message);
    }

    public IngestException(String message, Throwable cause) {
        super(message, cause);
    }
}
