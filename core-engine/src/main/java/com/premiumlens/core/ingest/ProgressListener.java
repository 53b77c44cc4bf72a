package com.premiumlens.core.ingest;

/**
 * Port through which a parse reports progress. Called on the parsing thread
 * between chunks; implementations should return quickly.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface ProgressListener {

    /** Listener that ignores every update. */
    ProgressListener NONE = progress -> {
    };

    /**
     * @param progress latest snapshot
     */
    void onProgress(ParseProgress progress);
}
