package com.premiumlens.core.ingest;

/**
 * How a batch of files is scheduled.
 */
public enum ImportMode {
    /** One task per file on a worker pool, awaited jointly. */
    PARALLEL,
    /** Files parsed one after another on the calling thread. */
    SEQUENTIAL
}
