package com.premiumlens.core.ingest;

/**
 * Stage reported by {@link ParseProgress}.
 */
public enum ParsePhase {
    DECODING,
    PARSING,
    COMPLETE
}
