package com.premiumlens.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Coverage combination sold on the policy.
 */
public enum CoverageType implements LabeledValue {
    /** Full commercial package. */
    FULL("主全"),
    /** Compulsory plus third-party liability. */
    COMPULSORY_THIRD_PARTY("交三"),
    /** Compulsory cover only. */
    COMPULSORY_ONLY("单交");

    private final String label;

    CoverageType(String label) {
        this.label = label;
    }

    @Override
    @JsonValue
    public String label() {
        return label;
    }
}
