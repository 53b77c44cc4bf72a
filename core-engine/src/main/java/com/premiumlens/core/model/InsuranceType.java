package com.premiumlens.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Line of motor insurance: voluntary commercial cover or compulsory traffic
 * liability.
 */
public enum InsuranceType implements LabeledValue {
    COMMERCIAL("商业险"),
    COMPULSORY("交强险");

    private final String label;

    InsuranceType(String label) {
        this.label = label;
    }

    @Override
    @JsonValue
    public String label() {
        return label;
    }
}
