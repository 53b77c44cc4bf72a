package com.premiumlens.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Whether the policy is new business, a renewal, or transferred in from
 * another insurer.
 */
public enum RenewalStatus implements LabeledValue {
    NEW("新保"),
    RENEWAL("续保"),
    TRANSFER("转保");

    private final String label;

    RenewalStatus(String label) {
        this.label = label;
    }

    @Override
    @JsonValue
    public String label() {
        return label;
    }
}
