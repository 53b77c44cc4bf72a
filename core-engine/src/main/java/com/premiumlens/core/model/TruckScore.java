package com.premiumlens.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Score band used for both the large-truck and small-truck scoring models.
 */
public enum TruckScore implements LabeledValue {
    A, B, C, D, E, X;

    @Override
    @JsonValue
    public String label() {
        return name();
    }
}
