package com.premiumlens.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Vehicle insurance risk grade, A (best) to G, X for unrated.
 */
public enum VehicleGrade implements LabeledValue {
    A, B, C, D, E, F, G, X;

    @Override
    @JsonValue
    public String label() {
        return name();
    }
}
