package com.premiumlens.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Highway exposure risk grade, A to F, X for unrated.
 */
public enum HighwayRiskGrade implements LabeledValue {
    A, B, C, D, E, F, X;

    @Override
    @JsonValue
    public String label() {
        return name();
    }
}
