package com.premiumlens.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Chengdu branch split: the city itself or the central sub-branches.
 */
public enum Branch implements LabeledValue {
    CHENGDU("成都"),
    SUB_BRANCH("中支");

    private final String label;

    Branch(String label) {
        this.label = label;
    }

    @Override
    @JsonValue
    public String label() {
        return label;
    }
}
