package com.premiumlens.core.model;

/**
 * Tri-state constraint on the new-energy vehicle flag.
 */
public enum NewEnergyFilter {
    /** No constraint. */
    ANY,
    NEW_ENERGY_ONLY,
    CONVENTIONAL_ONLY
}
