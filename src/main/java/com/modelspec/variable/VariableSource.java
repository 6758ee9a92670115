package com.modelspec.variable;

/**
 * Origin of a resolved variable specification.
 */
public enum VariableSource {
    /**
     * Derived from an uploaded dataset through the data provider.
     */
    DATA,

    /**
     * Entered manually in the variable configuration.
     */
    MANUAL
}
