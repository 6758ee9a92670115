package com.modelspec.variable;

import com.modelspec.exception.ConfigurationException;

/**
 * Kind of a model variable.
 */
public enum VariableKind {
    /**
     * Continuous predictor, one coefficient.
     */
    CONTINUOUS,

    /**
     * Two-level predictor, treated as its own single dummy.
     */
    BINARY,

    /**
     * Categorical predictor with 2-20 levels, one dummy per non-reference level.
     */
    FACTOR;

    /**
     * Parse a kind from configuration text ("continuous", "binary", "factor").
     *
     * @param value Configuration value
     * @return The variable kind
     * @throws ConfigurationException if the value is not a known kind
     */
    public static VariableKind fromConfig(String value) {
        if (value == null || value.isBlank()) {
            return CONTINUOUS;
        }
        try {
            return VariableKind.valueOf(value.trim().toUpperCase().replace("-", "_"));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(value, "Unknown variable type '" + value
                    + "'. Must be continuous, binary or factor.");
        }
    }

    /**
     * Name used in configuration and in exported variable types.
     */
    public String configName() {
        return name().toLowerCase();
    }
}
