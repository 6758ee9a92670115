package com.modelspec.variable;

import com.modelspec.exception.ConfigurationException;
import com.modelspec.exception.Stage;

import java.util.List;

/**
 * User-entered configuration for a variable (no uploaded data).
 *
 * @param kind           Variable kind
 * @param levelCount     Number of factor levels when no labels are given (null for default 3)
 * @param levelLabels    Named factor levels, or empty
 * @param referenceLevel Explicit reference level, or null
 */
public record ManualVariableConfig(
        VariableKind kind,
        Integer levelCount,
        List<String> levelLabels,
        String referenceLevel
) {
    public static final int DEFAULT_FACTOR_LEVELS = 3;

    public ManualVariableConfig {
        levelLabels = levelLabels == null ? List.of() : List.copyOf(levelLabels);
    }

    public static ManualVariableConfig continuous() {
        return new ManualVariableConfig(VariableKind.CONTINUOUS, null, null, null);
    }

    public static ManualVariableConfig binary() {
        return new ManualVariableConfig(VariableKind.BINARY, null, null, null);
    }

    public static ManualVariableConfig factor(int levelCount) {
        return new ManualVariableConfig(VariableKind.FACTOR, levelCount, null, null);
    }

    public static ManualVariableConfig factor(List<String> levelLabels, String referenceLevel) {
        return new ManualVariableConfig(VariableKind.FACTOR, null, levelLabels, referenceLevel);
    }

    /**
     * Build the resolved specification for the named variable.
     */
    public VariableSpec toSpec(String name) {
        return switch (kind) {
            case CONTINUOUS -> VariableSpec.continuous(name);
            case BINARY -> VariableSpec.binary(name, levelLabels, referenceLevel);
            case FACTOR -> factorSpec(name);
        };
    }

    private VariableSpec factorSpec(String name) {
        if (levelLabels.isEmpty()) {
            int count = levelCount == null ? DEFAULT_FACTOR_LEVELS : levelCount;
            VariableSpec spec = VariableSpec.factor(name, count);
            return referenceLevel == null ? spec : VariableSpec.factor(name, spec.levels(), referenceLevel);
        }
        if (levelCount != null && levelCount != levelLabels.size()) {
            throw new ConfigurationException(Stage.RESOLUTION, name, "Factor '" + name + "' declares "
                    + levelCount + " levels but lists " + levelLabels.size() + " labels");
        }
        return VariableSpec.factor(name, levelLabels, referenceLevel);
    }
}
