package com.modelspec.design;

import com.modelspec.variable.ManualVariableConfig;
import com.modelspec.variable.VariableKind;

import java.util.List;

/**
 * One factor of a factor-based design.
 *
 * @param name           Factor name
 * @param nLevels        Number of levels
 * @param levelLabels    Named levels, or empty for integer levels 1..n
 * @param referenceLevel Reference level, or null for the first level
 */
public record FactorDefinition(
        String name,
        int nLevels,
        List<String> levelLabels,
        String referenceLevel
) {
    public FactorDefinition {
        levelLabels = levelLabels == null ? List.of() : List.copyOf(levelLabels);
    }

    public static FactorDefinition of(String name, int nLevels) {
        return new FactorDefinition(name, nLevels, List.of(), null);
    }

    public static FactorDefinition of(String name, List<String> levelLabels, String referenceLevel) {
        return new FactorDefinition(name, levelLabels.size(), levelLabels, referenceLevel);
    }

    ManualVariableConfig toVariableConfig() {
        return new ManualVariableConfig(VariableKind.FACTOR, nLevels, levelLabels, referenceLevel);
    }
}
