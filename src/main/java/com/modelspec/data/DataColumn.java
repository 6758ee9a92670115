package com.modelspec.data;

import com.modelspec.variable.VariableKind;
import com.modelspec.variable.VariableSpec;

import java.util.List;

/**
 * Data-derived description of one uploaded column.
 *
 * @param name           Column name
 * @param kind           Detected kind
 * @param levels         Sorted unique observed values (factor and binary only)
 * @param referenceLevel Default reference level (first level), or null for continuous
 */
public record DataColumn(
        String name,
        VariableKind kind,
        List<String> levels,
        String referenceLevel
) {
    public DataColumn {
        levels = levels == null ? List.of() : List.copyOf(levels);
    }

    /**
     * Convert to a variable specification, validating factor level ranges.
     */
    public VariableSpec toVariableSpec() {
        return toVariableSpec(null);
    }

    /**
     * Convert to a variable specification with a user-chosen reference level.
     * The observed levels are kept; the reference must be one of them.
     *
     * @param referenceOverride Reference level, or null for the default
     */
    public VariableSpec toVariableSpec(String referenceOverride) {
        String reference = referenceOverride == null ? referenceLevel : referenceOverride;
        return switch (kind) {
            case CONTINUOUS -> VariableSpec.continuous(name);
            case BINARY -> VariableSpec.binary(name, levels, reference);
            case FACTOR -> VariableSpec.factor(name, levels, reference);
        };
    }
}
