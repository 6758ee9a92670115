package com.modelspec.variable;

import com.modelspec.exception.ConfigurationException;
import com.modelspec.exception.FactorLevelRangeException;
import com.modelspec.exception.Stage;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Resolved specification of a single variable.
 *
 * @param name           Variable name as written in the formula
 * @param kind           Continuous, binary or factor
 * @param levels         Ordered distinct level labels (empty for continuous)
 * @param referenceLevel Level omitted from dummy expansion (null for continuous)
 */
public record VariableSpec(
        String name,
        VariableKind kind,
        List<String> levels,
        String referenceLevel
) {
    public static final int MIN_FACTOR_LEVELS = 2;
    public static final int MAX_FACTOR_LEVELS = 20;

    private static final List<String> CANONICAL_BINARY_LEVELS = List.of("0", "1");

    public VariableSpec {
        levels = List.copyOf(levels);
    }

    /**
     * Create a continuous variable.
     */
    public static VariableSpec continuous(String name) {
        return new VariableSpec(name, VariableKind.CONTINUOUS, List.of(), null);
    }

    /**
     * Create a binary variable with the canonical levels 0 and 1.
     */
    public static VariableSpec binary(String name) {
        return new VariableSpec(name, VariableKind.BINARY, CANONICAL_BINARY_LEVELS, "0");
    }

    /**
     * Create a binary variable from two observed levels; the first in sort order is the reference.
     */
    public static VariableSpec binary(String name, List<String> levels) {
        if (levels == null || levels.isEmpty()) {
            return binary(name);
        }
        List<String> sorted = LevelLabels.sorted(levels);
        if (sorted.size() != 2 || sorted.get(0).equals(sorted.get(1))) {
            throw new ConfigurationException(Stage.RESOLUTION, name, "Binary variable '" + name
                    + "' needs exactly two distinct levels, got " + levels);
        }
        return new VariableSpec(name, VariableKind.BINARY, sorted, sorted.get(0));
    }

    /**
     * Create a binary variable from two observed levels with an explicit reference.
     *
     * @throws ConfigurationException if the reference is not one of the levels
     */
    public static VariableSpec binary(String name, List<String> levels, String referenceLevel) {
        VariableSpec spec = binary(name, levels);
        if (referenceLevel == null || referenceLevel.equals(spec.referenceLevel())) {
            return spec;
        }
        if (!spec.levels().contains(referenceLevel)) {
            throw new ConfigurationException(Stage.RESOLUTION, name, "Reference level '" + referenceLevel
                    + "' is not a level of binary variable '" + name + "' " + spec.levels());
        }
        return new VariableSpec(name, VariableKind.BINARY, spec.levels(), referenceLevel);
    }

    /**
     * Create a factor.
     *
     * @param name           Variable name
     * @param levels         Distinct level labels, sorted on creation
     * @param referenceLevel Reference level, or null for the first level in sort order
     * @throws FactorLevelRangeException if the level count is outside 2-20
     * @throws ConfigurationException    if levels repeat or the reference is not a level
     */
    public static VariableSpec factor(String name, List<String> levels, String referenceLevel) {
        int count = levels == null ? 0 : levels.size();
        if (count < MIN_FACTOR_LEVELS || count > MAX_FACTOR_LEVELS) {
            throw new FactorLevelRangeException(name, count, MIN_FACTOR_LEVELS, MAX_FACTOR_LEVELS);
        }
        Set<String> unique = new HashSet<>(levels);
        if (unique.size() != count) {
            throw new ConfigurationException(Stage.RESOLUTION, name,
                    "Factor '" + name + "' has duplicate levels: " + levels);
        }

        List<String> sorted = LevelLabels.sorted(levels);
        String reference = referenceLevel == null ? sorted.get(0) : referenceLevel;
        if (!sorted.contains(reference)) {
            throw new ConfigurationException(Stage.RESOLUTION, name, "Reference level '" + reference
                    + "' is not a level of factor '" + name + "' " + sorted);
        }
        return new VariableSpec(name, VariableKind.FACTOR, sorted, reference);
    }

    /**
     * Create a factor with integer levels 1..n and reference 1.
     */
    public static VariableSpec factor(String name, int levelCount) {
        if (levelCount < MIN_FACTOR_LEVELS || levelCount > MAX_FACTOR_LEVELS) {
            throw new FactorLevelRangeException(name, levelCount, MIN_FACTOR_LEVELS, MAX_FACTOR_LEVELS);
        }
        return factor(name, LevelLabels.numbered(levelCount), null);
    }

    public boolean isFactor() {
        return kind == VariableKind.FACTOR;
    }

    /**
     * Levels that receive a dummy, in level order.
     */
    public List<String> nonReferenceLevels() {
        if (!isFactor()) {
            return List.of();
        }
        return levels.stream()
                .filter(level -> !level.equals(referenceLevel))
                .toList();
    }
}
