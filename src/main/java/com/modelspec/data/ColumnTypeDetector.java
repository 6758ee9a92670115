package com.modelspec.data;

import com.modelspec.variable.LevelLabels;
import com.modelspec.variable.VariableKind;
import com.modelspec.variable.VariableSpec;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Detects a column's variable kind from its observed values.
 * <ul>
 *   <li>2 unique values: binary</li>
 *   <li>non-numeric, or 3-20 unique values: factor with sorted unique levels</li>
 *   <li>otherwise: continuous</li>
 * </ul>
 * Null values are ignored. A non-numeric column with more than 20 values is still
 * reported as a factor so that resolution fails with a level-range error.
 */
public final class ColumnTypeDetector {

    private ColumnTypeDetector() {
    }

    public static DataColumn detect(String name, Collection<?> values) {
        Set<String> unique = new LinkedHashSet<>();
        for (Object value : values) {
            if (value != null) {
                unique.add(LevelLabels.label(value));
            }
        }

        int count = unique.size();
        boolean numeric = unique.isEmpty() || LevelLabels.allNumeric(unique);

        if (count == 2) {
            List<String> levels = LevelLabels.sorted(unique);
            return new DataColumn(name, VariableKind.BINARY, levels, levels.get(0));
        }
        if (!numeric || (count > VariableSpec.MIN_FACTOR_LEVELS && count <= VariableSpec.MAX_FACTOR_LEVELS)) {
            List<String> levels = LevelLabels.sorted(unique);
            String reference = levels.isEmpty() ? null : levels.get(0);
            return new DataColumn(name, VariableKind.FACTOR, levels, reference);
        }
        return new DataColumn(name, VariableKind.CONTINUOUS, List.of(), null);
    }

    /**
     * Whether a column should be skipped: blank names and index columns such as "Unnamed: 0".
     */
    public static boolean isIgnoredColumn(String name) {
        return name == null || name.isBlank() || name.trim().startsWith("Unnamed:");
    }
}
