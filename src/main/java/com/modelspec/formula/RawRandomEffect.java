package com.modelspec.formula;

/**
 * Random-effect clause as written in the formula, e.g. {@code (1 + x|school/class)}.
 *
 * @param group         Grouping variable (outer group when nested)
 * @param subgroup      Nested subgroup, or null
 * @param slopeVariable Random slope variable, or null for intercept only
 * @param text          Clause text as it appears in the input
 * @param position      Position of the opening parenthesis
 */
public record RawRandomEffect(
        String group,
        String subgroup,
        String slopeVariable,
        String text,
        int position
) {
    public boolean isNested() {
        return subgroup != null;
    }

    public boolean hasRandomSlope() {
        return slopeVariable != null;
    }

    /**
     * Grouping level this clause declares: the subgroup when nested, otherwise the group.
     */
    public String declaredGroup() {
        return isNested() ? subgroup : group;
    }
}
