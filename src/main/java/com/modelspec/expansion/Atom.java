package com.modelspec.expansion;

/**
 * One predictor column: a continuous or binary variable, or one dummy of a factor.
 *
 * @param variable Variable name
 * @param level    Factor level for a dummy, null otherwise
 */
public record Atom(String variable, String level) {

    public static Atom of(String variable) {
        return new Atom(variable, null);
    }

    public static Atom dummy(String variable, String level) {
        return new Atom(variable, level);
    }

    public boolean isDummy() {
        return level != null;
    }

    /**
     * Display label: "x" or "origin[Japan]".
     */
    public String label() {
        return isDummy() ? variable + "[" + level + "]" : variable;
    }

    @Override
    public String toString() {
        return label();
    }
}
