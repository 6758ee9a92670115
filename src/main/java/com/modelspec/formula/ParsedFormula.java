package com.modelspec.formula;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Output of the parse stage: dependent variable, raw terms and random-effect clauses.
 * An empty formula ("no formula yet") is represented by {@link #empty()}.
 *
 * @param text          Trimmed input text
 * @param dependent     Dependent variable name (null when empty)
 * @param terms         Raw predictor terms, shorthand already expanded
 * @param randomEffects Random-effect clauses in written order
 */
public record ParsedFormula(
        String text,
        String dependent,
        List<RawTerm> terms,
        List<RawRandomEffect> randomEffects
) {
    private static final ParsedFormula EMPTY = new ParsedFormula("", null, List.of(), List.of());

    public ParsedFormula {
        terms = List.copyOf(terms);
        randomEffects = List.copyOf(randomEffects);
    }

    public static ParsedFormula empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return dependent == null;
    }

    /**
     * Distinct predictor identifiers in first-appearance order.
     */
    public List<String> predictorVariables() {
        Set<String> names = new LinkedHashSet<>();
        for (RawTerm term : terms) {
            names.addAll(term.variables());
        }
        return new ArrayList<>(names);
    }

    /**
     * Random slope identifiers in clause order.
     */
    public List<String> slopeVariables() {
        Set<String> names = new LinkedHashSet<>();
        for (RawRandomEffect effect : randomEffects) {
            if (effect.hasRandomSlope()) {
                names.add(effect.slopeVariable());
            }
        }
        return new ArrayList<>(names);
    }

    /**
     * Every identifier the variable resolver must bind: dependent, predictors, slopes.
     */
    public List<String> referencedVariables() {
        Set<String> names = new LinkedHashSet<>();
        if (dependent != null) {
            names.add(dependent);
        }
        names.addAll(predictorVariables());
        names.addAll(slopeVariables());
        return new ArrayList<>(names);
    }
}
