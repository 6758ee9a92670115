package com.modelspec.formula;

import java.util.List;

/**
 * Unresolved predictor reference produced by the parser.
 * One variable is a main effect; two or more form an explicit interaction.
 *
 * @param variables Participating identifiers in their written order
 */
public record RawTerm(List<String> variables) {

    public RawTerm {
        if (variables == null || variables.isEmpty()) {
            throw new IllegalArgumentException("Raw term needs at least one variable");
        }
        variables = List.copyOf(variables);
    }

    public static RawTerm of(String... variables) {
        return new RawTerm(List.of(variables));
    }

    public boolean isInteraction() {
        return variables.size() > 1;
    }

    /**
     * Term text using ':' as the interaction marker, e.g. "a:b".
     */
    public String label() {
        return String.join(":", variables);
    }

    @Override
    public String toString() {
        return label();
    }
}
