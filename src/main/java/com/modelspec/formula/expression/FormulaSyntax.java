package com.modelspec.formula.expression;

import com.modelspec.exception.ConfigurationException;

import java.util.Set;

/**
 * Operator characters of the formula language.
 * The interaction marker is configurable; every other operator is fixed.
 *
 * @param interactionMarker Character joining identifiers into an explicit interaction
 */
public record FormulaSyntax(char interactionMarker) {

    // Declared before DEFAULT, which is validated against it
    private static final Set<Character> RESERVED = Set.of(
            Operators.EQUALS, Operators.TILDE, Operators.PLUS, Operators.STAR,
            Operators.LEFT_PAREN, Operators.RIGHT_PAREN, Operators.BAR, Operators.SLASH,
            Operators.UNDERSCORE
    );

    /**
     * R-style syntax with ':' as the interaction marker.
     */
    public static final FormulaSyntax DEFAULT = new FormulaSyntax(Operators.COLON);

    /**
     * Operator symbols.
     */
    public static final class Operators {
        public static final char EQUALS = '=';
        public static final char TILDE = '~';
        public static final char PLUS = '+';
        public static final char COLON = ':';
        public static final char STAR = '*';
        public static final char LEFT_PAREN = '(';
        public static final char RIGHT_PAREN = ')';
        public static final char BAR = '|';
        public static final char SLASH = '/';
        public static final char UNDERSCORE = '_';

        private Operators() {
        }
    }

    public FormulaSyntax {
        if (RESERVED.contains(interactionMarker)
                || Character.isLetterOrDigit(interactionMarker)
                || Character.isWhitespace(interactionMarker)) {
            throw new ConfigurationException(String.valueOf(interactionMarker),
                    "Interaction marker '" + interactionMarker + "' clashes with formula syntax");
        }
    }

    /**
     * Parse a marker from configuration text (must be a single character).
     */
    public static FormulaSyntax withMarker(String marker) {
        if (marker == null || marker.isEmpty()) {
            return DEFAULT;
        }
        if (marker.length() != 1) {
            throw new ConfigurationException(marker, "Interaction marker must be a single character");
        }
        return new FormulaSyntax(marker.charAt(0));
    }

    /**
     * Identifier start character: {@code [A-Za-z_]}.
     */
    public static boolean isIdentifierStart(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == Operators.UNDERSCORE;
    }

    /**
     * Identifier part character: {@code [A-Za-z0-9_]}.
     */
    public static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || (c >= '0' && c <= '9');
    }
}
