package com.modelspec.formula.expression;

/**
 * Token types for formula parsing.
 */
public enum TokenType {
    // Identifiers and literals
    IDENT,
    NUMBER,

    // Dependent / predictor separator ('=' or '~')
    SEPARATOR,

    // Term operators
    PLUS,
    INTERACTION,
    STAR,

    // Random-effect clause delimiters
    LPAREN,
    RPAREN,
    BAR,
    SLASH,

    // Special
    EOF
}
