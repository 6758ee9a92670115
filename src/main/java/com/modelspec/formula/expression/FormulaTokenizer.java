package com.modelspec.formula.expression;

import com.modelspec.exception.FormulaParseException;

import java.util.ArrayList;
import java.util.List;

import static com.modelspec.formula.expression.FormulaSyntax.Operators;

/**
 * Tokenizer for model formulas.
 * Converts input string into a sequence of tokens.
 */
public final class FormulaTokenizer {

    private final String input;
    private final FormulaSyntax syntax;
    private final int length;
    private int pos;

    public FormulaTokenizer(String input) {
        this(input, FormulaSyntax.DEFAULT);
    }

    public FormulaTokenizer(String input, FormulaSyntax syntax) {
        this.input = input;
        this.syntax = syntax;
        this.length = input.length();
        this.pos = 0;
    }

    /**
     * Tokenize the input string.
     *
     * @return List of tokens, always terminated by an EOF token
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();

        while (!isAtEnd()) {
            char c = peek();

            if (Character.isWhitespace(c)) {
                advance();
                continue;
            }

            int start = pos;

            if (c == syntax.interactionMarker()) {
                advance();
                tokens.add(new Token(TokenType.INTERACTION, String.valueOf(c), start));
                continue;
            }

            switch (c) {
                case Operators.EQUALS, Operators.TILDE -> {
                    advance();
                    tokens.add(new Token(TokenType.SEPARATOR, String.valueOf(c), start));
                }
                case Operators.PLUS -> {
                    advance();
                    tokens.add(new Token(TokenType.PLUS, "+", start));
                }
                case Operators.STAR -> {
                    advance();
                    tokens.add(new Token(TokenType.STAR, "*", start));
                }
                case Operators.LEFT_PAREN -> {
                    advance();
                    tokens.add(new Token(TokenType.LPAREN, "(", start));
                }
                case Operators.RIGHT_PAREN -> {
                    advance();
                    tokens.add(new Token(TokenType.RPAREN, ")", start));
                }
                case Operators.BAR -> {
                    advance();
                    tokens.add(new Token(TokenType.BAR, "|", start));
                }
                case Operators.SLASH -> {
                    advance();
                    tokens.add(new Token(TokenType.SLASH, "/", start));
                }
                default -> {
                    if (FormulaSyntax.isIdentifierStart(c)) {
                        tokens.add(readIdentifier());
                    } else if (Character.isDigit(c)) {
                        tokens.add(readNumber());
                    } else {
                        throw error("Unexpected character '" + c + "'", String.valueOf(c), start);
                    }
                }
            }
        }

        tokens.add(new Token(TokenType.EOF, "", pos));
        return tokens;
    }

    private Token readIdentifier() {
        int start = pos;
        while (!isAtEnd() && FormulaSyntax.isIdentifierPart(peek())) {
            advance();
        }
        return new Token(TokenType.IDENT, input.substring(start, pos), start);
    }

    private Token readNumber() {
        int start = pos;
        while (!isAtEnd() && Character.isDigit(peek())) {
            advance();
        }
        // "2x" is neither a number nor an identifier
        if (!isAtEnd() && FormulaSyntax.isIdentifierStart(peek())) {
            while (!isAtEnd() && FormulaSyntax.isIdentifierPart(peek())) {
                advance();
            }
            String text = input.substring(start, pos);
            throw error("Identifier '" + text + "' must not start with a digit", text, start);
        }
        return new Token(TokenType.NUMBER, input.substring(start, pos), start);
    }

    private char advance() {
        return input.charAt(pos++);
    }

    private char peek() {
        return input.charAt(pos);
    }

    private boolean isAtEnd() {
        return pos >= length;
    }

    private FormulaParseException error(String message, String subject, int position) {
        return new FormulaParseException("Invalid formula at position "
                + position + ": " + message + " in '" + input + "'", subject, position);
    }
}
