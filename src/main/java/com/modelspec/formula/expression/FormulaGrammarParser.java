package com.modelspec.formula.expression;

import com.modelspec.exception.FormulaParseException;
import com.modelspec.formula.ParsedFormula;
import com.modelspec.formula.RawRandomEffect;
import com.modelspec.formula.RawTerm;

import java.util.ArrayList;
import java.util.List;

/**
 * Parser for model formulas.
 * Converts tokens into a {@link ParsedFormula} using recursive descent parsing.
 * <p>
 * Grammar:
 * <pre>
 * formula     := IDENT sep terms
 * sep         := '=' | '~'
 * terms       := term ('+' term)*
 * term        := random | IDENT ((':' IDENT)+ | ('*' IDENT)+)?
 * random      := '(' '1' ('+' IDENT)? '|' IDENT ('/' IDENT)? ')'
 * </pre>
 * The {@code *} shorthand is expanded here into every main effect and every
 * interaction of its participants, so it never leaves the parse stage.
 */
public final class FormulaGrammarParser {

    private final String input;
    private final List<Token> tokens;
    private int index;

    public FormulaGrammarParser(String input, List<Token> tokens) {
        this.input = input;
        this.tokens = tokens;
        this.index = 0;
    }

    /**
     * Parse the token stream into a formula.
     *
     * @return Parsed formula with shorthand terms expanded
     */
    public ParsedFormula parse() {
        String dependent = parseDependent();

        if (check(TokenType.EOF)) {
            throw error("Empty right-hand side", previous());
        }

        List<RawTerm> terms = new ArrayList<>();
        List<RawRandomEffect> randomEffects = new ArrayList<>();
        parseTerm(terms, randomEffects);

        while (match(TokenType.PLUS)) {
            if (check(TokenType.EOF)) {
                throw error("Dangling '+' operator", previous());
            }
            parseTerm(terms, randomEffects);
        }

        if (!check(TokenType.EOF)) {
            if (check(TokenType.RPAREN)) {
                throw error("Unbalanced random-effect parentheses", peek());
            }
            throw error("Expected '+' before '" + peek().text() + "'", peek());
        }

        return new ParsedFormula(input.trim(), dependent, terms, randomEffects);
    }

    /**
     * Expand {@code a*b*c} into every non-empty combination of its participants,
     * smaller combinations first: a, b, c, a:b, a:c, b:c, a:b:c.
     */
    public static List<RawTerm> expandShorthand(List<String> variables) {
        List<RawTerm> result = new ArrayList<>();
        for (int size = 1; size <= variables.size(); size++) {
            collectCombinations(variables, size, 0, new ArrayList<>(), result);
        }
        return result;
    }

    private static void collectCombinations(List<String> variables, int size, int start,
                                            List<String> current, List<RawTerm> out) {
        if (current.size() == size) {
            out.add(new RawTerm(current));
            return;
        }
        for (int i = start; i < variables.size(); i++) {
            current.add(variables.get(i));
            collectCombinations(variables, size, i + 1, current, out);
            current.remove(current.size() - 1);
        }
    }

    private String parseDependent() {
        List<Token> separators = tokens.stream()
                .filter(t -> t.type() == TokenType.SEPARATOR)
                .toList();

        if (separators.isEmpty()) {
            throw new FormulaParseException("Invalid formula at position 0: "
                    + "Missing '=' or '~' between dependent variable and predictors in '"
                    + input + "'", input.trim(), 0);
        }
        if (separators.size() > 1) {
            Token second = separators.get(1);
            throw error("Duplicate dependent variable separator '" + second.text() + "'", second);
        }

        Token first = peek();
        if (first.type() == TokenType.SEPARATOR) {
            throw error("Missing dependent variable", first);
        }
        Token dependent = consume(TokenType.IDENT, "Dependent variable must be a variable name");

        if (!check(TokenType.SEPARATOR)) {
            Token separator = separators.get(0);
            String lhs = input.substring(first.position(), separator.position()).trim();
            throw new FormulaParseException("Invalid formula at position " + first.position()
                    + ": Left-hand side must be a single dependent variable, found '" + lhs
                    + "' in '" + input + "'", lhs, first.position());
        }
        advance();
        return dependent.text();
    }

    private void parseTerm(List<RawTerm> terms, List<RawRandomEffect> randomEffects) {
        if (check(TokenType.LPAREN)) {
            randomEffects.add(parseRandomEffect());
            return;
        }
        if (check(TokenType.RPAREN)) {
            throw error("Unbalanced random-effect parentheses", peek());
        }

        Token first = consume(TokenType.IDENT, "Expected variable name");
        List<String> variables = new ArrayList<>();
        variables.add(first.text());

        TokenType operator = null;
        while (check(TokenType.INTERACTION) || check(TokenType.STAR)) {
            Token operatorToken = advance();
            if (operator != null && operator != operatorToken.type()) {
                throw error("Cannot mix interaction and '*' shorthand in one term", operatorToken);
            }
            operator = operatorToken.type();

            if (!check(TokenType.IDENT)) {
                throw error("Dangling '" + operatorToken.text() + "' operator", operatorToken);
            }
            Token next = advance();
            if (variables.contains(next.text())) {
                throw error("Variable '" + next.text() + "' repeated in interaction", next);
            }
            variables.add(next.text());
        }

        if (operator == TokenType.STAR) {
            terms.addAll(expandShorthand(variables));
        } else {
            terms.add(new RawTerm(variables));
        }
    }

    private RawRandomEffect parseRandomEffect() {
        Token open = advance();

        Token intercept = peek();
        if (intercept.type() != TokenType.NUMBER || !intercept.text().equals("1")) {
            throw clauseError("Random-effect clause must start with '1'", open);
        }
        advance();

        String slope = null;
        if (match(TokenType.PLUS)) {
            if (!check(TokenType.IDENT)) {
                throw clauseError("Expected random slope variable after '+'", open);
            }
            slope = advance().text();
        }

        if (!match(TokenType.BAR)) {
            if (check(TokenType.EOF)) {
                throw clauseError("Unbalanced random-effect parentheses", open);
            }
            throw clauseError("Expected '|' in random-effect clause", open);
        }
        if (!check(TokenType.IDENT)) {
            throw clauseError("Expected grouping variable after '|'", open);
        }
        String group = advance().text();

        String subgroup = null;
        if (match(TokenType.SLASH)) {
            if (!check(TokenType.IDENT)) {
                throw clauseError("Expected subgroup after '/'", open);
            }
            subgroup = advance().text();
            if (subgroup.equals(group)) {
                throw clauseError("Group '" + group + "' cannot be nested in itself", open);
            }
        }

        if (!check(TokenType.RPAREN)) {
            if (check(TokenType.EOF)) {
                throw clauseError("Unbalanced random-effect parentheses", open);
            }
            throw clauseError("Expected ')' to close random-effect clause", open);
        }
        Token close = advance();

        String text = input.substring(open.position(), close.end());
        return new RawRandomEffect(group, subgroup, slope, text, open.position());
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw error(message, peek());
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) {
            index++;
        }
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token previous() {
        return tokens.get(index - 1);
    }

    private FormulaParseException error(String message, Token token) {
        int position = token.position();
        String subject = token.type() == TokenType.EOF ? "" : token.text();
        return new FormulaParseException("Invalid formula at position "
                + position + ": " + message + " in '" + input + "'", subject, position);
    }

    private FormulaParseException clauseError(String message, Token open) {
        int end = Math.min(peek().end(), input.length());
        String clause = input.substring(open.position(), end);
        return new FormulaParseException("Invalid formula at position "
                + open.position() + ": " + message + " in '" + clause + "'", clause, open.position());
    }
}
