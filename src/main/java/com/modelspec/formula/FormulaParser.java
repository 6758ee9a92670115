package com.modelspec.formula;

import com.modelspec.formula.expression.FormulaGrammarParser;
import com.modelspec.formula.expression.FormulaSyntax;
import com.modelspec.formula.expression.FormulaTokenizer;
import com.modelspec.formula.expression.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Facade for parsing R-style model formulas.
 * <p>
 * Supports:
 * <ul>
 *   <li>Separators: {@code =} or {@code ~} (exactly one)</li>
 *   <li>Main effects joined by {@code +}</li>
 *   <li>Explicit interactions: {@code a:b:c}</li>
 *   <li>Shorthand: {@code a*b} for {@code a + b + a:b}</li>
 *   <li>Random effects: {@code (1|g)}, {@code (1 + x|g)}, {@code (1|g/s)}</li>
 * </ul>
 * Blank input is the "no formula yet" state, not an error.
 */
public final class FormulaParser {

    private static final Logger log = LoggerFactory.getLogger(FormulaParser.class);

    private FormulaParser() {
    }

    /**
     * Parse a formula with the default syntax.
     *
     * @param formula Formula text
     * @return Parsed formula, or {@link ParsedFormula#empty()} for blank input
     */
    public static ParsedFormula parse(String formula) {
        return parse(formula, FormulaSyntax.DEFAULT);
    }

    /**
     * Parse a formula with a custom interaction marker.
     *
     * @param formula Formula text
     * @param syntax  Formula syntax
     * @return Parsed formula, or {@link ParsedFormula#empty()} for blank input
     */
    public static ParsedFormula parse(String formula, FormulaSyntax syntax) {
        if (formula == null || formula.isBlank()) {
            return ParsedFormula.empty();
        }

        // Tokenize
        FormulaTokenizer tokenizer = new FormulaTokenizer(formula, syntax);
        List<Token> tokens = tokenizer.tokenize();
        log.debug("Tokenized formula '{}' into {} tokens", formula, tokens.size());

        // Parse
        FormulaGrammarParser parser = new FormulaGrammarParser(formula, tokens);
        return parser.parse();
    }
}
