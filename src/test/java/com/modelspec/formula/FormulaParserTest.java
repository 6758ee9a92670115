package com.modelspec.formula;

import com.modelspec.exception.FormulaParseException;
import com.modelspec.formula.expression.FormulaSyntax;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FormulaParser.
 */
class FormulaParserTest {

    // =====================================================================
    // Fixed effects
    // =====================================================================

    @Test
    @DisplayName("Should parse main effects with either separator")
    void shouldParseMainEffects() {
        ParsedFormula equals = FormulaParser.parse("y = x1 + x2");
        ParsedFormula tilde = FormulaParser.parse("y ~ x1 + x2");

        assertEquals("y", equals.dependent());
        assertEquals(List.of(RawTerm.of("x1"), RawTerm.of("x2")), equals.terms());
        assertEquals(equals.terms(), tilde.terms());
        assertTrue(equals.randomEffects().isEmpty());
    }

    @Test
    @DisplayName("Should keep an explicit interaction as one term")
    void shouldParseExplicitInteraction() {
        ParsedFormula parsed = FormulaParser.parse("y ~ a:b:c");

        assertEquals(List.of(RawTerm.of("a", "b", "c")), parsed.terms());
        assertTrue(parsed.terms().get(0).isInteraction());
    }

    @Test
    @DisplayName("Should expand star shorthand into all combinations")
    void shouldExpandStarShorthand() {
        ParsedFormula parsed = FormulaParser.parse("y ~ a*b*c");

        List<String> labels = parsed.terms().stream().map(RawTerm::label).toList();
        assertEquals(List.of("a", "b", "c", "a:b", "a:c", "b:c", "a:b:c"), labels);
    }

    @Test
    @DisplayName("a*b is equivalent to a + b + a:b")
    void shorthandEquivalence() {
        assertEquals(FormulaParser.parse("y ~ a + b + a:b").terms(), FormulaParser.parse("y ~ a*b").terms());
    }

    @Test
    @DisplayName("Should parse random-effect clauses")
    void shouldParseRandomEffects() {
        ParsedFormula parsed = FormulaParser.parse("y ~ x + (1 + x|school/class) + (1|district)");

        assertEquals(List.of(RawTerm.of("x")), parsed.terms());
        assertEquals(2, parsed.randomEffects().size());

        RawRandomEffect nested = parsed.randomEffects().get(0);
        assertEquals("school", nested.group());
        assertEquals("class", nested.subgroup());
        assertEquals("x", nested.slopeVariable());
        assertEquals("(1 + x|school/class)", nested.text());
        assertEquals(8, nested.position());
        assertEquals("class", nested.declaredGroup());

        RawRandomEffect intercept = parsed.randomEffects().get(1);
        assertFalse(intercept.isNested());
        assertFalse(intercept.hasRandomSlope());
        assertEquals("district", intercept.declaredGroup());
    }

    @Test
    @DisplayName("Should list referenced variables in first-appearance order")
    void shouldListReferencedVariables() {
        ParsedFormula parsed = FormulaParser.parse("y ~ b + a:b + (1 + z|g)");

        assertEquals(List.of("b", "a"), parsed.predictorVariables());
        assertEquals(List.of("z"), parsed.slopeVariables());
        assertEquals(List.of("y", "b", "a", "z"), parsed.referencedVariables());
    }

    @ParameterizedTest
    @DisplayName("Blank input is the empty state, not an error")
    @ValueSource(strings = {"", "   ", "\t"})
    void blankInputIsEmpty(String formula) {
        assertTrue(FormulaParser.parse(formula).isEmpty());
        assertTrue(FormulaParser.parse(null).isEmpty());
    }

    @Test
    @DisplayName("Should parse with a custom interaction marker")
    void shouldParseCustomMarker() {
        ParsedFormula parsed = FormulaParser.parse("y ~ a&b", new FormulaSyntax('&'));

        assertEquals(List.of(RawTerm.of("a", "b")), parsed.terms());
    }

    // =====================================================================
    // Errors
    // =====================================================================

    @ParameterizedTest
    @DisplayName("Should reject malformed formulas")
    @ValueSource(strings = {
            "y x1 + x2",
            "y ~",
            "y ~ x +",
            "y ~ x + + z",
            "y ~ a:",
            "y ~ a*",
            "y ~ a*b:c",
            "y ~ a:a",
            "y ~ (1|g",
            "y ~ x)",
            "y ~ (2|g)",
            "y ~ (1 + |g)",
            "y ~ (1 x|g)",
            "y ~ (1|)",
            "y ~ (1|g/)",
            "y ~ (1|g/g)",
            "y = x ~ z",
            "a b ~ x",
            "~ x",
            "y ~ x z"
    })
    void shouldRejectMalformedFormulas(String formula) {
        FormulaParseException e = assertThrows(FormulaParseException.class, () -> FormulaParser.parse(formula));

        assertTrue(e.getMessage().startsWith("Invalid formula at position "), e.getMessage());
    }

    @Test
    @DisplayName("Missing separator is reported at position 0")
    void missingSeparatorPosition() {
        FormulaParseException e = assertThrows(FormulaParseException.class,
                () -> FormulaParser.parse("y x1 + x2"));

        assertEquals(0, e.getPosition());
        assertEquals("y x1 + x2", e.getSubject());
    }

    @Test
    @DisplayName("Dangling operator is reported at its position")
    void danglingOperatorPosition() {
        FormulaParseException e = assertThrows(FormulaParseException.class,
                () -> FormulaParser.parse("y ~ x +"));

        assertEquals(6, e.getPosition());
        assertTrue(e.getMessage().contains("Dangling '+'"));
    }

    @Test
    @DisplayName("Malformed clause reports the clause text")
    void malformedClauseSubject() {
        FormulaParseException e = assertThrows(FormulaParseException.class,
                () -> FormulaParser.parse("y ~ x + (1|g"));

        assertEquals(8, e.getPosition());
        assertEquals("(1|g", e.getSubject());
    }

    @Test
    @DisplayName("Multi-identifier left-hand side is rejected")
    void multiIdentifierLeftHandSide() {
        FormulaParseException e = assertThrows(FormulaParseException.class,
                () -> FormulaParser.parse("a + b ~ x"));

        assertEquals("a + b", e.getSubject());
    }
}
