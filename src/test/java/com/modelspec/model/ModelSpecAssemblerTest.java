package com.modelspec.model;

import com.modelspec.cluster.ClusterSpec;
import com.modelspec.data.InMemoryDataProvider;
import com.modelspec.exception.FactorLevelRangeException;
import com.modelspec.exception.FormulaParseException;
import com.modelspec.exception.ModelValidationException;
import com.modelspec.exception.Stage;
import com.modelspec.exception.UnresolvedVariableException;
import com.modelspec.exception.UnsupportedRandomSlopeException;
import com.modelspec.variable.DefaultVariableResolver;
import com.modelspec.variable.ManualVariableConfig;
import com.modelspec.variable.VariableKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ModelSpecAssembler covering the full resolution pipeline.
 */
class ModelSpecAssemblerTest {

    private Map<String, ManualVariableConfig> manual;
    private ModelSpecAssembler assembler;

    @BeforeEach
    void setUp() {
        manual = new LinkedHashMap<>();
        manual.put("y", ManualVariableConfig.continuous());
        manual.put("x", ManualVariableConfig.continuous());
        manual.put("x1", ManualVariableConfig.continuous());
        manual.put("x2", ManualVariableConfig.continuous());
        manual.put("a", ManualVariableConfig.factor(3));
        manual.put("b", ManualVariableConfig.binary());
        assembler = new ModelSpecAssembler(new DefaultVariableResolver(manual));
    }

    // =====================================================================
    // Scenarios
    // =====================================================================

    @Test
    @DisplayName("y = x1 + x2 with continuous predictors")
    void continuousMainEffects() {
        ModelSpec spec = assembler.resolve("y = x1 + x2");

        assertEquals("y", spec.dependentVariable());
        assertEquals(List.of("x1", "x2"), spec.termLabels());
        assertFalse(spec.isMixedModel());
    }

    @Test
    @DisplayName("y = a*b with a 3-level factor and a binary variable")
    void factorByBinaryShorthand() {
        ModelSpec spec = assembler.resolve("y = a*b");

        assertEquals(List.of("a[2]", "a[3]", "b", "a[2]:b", "a[3]:b"), spec.termLabels());
        assertEquals(VariableKind.FACTOR, spec.variable("a").kind());
        assertEquals("1", spec.variable("a").referenceLevel());
    }

    @Test
    @DisplayName("y ~ x + (1|school) gives one top-level cluster")
    void randomIntercept() {
        ModelSpec spec = assembler.resolve("y ~ x + (1|school)");

        assertEquals(List.of("x"), spec.termLabels());
        assertEquals(List.of(new ClusterSpec("school", null, false, null)), spec.clusters());
        assertTrue(spec.isMixedModel());
    }

    @Test
    @DisplayName("y ~ x + (1 + x|school/class) gives nested clusters with the slope on class")
    void nestedRandomSlope() {
        ModelSpec spec = assembler.resolve("y ~ x + (1 + x|school/class)");

        assertEquals(List.of("x"), spec.termLabels());
        assertEquals(2, spec.clusters().size());

        ClusterSpec school = spec.clusters().get(0);
        assertEquals("school", school.groupName());
        assertTrue(school.isRoot());
        assertFalse(school.hasRandomSlope());

        ClusterSpec clazz = spec.clusters().get(1);
        assertEquals("class", clazz.groupName());
        assertEquals("school", clazz.parentGroup());
        assertTrue(clazz.hasRandomSlope());
        assertEquals("x", clazz.slopeVariable());
    }

    @Test
    @DisplayName("Named data levels appear in term labels")
    void namedDataLevels() {
        InMemoryDataProvider data = InMemoryDataProvider.fromValues(
                Map.of("origin", List.of("USA", "Japan", "Europe", "Japan")));
        ModelSpecAssembler withData = new ModelSpecAssembler(new DefaultVariableResolver(data, manual));

        ModelSpec spec = withData.resolve("y ~ x + origin");

        assertEquals(List.of("x", "origin[Japan]", "origin[USA]"), spec.termLabels());
    }

    // =====================================================================
    // Properties
    // =====================================================================

    @Test
    @DisplayName("Shorthand and explicit interactions give equal specifications")
    void shorthandEquivalence() {
        assertEquals(assembler.resolve("y ~ a + b + a:b"), assembler.resolve("y ~ a*b"));
    }

    @Test
    @DisplayName("Resolution is deterministic")
    void deterministic() {
        String formula = "y ~ a*b*x + (1 + x|school/class)";

        ModelSpec first = assembler.resolve(formula);
        ModelSpec second = assembler.resolve(formula);

        assertEquals(first, second);
        assertEquals(first.termLabels(), second.termLabels());
    }

    @Test
    @DisplayName("Cartesian law: interaction term count is the product of per-variable choices")
    void cartesianLaw() {
        manual.put("c", ManualVariableConfig.factor(4));

        ModelSpec spec = new ModelSpecAssembler(new DefaultVariableResolver(manual)).resolve("y ~ a:c:b:x");

        assertEquals(2 * 3 * 1 * 1, spec.terms().size());
    }

    @Test
    @DisplayName("Reference levels never appear in any term")
    void referenceExclusion() {
        manual.put("tutor", ManualVariableConfig.factor(List.of("none", "peer", "teacher"), "peer"));

        ModelSpec spec = new ModelSpecAssembler(new DefaultVariableResolver(manual)).resolve("y ~ tutor*a");

        List<String> labels = spec.termLabels();
        assertTrue(labels.stream().noneMatch(label -> label.contains("tutor[peer]")));
        assertTrue(labels.stream().noneMatch(label -> label.contains("a[1]")));
        assertTrue(labels.contains("tutor[none]:a[3]"));
    }

    @ParameterizedTest
    @DisplayName("Rendering and resolving again gives an equal specification")
    @ValueSource(strings = {
            "y = x1 + x2",
            "y ~ a*b",
            "y ~ b:a + a",
            "y ~ x + a:b + (1 + x|school/class)",
            "y ~ a*b*x + (1|school) + (1|school/class)",
            "y ~ x + (1|school/class) + (1 + x|school) + (1 + b|district)"
    })
    void roundTrip(String formula) {
        ModelSpec spec = assembler.resolve(formula);

        String rendered = FormulaRenderer.render(spec);

        assertEquals(spec, assembler.resolve(rendered), rendered);
    }

    // =====================================================================
    // Results and errors
    // =====================================================================

    @Test
    @DisplayName("Successful assembly keeps the parsed formula")
    void successResult() {
        AssemblyResult result = assembler.assemble("y ~ x");

        assertEquals(AssemblyStatus.SUCCESS, result.getStatus());
        assertTrue(result.isSuccess());
        assertTrue(result.getModelSpec().isPresent());
        assertTrue(result.isPreviewAvailable());
        assertNull(result.getStage());
    }

    @ParameterizedTest
    @DisplayName("Blank formula is the empty state")
    @ValueSource(strings = {"", "   "})
    void emptyFormula(String formula) {
        AssemblyResult result = assembler.assemble(formula);

        assertEquals(AssemblyStatus.EMPTY, result.getStatus());
        assertTrue(result.getError().isEmpty());
        assertFalse(result.isPreviewAvailable());
        assertThrows(FormulaParseException.class, () -> assembler.resolve(formula));
    }

    @Test
    @DisplayName("Missing separator fails the parse stage without a preview")
    void parseError() {
        AssemblyResult result = assembler.assemble("y x1 + x2");

        assertEquals(AssemblyStatus.FAILED, result.getStatus());
        assertEquals(Stage.PARSE, result.getStage());
        assertInstanceOf(FormulaParseException.class, result.getError().orElseThrow());
        assertTrue(result.getModelSpec().isEmpty());
        assertFalse(result.isPreviewAvailable());
    }

    @Test
    @DisplayName("Unresolved variable fails resolution but keeps the preview")
    void unresolvedVariable() {
        AssemblyResult result = assembler.assemble("y ~ x + q + r");

        assertEquals(Stage.RESOLUTION, result.getStage());
        UnresolvedVariableException error = assertInstanceOf(UnresolvedVariableException.class,
                result.getError().orElseThrow());
        assertEquals("q", error.getSubject());
        assertTrue(result.isPreviewAvailable());
        assertEquals(List.of("x", "q", "r"), result.getParsedFormula().orElseThrow().predictorVariables());
        assertTrue(result.getModelSpec().isEmpty());
    }

    @Test
    @DisplayName("Unconfigured dependent variable is unresolved")
    void unresolvedDependent() {
        UnresolvedVariableException e = assertThrows(UnresolvedVariableException.class,
                () -> assembler.resolve("outcome ~ x"));

        assertEquals("outcome", e.getSubject());
    }

    @Test
    @DisplayName("Factor with 25 distinct levels fails resolution")
    void factorLevelRange() {
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < 25; i++) {
            ids.add("s" + i);
        }
        InMemoryDataProvider data = InMemoryDataProvider.fromValues(Map.of("subject", ids));
        ModelSpecAssembler withData = new ModelSpecAssembler(new DefaultVariableResolver(data, manual));

        AssemblyResult result = withData.assemble("y ~ x + subject");

        assertEquals(Stage.RESOLUTION, result.getStage());
        FactorLevelRangeException error = assertInstanceOf(FactorLevelRangeException.class,
                result.getError().orElseThrow());
        assertEquals(25, error.getLevelCount());
    }

    @Test
    @DisplayName("Factor random slope fails the random-effects stage")
    void factorRandomSlope() {
        AssemblyResult result = assembler.assemble("y ~ x + (1 + a|school)");

        assertEquals(Stage.RANDOM_EFFECTS, result.getStage());
        assertInstanceOf(UnsupportedRandomSlopeException.class, result.getError().orElseThrow());
    }

    @Test
    @DisplayName("Slope variable need not be a fixed effect but must be configured")
    void slopeOnlyVariable() {
        ModelSpec spec = assembler.resolve("y ~ x + (1 + x2|school)");
        assertEquals(VariableKind.CONTINUOUS, spec.variable("x2").kind());

        AssemblyResult result = assembler.assemble("y ~ x + (1 + z|school)");
        assertEquals(Stage.RANDOM_EFFECTS, result.getStage());
        assertInstanceOf(UnresolvedVariableException.class, result.getError().orElseThrow());
    }

    @ParameterizedTest
    @DisplayName("Global invariants are validated last")
    @ValueSource(strings = {
            "y ~ x + y",
            "y ~ (1|school)",
            "y ~ x + (1|x)",
            "y ~ x + b + (1|b/school)"
    })
    void validationErrors(String formula) {
        AssemblyResult result = assembler.assemble(formula);

        assertEquals(Stage.VALIDATION, result.getStage());
        assertInstanceOf(ModelValidationException.class, result.getError().orElseThrow());
    }

    @Test
    @DisplayName("Superseded token cancels the request before any work")
    void cancelledToken() {
        ResolutionToken token = new ResolutionToken(1);
        token.invalidate();

        AssemblyResult result = assembler.assemble("y ~ x", token);

        assertEquals(AssemblyStatus.CANCELLED, result.getStatus());
        assertTrue(result.getModelSpec().isEmpty());
    }

    // =====================================================================
    // Model helpers
    // =====================================================================

    @Test
    @DisplayName("Model helpers expose correlable variables and factor levels")
    void modelHelpers() {
        ModelSpec spec = assembler.resolve("y ~ x + b + a + a:x + x1:x2 + (1|school)");

        assertEquals(List.of("x", "b"), spec.correlableVariables());
        assertEquals(Map.of("a", 3), spec.factorLevels());
        assertEquals(List.of("x", "b", "a", "x1", "x2"), spec.predictorVariables());
        assertTrue(spec.termLabels().contains("a[2]:x"));
    }

    @Test
    @DisplayName("Specification is immutable")
    void immutable() {
        ModelSpec spec = assembler.resolve("y ~ x");

        assertThrows(UnsupportedOperationException.class, () -> spec.terms().clear());
        assertThrows(UnsupportedOperationException.class, () -> spec.variables().remove("x"));
    }
}
