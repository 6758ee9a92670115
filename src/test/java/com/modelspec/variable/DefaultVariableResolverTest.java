package com.modelspec.variable;

import com.modelspec.data.InMemoryDataProvider;
import com.modelspec.exception.ConfigurationException;
import com.modelspec.exception.FactorLevelRangeException;
import com.modelspec.exception.Stage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DefaultVariableResolver.
 */
class DefaultVariableResolverTest {

    private Map<String, ManualVariableConfig> manual;

    @BeforeEach
    void setUp() {
        manual = new LinkedHashMap<>();
        manual.put("y", ManualVariableConfig.continuous());
        manual.put("x", ManualVariableConfig.continuous());
        manual.put("treated", ManualVariableConfig.binary());
        manual.put("a", ManualVariableConfig.factor(3));
        manual.put("origin", ManualVariableConfig.continuous());
    }

    @Test
    @DisplayName("Should resolve manually configured variables")
    void shouldResolveManualVariables() {
        VariableResolver resolver = new DefaultVariableResolver(manual);

        VariableResolution resolution = resolver.resolve(List.of("y", "x", "treated", "a"));

        assertTrue(resolution.isComplete());
        assertEquals(List.of("y", "x", "treated", "a"), List.copyOf(resolution.getVariables().keySet()));
        assertEquals(VariableKind.BINARY, resolution.getVariables().get("treated").kind());
        assertEquals(List.of("1", "2", "3"), resolution.getVariables().get("a").levels());
        assertEquals(VariableSource.MANUAL, resolution.getSource("a").orElseThrow());
    }

    @Test
    @DisplayName("Data columns take precedence over manual configuration")
    void dataTakesPrecedence() {
        InMemoryDataProvider data = InMemoryDataProvider.fromValues(
                Map.of("origin", List.of("USA", "Japan", "Europe", "USA")));
        VariableResolver resolver = new DefaultVariableResolver(data, manual);

        VariableResolution resolution = resolver.resolve(List.of("origin"));

        VariableSpec origin = resolution.getVariables().get("origin");
        assertEquals(VariableKind.FACTOR, origin.kind());
        assertEquals(List.of("Europe", "Japan", "USA"), origin.levels());
        assertEquals(VariableSource.DATA, resolution.getSource("origin").orElseThrow());
    }

    @Test
    @DisplayName("Should collect every unresolved identifier")
    void shouldCollectUnresolved() {
        VariableResolver resolver = new DefaultVariableResolver(manual);

        VariableResolution resolution = resolver.resolve(List.of("x", "q", "r", "q"));

        assertFalse(resolution.isComplete());
        assertEquals(2, resolution.getUnresolved().size());
        assertEquals("q", resolution.getUnresolved().get(0).getSubject());
        assertEquals(Stage.RESOLUTION, resolution.getUnresolved().get(0).getStage());
        assertEquals(1, resolution.getVariables().size());
    }

    @Test
    @DisplayName("Lookup never guesses a kind for unknown names")
    void lookupUnknownIsEmpty() {
        VariableResolver resolver = new DefaultVariableResolver(null, null);

        assertTrue(resolver.lookup("x").isEmpty());
        assertTrue(resolver.lookup("").isEmpty());
    }

    @Test
    @DisplayName("Factor with 25 levels fails resolution")
    void shouldRejectTooManyLevels() {
        manual.put("big", ManualVariableConfig.factor(25));
        VariableResolver resolver = new DefaultVariableResolver(manual);

        FactorLevelRangeException e = assertThrows(FactorLevelRangeException.class, () -> resolver.lookup("big"));
        assertEquals(25, e.getLevelCount());
    }

    @Test
    @DisplayName("Manual factor with named levels and reference")
    void shouldResolveNamedFactor() {
        manual.put("tutor", ManualVariableConfig.factor(List.of("teacher", "none", "peer"), "none"));
        VariableResolver resolver = new DefaultVariableResolver(manual);

        VariableSpec tutor = resolver.lookup("tutor").orElseThrow();

        assertEquals(List.of("none", "peer", "teacher"), tutor.levels());
        assertEquals("none", tutor.referenceLevel());
    }

    @Test
    @DisplayName("Configured reference level applies to a data-derived factor")
    void dataFactorKeepsConfiguredReference() {
        manual.put("tutor", ManualVariableConfig.factor(List.of("none", "peer", "teacher"), "peer"));
        InMemoryDataProvider data = InMemoryDataProvider.fromValues(
                Map.of("tutor", List.of("teacher", "none", "peer", "peer", "none")));
        VariableResolver resolver = new DefaultVariableResolver(data, manual);

        VariableResolution resolution = resolver.resolve(List.of("tutor"));

        VariableSpec tutor = resolution.getVariables().get("tutor");
        assertEquals(List.of("none", "peer", "teacher"), tutor.levels());
        assertEquals("peer", tutor.referenceLevel());
        assertEquals(List.of("none", "teacher"), tutor.nonReferenceLevels());
        assertEquals(VariableSource.DATA, resolution.getSource("tutor").orElseThrow());
    }

    @Test
    @DisplayName("Configured reference keeps the observed levels, not the configured ones")
    void dataLevelsWinOverConfiguredLevels() {
        manual.put("origin", ManualVariableConfig.factor(List.of("Europe", "Japan", "Korea", "USA"), "USA"));
        InMemoryDataProvider data = InMemoryDataProvider.fromValues(
                Map.of("origin", List.of("USA", "Japan", "Europe")));
        VariableResolver resolver = new DefaultVariableResolver(data, manual);

        VariableSpec origin = resolver.lookup("origin").orElseThrow();

        assertEquals(List.of("Europe", "Japan", "USA"), origin.levels());
        assertEquals("USA", origin.referenceLevel());
    }

    @Test
    @DisplayName("Configured reference missing from the data fails resolution")
    void shouldRejectReferenceNotObservedInData() {
        manual.put("origin", ManualVariableConfig.factor(List.of("Europe", "Korea"), "Korea"));
        InMemoryDataProvider data = InMemoryDataProvider.fromValues(
                Map.of("origin", List.of("USA", "Japan", "Europe")));
        VariableResolver resolver = new DefaultVariableResolver(data, manual);

        ConfigurationException e = assertThrows(ConfigurationException.class, () -> resolver.lookup("origin"));
        assertEquals("origin", e.getSubject());
        assertEquals(Stage.RESOLUTION, e.getStage());
    }
}
