package com.modelspec.design;

import com.modelspec.exception.ConfigurationException;
import com.modelspec.model.ModelSpec;
import com.modelspec.model.ModelSpecAssembler;
import com.modelspec.variable.DefaultVariableResolver;
import com.modelspec.variable.VariableKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FactorDesign.
 */
class FactorDesignTest {

    private final FactorDefinition group = FactorDefinition.of("group", 3);
    private final FactorDefinition dose = FactorDefinition.of("dose", List.of("low", "mid", "high"), "low");

    @Test
    @DisplayName("Should render the design as a formula")
    void shouldRenderFormula() {
        FactorDesign design = new FactorDesign(List.of(group, dose), List.of("group:dose"));

        assertEquals("y = group + dose + group:dose", design.toFormula());
        assertEquals("y = group + dose", FactorDesign.of(List.of(group, dose)).toFormula());
    }

    @Test
    @DisplayName("Should list every pairwise interaction")
    void shouldListPairwiseInteractions() {
        FactorDesign design = FactorDesign.of(List.of(group, dose, FactorDefinition.of("site", 2)));

        assertEquals(List.of("group:dose", "group:site", "dose:site"), design.allPairwiseInteractions());
        assertEquals(3, design.withAllInteractions().interactions().size());
    }

    @Test
    @DisplayName("Should configure y as continuous and every factor")
    void shouldBuildVariableConfig() {
        FactorDesign design = FactorDesign.of(List.of(group, dose));

        Map<String, ?> config = design.toVariableConfig();

        assertEquals(List.of("y", "group", "dose"), List.copyOf(config.keySet()));
        assertEquals(VariableKind.CONTINUOUS, design.toVariableConfig().get("y").kind());
        assertEquals(VariableKind.FACTOR, design.toVariableConfig().get("dose").kind());
    }

    @Test
    @DisplayName("Should resolve through the assembler")
    void shouldResolve() {
        FactorDesign design = new FactorDesign(List.of(group, dose), List.of("group:dose"));
        ModelSpecAssembler assembler = new ModelSpecAssembler(new DefaultVariableResolver(design.toVariableConfig()));

        ModelSpec spec = assembler.resolve(design.toFormula());

        assertEquals(List.of(
                "group[2]", "group[3]", "dose[high]", "dose[mid]",
                "group[2]:dose[high]", "group[2]:dose[mid]", "group[3]:dose[high]", "group[3]:dose[mid]"),
                spec.termLabels());
        assertEquals(Map.of("group", 3, "dose", 3), spec.factorLevels());
    }

    @Test
    @DisplayName("Should reject interactions with unknown factors")
    void shouldRejectUnknownFactor() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> new FactorDesign(List.of(group, dose), List.of("group:site")));

        assertEquals("site", e.getSubject());
    }

    @Test
    @DisplayName("Should reject invalid designs")
    void shouldRejectInvalidDesigns() {
        assertThrows(ConfigurationException.class, () -> FactorDesign.of(List.of()));
        assertThrows(ConfigurationException.class, () -> FactorDesign.of(List.of(group, group)));
        assertThrows(ConfigurationException.class, () -> FactorDesign.of(List.of(FactorDefinition.of("y", 2))));
        assertThrows(ConfigurationException.class,
                () -> new FactorDesign(List.of(group, dose), List.of("group:group")));
        assertThrows(ConfigurationException.class,
                () -> new FactorDesign(List.of(group, dose), List.of("group:dose:group")));
    }
}
