package com.modelspec.design;

import com.modelspec.exception.ConfigurationException;
import com.modelspec.formula.expression.FormulaSyntax;
import com.modelspec.variable.ManualVariableConfig;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Factor-based (ANOVA) design: a continuous outcome {@code y} explained by
 * categorical factors and a selection of their pairwise interactions.
 * The design is turned into a formula and a manual variable configuration and
 * resolved through the same assembler as a typed formula.
 *
 * @param factors      Factors in display order
 * @param interactions Selected pairwise interactions, e.g. "group:dose"
 */
public record FactorDesign(List<FactorDefinition> factors, List<String> interactions) {

    public static final String DEPENDENT_VARIABLE = "y";

    public FactorDesign {
        factors = factors == null ? List.of() : List.copyOf(factors);
        interactions = interactions == null ? List.of() : List.copyOf(interactions);
        validate(factors, interactions);
    }

    public static FactorDesign of(List<FactorDefinition> factors) {
        return new FactorDesign(factors, List.of());
    }

    /**
     * Every pair of factors, in factor order ("a:b", "a:c", "b:c").
     */
    public List<String> allPairwiseInteractions() {
        List<String> pairs = new ArrayList<>();
        for (int i = 0; i < factors.size(); i++) {
            for (int j = i + 1; j < factors.size(); j++) {
                pairs.add(factors.get(i).name() + FormulaSyntax.Operators.COLON + factors.get(j).name());
            }
        }
        return pairs;
    }

    /**
     * Same factors with every pairwise interaction selected.
     */
    public FactorDesign withAllInteractions() {
        return new FactorDesign(factors, allPairwiseInteractions());
    }

    /**
     * Render the design as a formula, e.g. {@code y = group + dose + group:dose}.
     */
    public String toFormula() {
        List<String> terms = new ArrayList<>();
        for (FactorDefinition factor : factors) {
            terms.add(factor.name());
        }
        terms.addAll(interactions);
        return DEPENDENT_VARIABLE + " " + FormulaSyntax.Operators.EQUALS + " " + String.join(" + ", terms);
    }

    /**
     * Manual configuration for the outcome and every factor.
     */
    public Map<String, ManualVariableConfig> toVariableConfig() {
        Map<String, ManualVariableConfig> config = new LinkedHashMap<>();
        config.put(DEPENDENT_VARIABLE, ManualVariableConfig.continuous());
        for (FactorDefinition factor : factors) {
            config.put(factor.name(), factor.toVariableConfig());
        }
        return config;
    }

    private static void validate(List<FactorDefinition> factors, List<String> interactions) {
        if (factors.isEmpty()) {
            throw new ConfigurationException("Factor design needs at least one factor");
        }

        Set<String> names = new HashSet<>();
        for (FactorDefinition factor : factors) {
            if (factor.name() == null || factor.name().isBlank()) {
                throw new ConfigurationException("Factor name cannot be null or empty");
            }
            if (DEPENDENT_VARIABLE.equals(factor.name())) {
                throw new ConfigurationException(factor.name(),
                        "Factor cannot be named '" + DEPENDENT_VARIABLE + "', the outcome variable");
            }
            if (!names.add(factor.name())) {
                throw new ConfigurationException(factor.name(), "Duplicate factor: " + factor.name());
            }
        }

        for (String interaction : interactions) {
            String[] parts = interaction.split(String.valueOf(FormulaSyntax.Operators.COLON), -1);
            if (parts.length != 2 || parts[0].equals(parts[1])) {
                throw new ConfigurationException(interaction,
                        "Interaction '" + interaction + "' must join two different factors");
            }
            for (String part : parts) {
                if (!names.contains(part)) {
                    throw new ConfigurationException(part,
                            "Interaction '" + interaction + "' references unknown factor '" + part + "'");
                }
            }
        }
    }
}
