package com.modelspec.config;

import com.modelspec.data.DataProvider;
import com.modelspec.design.FactorDesign;
import com.modelspec.variable.DefaultVariableResolver;
import com.modelspec.variable.ManualVariableConfig;
import com.modelspec.variable.VariableResolver;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Model definition loaded from YAML.
 *
 * @param name         Model name
 * @param formula      Formula text (derived from the factor design when only a design is given)
 * @param variables    Manually configured variables
 * @param data         Uploaded column data
 * @param factorDesign Factor-based design, or null
 */
public record ModelDefinition(
        String name,
        String formula,
        Map<String, ManualVariableConfig> variables,
        DataProvider data,
        FactorDesign factorDesign
) {
    public ModelDefinition {
        variables = variables == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(variables));
        data = data == null ? DataProvider.none() : data;
        if ((formula == null || formula.isBlank()) && factorDesign != null) {
            formula = factorDesign.toFormula();
        }
    }

    public boolean isFactorDesign() {
        return factorDesign != null;
    }

    /**
     * Build a resolver over the uploaded data and the manual configuration.
     * Factor design variables are added to the manual configuration; explicit entries win.
     */
    public VariableResolver toVariableResolver() {
        Map<String, ManualVariableConfig> config = new LinkedHashMap<>();
        if (factorDesign != null) {
            config.putAll(factorDesign.toVariableConfig());
        }
        config.putAll(variables);
        return new DefaultVariableResolver(data, config);
    }
}
