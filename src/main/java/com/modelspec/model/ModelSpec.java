package com.modelspec.model;

import com.modelspec.cluster.ClusterSpec;
import com.modelspec.expansion.Atom;
import com.modelspec.expansion.ExpandedTerm;
import com.modelspec.variable.VariableKind;
import com.modelspec.variable.VariableSpec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable snapshot of a resolved model, consumed by the simulation engine,
 * the effect and correlation editors and the export generator.
 *
 * @param dependentVariable Dependent variable name
 * @param variables         Every referenced variable (dependent, predictors, slopes) in first-appearance order
 * @param terms             Expanded predictor terms, deduplicated, in formula order
 * @param clusters          Random-effect clusters, parents before children
 */
public record ModelSpec(
        String dependentVariable,
        Map<String, VariableSpec> variables,
        List<ExpandedTerm> terms,
        List<ClusterSpec> clusters
) {
    public ModelSpec {
        variables = Collections.unmodifiableMap(new LinkedHashMap<>(variables));
        terms = List.copyOf(terms);
        clusters = List.copyOf(clusters);
    }

    public VariableSpec variable(String name) {
        return variables.get(name);
    }

    /**
     * Labels of all expanded terms, e.g. ["x1", "origin[Japan]", "origin[Japan]:x1"].
     */
    public List<String> termLabels() {
        return terms.stream().map(ExpandedTerm::label).toList();
    }

    public boolean isMixedModel() {
        return !clusters.isEmpty();
    }

    /**
     * Distinct variables used in fixed-effect terms, in first-appearance order.
     */
    public List<String> predictorVariables() {
        Set<String> names = new LinkedHashSet<>();
        for (ExpandedTerm term : terms) {
            names.addAll(term.variables());
        }
        return new ArrayList<>(names);
    }

    /**
     * Continuous and binary variables that appear as main effects; these are the
     * predictors a correlation can be specified between.
     */
    public List<String> correlableVariables() {
        Set<String> names = new LinkedHashSet<>();
        for (ExpandedTerm term : terms) {
            if (term.isInteraction()) {
                continue;
            }
            Atom atom = term.atoms().get(0);
            VariableSpec spec = variables.get(atom.variable());
            if (spec != null && spec.kind() != VariableKind.FACTOR) {
                names.add(atom.variable());
            }
        }
        return new ArrayList<>(names);
    }

    /**
     * Factor predictors and their number of levels.
     */
    public Map<String, Integer> factorLevels() {
        Map<String, Integer> levels = new LinkedHashMap<>();
        for (String name : predictorVariables()) {
            VariableSpec spec = variables.get(name);
            if (spec.isFactor()) {
                levels.put(name, spec.levels().size());
            }
        }
        return levels;
    }
}
