package com.modelspec.model;

import com.modelspec.cluster.ClusterHierarchy;
import com.modelspec.cluster.ClusterSpec;
import com.modelspec.cluster.RandomEffectsResolver;
import com.modelspec.exception.FormulaParseException;
import com.modelspec.exception.ModelSpecException;
import com.modelspec.exception.ModelValidationException;
import com.modelspec.expansion.ExpandedTerm;
import com.modelspec.expansion.InteractionExpander;
import com.modelspec.formula.FormulaParser;
import com.modelspec.formula.ParsedFormula;
import com.modelspec.formula.expression.FormulaSyntax;
import com.modelspec.variable.VariableResolution;
import com.modelspec.variable.VariableResolver;
import com.modelspec.variable.VariableSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs parse, variable resolution, interaction expansion and random-effect
 * resolution, then validates the result into an immutable {@link ModelSpec}.
 * <p>
 * Assembly is synchronous and has no side effects; the first failing stage ends it.
 */
public class ModelSpecAssembler {

    private static final Logger log = LoggerFactory.getLogger(ModelSpecAssembler.class);

    private final VariableResolver variableResolver;
    private final FormulaSyntax syntax;
    private final InteractionExpander expander = new InteractionExpander();
    private final RandomEffectsResolver randomEffectsResolver = new RandomEffectsResolver();

    public ModelSpecAssembler(VariableResolver variableResolver) {
        this(variableResolver, FormulaSyntax.DEFAULT);
    }

    public ModelSpecAssembler(VariableResolver variableResolver, FormulaSyntax syntax) {
        this.variableResolver = variableResolver;
        this.syntax = syntax == null ? FormulaSyntax.DEFAULT : syntax;
    }

    public FormulaSyntax getSyntax() {
        return syntax;
    }

    /**
     * Assemble a formula without cancellation.
     */
    public AssemblyResult assemble(String formula) {
        return assemble(formula, null);
    }

    /**
     * Assemble a formula on behalf of a live request.
     * The token is checked once, before any work starts.
     *
     * @param formula Formula text (blank means no formula yet)
     * @param token   Request token, or null
     * @return Empty, success, failed or cancelled result
     */
    public AssemblyResult assemble(String formula, ResolutionToken token) {
        if (token != null && !token.isValid()) {
            log.debug("Skipping superseded request {}", token);
            return AssemblyResult.cancelled();
        }

        ParsedFormula parsed;
        try {
            parsed = FormulaParser.parse(formula, syntax);
        } catch (ModelSpecException e) {
            log.debug("Parse failed: {}", e.getMessage());
            return AssemblyResult.failed(e, null);
        }

        if (parsed.isEmpty()) {
            return AssemblyResult.empty();
        }

        try {
            ModelSpec spec = build(parsed);
            log.debug("Assembled '{}' into {} terms and {} clusters",
                    parsed.text(), spec.terms().size(), spec.clusters().size());
            return AssemblyResult.success(spec, parsed);
        } catch (ModelSpecException e) {
            log.debug("Assembly of '{}' failed at {}: {}", parsed.text(), e.getStage(), e.getMessage());
            return AssemblyResult.failed(e, parsed);
        }
    }

    /**
     * Resolve a formula, throwing the first error instead of wrapping it.
     *
     * @param formula Formula text
     * @return Resolved model specification
     * @throws ModelSpecException on the first failing stage, including blank input
     */
    public ModelSpec resolve(String formula) {
        ParsedFormula parsed = FormulaParser.parse(formula, syntax);
        if (parsed.isEmpty()) {
            String text = formula == null ? "" : formula;
            throw new FormulaParseException("Invalid formula at position 0: Formula is empty in '"
                    + text + "'", text, 0);
        }
        return build(parsed);
    }

    private ModelSpec build(ParsedFormula parsed) {
        // Resolve dependent and fixed-effect variables
        List<String> names = new ArrayList<>();
        names.add(parsed.dependent());
        names.addAll(parsed.predictorVariables());
        VariableResolution resolution = variableResolver.resolve(names);
        if (!resolution.isComplete()) {
            throw resolution.getUnresolved().get(0);
        }
        Map<String, VariableSpec> variables = new LinkedHashMap<>(resolution.getVariables());

        // Expand terms
        List<ExpandedTerm> terms = expander.expand(parsed.terms(), variables);

        // Resolve random effects; unresolved slopes are reported by the random-effects stage
        List<String> slopes = parsed.slopeVariables().stream()
                .filter(name -> !variables.containsKey(name))
                .toList();
        if (!slopes.isEmpty()) {
            variables.putAll(variableResolver.resolve(slopes).getVariables());
        }
        ClusterHierarchy hierarchy = randomEffectsResolver.resolve(parsed.randomEffects(), variables);

        validate(parsed, variables, terms, hierarchy.getClusters());
        return new ModelSpec(parsed.dependent(), variables, terms, hierarchy.getClusters());
    }

    private void validate(ParsedFormula parsed, Map<String, VariableSpec> variables,
                          List<ExpandedTerm> terms, List<ClusterSpec> clusters) {
        String dependent = parsed.dependent();
        if (parsed.predictorVariables().contains(dependent)) {
            throw new ModelValidationException(dependent,
                    "Dependent variable '" + dependent + "' cannot also be a predictor");
        }
        if (terms.isEmpty()) {
            throw new ModelValidationException(parsed.text(),
                    "Model needs at least one fixed-effect predictor");
        }
        for (ClusterSpec cluster : clusters) {
            if (variables.containsKey(cluster.groupName())) {
                throw new ModelValidationException(cluster.groupName(), "Grouping variable '"
                        + cluster.groupName() + "' is also used as a model variable");
            }
        }
    }
}
