package com.modelspec.model;

import com.modelspec.cluster.ClusterSpec;
import com.modelspec.expansion.ExpandedTerm;
import com.modelspec.formula.expression.FormulaSyntax;
import com.modelspec.variable.VariableKind;
import com.modelspec.variable.VariableSpec;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Renders a model specification back to canonical formula text.
 * Rendering then re-resolving yields an equal specification.
 */
public final class FormulaRenderer {

    private FormulaRenderer() {
    }

    /**
     * Render with the default interaction marker.
     */
    public static String render(ModelSpec spec) {
        return render(spec, FormulaSyntax.DEFAULT);
    }

    /**
     * Render a specification, e.g. {@code y ~ x + a + x:a + (1 + x|school)}.
     * Expanded dummies are regrouped into one term per variable tuple.
     */
    public static String render(ModelSpec spec, FormulaSyntax syntax) {
        String marker = String.valueOf(syntax.interactionMarker());

        // Regroup expanded terms by variable tuple
        Set<List<String>> tuples = new LinkedHashSet<>();
        for (ExpandedTerm term : spec.terms()) {
            tuples.add(term.variables());
        }

        List<String> parts = new ArrayList<>();
        for (List<String> tuple : tuples) {
            parts.add(String.join(marker, tuple));
        }
        for (ClusterSpec cluster : spec.clusters()) {
            parts.add(renderCluster(cluster));
        }

        return spec.dependentVariable() + " " + FormulaSyntax.Operators.TILDE + " " + String.join(" + ", parts);
    }

    /**
     * Render non-continuous variable declarations for export,
     * e.g. {@code a=(factor, 1, 2, 3), b=(binary)}.
     */
    public static String variableTypes(ModelSpec spec) {
        List<String> declarations = new ArrayList<>();
        for (Map.Entry<String, VariableSpec> entry : spec.variables().entrySet()) {
            VariableSpec variable = entry.getValue();
            if (variable.kind() == VariableKind.FACTOR) {
                declarations.add(entry.getKey() + "=(" + variable.kind().configName() + ", "
                        + String.join(", ", variable.levels()) + ")");
            } else if (variable.kind() == VariableKind.BINARY) {
                declarations.add(entry.getKey() + "=(" + variable.kind().configName() + ")");
            }
        }
        return String.join(", ", declarations);
    }

    private static String renderCluster(ClusterSpec cluster) {
        String effects = cluster.hasRandomSlope() ? "1 + " + cluster.slopeVariable() : "1";
        String grouping = cluster.isRoot()
                ? cluster.groupName()
                : cluster.parentGroup() + "/" + cluster.groupName();
        return "(" + effects + "|" + grouping + ")";
    }
}
