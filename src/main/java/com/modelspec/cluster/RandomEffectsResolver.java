package com.modelspec.cluster;

import com.modelspec.exception.ClusterHierarchyException;
import com.modelspec.exception.Stage;
import com.modelspec.exception.UnresolvedVariableException;
import com.modelspec.exception.UnsupportedRandomSlopeException;
import com.modelspec.formula.RawRandomEffect;
import com.modelspec.variable.VariableSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns random-effect clauses into a validated cluster hierarchy.
 * <p>
 * {@code (1|g/s)} declares {@code g} as a top-level cluster and {@code s} nested in it.
 * A random slope {@code (1 + x|...)} belongs to the level the clause declares
 * ({@code s} when nested). The outer group of a nested clause is an implied declaration
 * without a slope and merges with any top-level declaration of the same group.
 * Explicit redeclarations must agree exactly.
 */
public class RandomEffectsResolver {

    private static final Logger log = LoggerFactory.getLogger(RandomEffectsResolver.class);

    /**
     * Resolve clauses against resolved variables.
     *
     * @param clauses   Random-effect clauses in formula order
     * @param variables Resolved variables (slope variables must be present)
     * @return Validated hierarchy in declaration order
     */
    public ClusterHierarchy resolve(List<RawRandomEffect> clauses, Map<String, VariableSpec> variables) {
        Map<String, Declaration> declared = new LinkedHashMap<>();

        for (RawRandomEffect clause : clauses) {
            String slope = clause.slopeVariable();
            if (slope != null) {
                validateSlope(slope, clause.declaredGroup(), variables);
            }

            if (clause.isNested()) {
                declareImpliedParent(declared, clause.group(), clause);
                declare(declared, ClusterSpec.child(clause.subgroup(), clause.group(), slope), clause);
            } else {
                declare(declared, ClusterSpec.root(clause.group(), slope), clause);
            }
        }

        List<ClusterSpec> specs = new ArrayList<>();
        for (Declaration declaration : declared.values()) {
            specs.add(declaration.spec());
        }
        return new ClusterHierarchy(specs);
    }

    private void validateSlope(String slope, String group, Map<String, VariableSpec> variables) {
        VariableSpec spec = variables.get(slope);
        if (spec == null) {
            throw new UnresolvedVariableException(Stage.RANDOM_EFFECTS, slope);
        }
        if (spec.isFactor()) {
            throw new UnsupportedRandomSlopeException(slope, group);
        }
    }

    private void declareImpliedParent(Map<String, Declaration> declared, String group, RawRandomEffect clause) {
        Declaration existing = declared.get(group);
        if (existing == null) {
            declared.put(group, new Declaration(ClusterSpec.root(group), true, clause.text()));
            return;
        }
        if (!existing.spec().isRoot()) {
            throw new ClusterHierarchyException(group, "Group '" + group + "' is nested in '"
                    + existing.spec().parentGroup() + "' by " + existing.clause()
                    + " but used as an outer group by " + clause.text());
        }
    }

    private void declare(Map<String, Declaration> declared, ClusterSpec spec, RawRandomEffect clause) {
        String group = spec.groupName();
        Declaration existing = declared.get(group);

        if (existing == null) {
            declared.put(group, new Declaration(spec, false, clause.text()));
            return;
        }

        if (existing.implied()) {
            if (!spec.isRoot()) {
                throw new ClusterHierarchyException(group, "Group '" + group + "' is an outer group in "
                        + existing.clause() + " but nested in '" + spec.parentGroup() + "' by " + clause.text());
            }
            declared.put(group, new Declaration(spec, false, clause.text()));
            log.debug("Cluster '{}' from {} replaces implied declaration", group, clause.text());
            return;
        }

        if (!existing.spec().equals(spec)) {
            throw new ClusterHierarchyException(group, "Conflicting declarations of group '" + group
                    + "': " + existing.clause() + " and " + clause.text());
        }
        log.debug("Merged repeated declaration of cluster '{}'", group);
    }

    private record Declaration(ClusterSpec spec, boolean implied, String clause) {
    }
}
