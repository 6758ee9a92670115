package com.modelspec.expansion;

import com.modelspec.exception.Stage;
import com.modelspec.exception.UnresolvedVariableException;
import com.modelspec.formula.RawTerm;
import com.modelspec.variable.VariableSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Expands raw terms into canonical expanded terms.
 * <p>
 * A factor contributes one atom per non-reference level; continuous and binary
 * variables contribute a single atom. An interaction is the full Cartesian product
 * of its participants' atoms, first participant varying slowest. Terms with the same
 * unordered atom set are kept once, at their first appearance.
 */
public class InteractionExpander {

    private static final Logger log = LoggerFactory.getLogger(InteractionExpander.class);

    /**
     * Expand raw terms against resolved variables.
     *
     * @param rawTerms  Raw terms in formula order
     * @param variables Resolved variables by name
     * @return Deduplicated expanded terms in first-appearance order
     * @throws UnresolvedVariableException if a term references an unresolved variable
     */
    public List<ExpandedTerm> expand(List<RawTerm> rawTerms, Map<String, VariableSpec> variables) {
        Map<Set<Atom>, ExpandedTerm> terms = new LinkedHashMap<>();

        for (RawTerm rawTerm : rawTerms) {
            List<List<Atom>> choices = new ArrayList<>();
            for (String name : rawTerm.variables()) {
                VariableSpec spec = variables.get(name);
                if (spec == null) {
                    throw new UnresolvedVariableException(Stage.EXPANSION, name);
                }
                choices.add(atomsFor(spec));
            }

            List<List<Atom>> product = cartesianProduct(choices);
            for (List<Atom> atoms : product) {
                ExpandedTerm term = new ExpandedTerm(atoms);
                ExpandedTerm existing = terms.putIfAbsent(term.atomSet(), term);
                if (existing != null) {
                    log.debug("Dropping duplicate term {} (already present as {})", term, existing);
                }
            }
            log.debug("Expanded raw term {} into {} terms", rawTerm, product.size());
        }

        return List.copyOf(terms.values());
    }

    /**
     * Atom choices contributed by one variable.
     */
    public static List<Atom> atomsFor(VariableSpec spec) {
        return switch (spec.kind()) {
            case CONTINUOUS, BINARY -> List.of(Atom.of(spec.name()));
            case FACTOR -> spec.nonReferenceLevels().stream()
                    .map(level -> Atom.dummy(spec.name(), level))
                    .toList();
        };
    }

    private static List<List<Atom>> cartesianProduct(List<List<Atom>> choices) {
        List<List<Atom>> product = new ArrayList<>();
        product.add(List.of());
        for (List<Atom> options : choices) {
            List<List<Atom>> next = new ArrayList<>(product.size() * options.size());
            for (List<Atom> prefix : product) {
                for (Atom atom : options) {
                    List<Atom> combination = new ArrayList<>(prefix);
                    combination.add(atom);
                    next.add(combination);
                }
            }
            product = next;
        }
        return product;
    }
}
