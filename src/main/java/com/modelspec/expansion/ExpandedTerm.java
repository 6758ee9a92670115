package com.modelspec.expansion;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Canonical predictor term consumed downstream: one atom for a main effect,
 * an ordered tuple of atoms for an interaction.
 *
 * @param atoms Atoms in the originating identifier order
 */
public record ExpandedTerm(List<Atom> atoms) {

    public ExpandedTerm {
        if (atoms == null || atoms.isEmpty()) {
            throw new IllegalArgumentException("Expanded term needs at least one atom");
        }
        atoms = List.copyOf(atoms);
        if (new HashSet<>(atoms).size() != atoms.size()) {
            throw new IllegalArgumentException("Duplicate atom in term " + atoms);
        }
    }

    public static ExpandedTerm of(Atom... atoms) {
        return new ExpandedTerm(List.of(atoms));
    }

    public boolean isInteraction() {
        return atoms.size() > 1;
    }

    /**
     * Variable names of the atoms, in order.
     */
    public List<String> variables() {
        return atoms.stream().map(Atom::variable).toList();
    }

    /**
     * Order-independent identity used for deduplication.
     */
    public Set<Atom> atomSet() {
        return Set.copyOf(atoms);
    }

    /**
     * Display label, e.g. "origin[Japan]:cyl[6]".
     */
    public String label() {
        return atoms.stream().map(Atom::label).collect(Collectors.joining(":"));
    }

    @Override
    public String toString() {
        return label();
    }
}
