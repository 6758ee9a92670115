package com.modelspec.variable;

import java.util.Collection;
import java.util.Optional;

/**
 * Binds identifiers to variable specifications.
 * Resolution is a pure lookup over the data provider and the manual configuration;
 * kinds are never guessed from formula text.
 */
public interface VariableResolver {

    /**
     * Look up a single variable.
     *
     * @param name Identifier
     * @return Specification, or empty if neither data nor configuration knows it
     * @throws com.modelspec.exception.FactorLevelRangeException if a factor has an unsupported level count
     */
    Optional<VariableSpec> lookup(String name);

    /**
     * Resolve every identifier, collecting unresolved ones instead of stopping at the first.
     *
     * @param names Identifiers in first-appearance order
     * @return Resolution with bindings and per-identifier errors
     */
    VariableResolution resolve(Collection<String> names);
}
