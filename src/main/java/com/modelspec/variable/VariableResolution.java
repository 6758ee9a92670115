package com.modelspec.variable;

import com.modelspec.exception.UnresolvedVariableException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Result of resolving a set of identifiers.
 * Holds every binding that succeeded and one error per identifier that did not,
 * so callers can still preview the resolved part.
 */
public final class VariableResolution {

    private final Map<String, VariableSpec> variables;
    private final Map<String, VariableSource> sources;
    private final List<UnresolvedVariableException> unresolved;

    public VariableResolution(Map<String, VariableSpec> variables,
                              Map<String, VariableSource> sources,
                              List<UnresolvedVariableException> unresolved) {
        this.variables = Collections.unmodifiableMap(new LinkedHashMap<>(variables));
        this.sources = Collections.unmodifiableMap(new LinkedHashMap<>(sources));
        this.unresolved = List.copyOf(unresolved);
    }

    /**
     * Resolved variables in identifier order.
     */
    public Map<String, VariableSpec> getVariables() {
        return variables;
    }

    public Optional<VariableSource> getSource(String name) {
        return Optional.ofNullable(sources.get(name));
    }

    public List<UnresolvedVariableException> getUnresolved() {
        return unresolved;
    }

    public boolean isComplete() {
        return unresolved.isEmpty();
    }
}
