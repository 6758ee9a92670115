package com.modelspec.variable;

import com.modelspec.data.DataColumn;
import com.modelspec.data.DataProvider;
import com.modelspec.exception.UnresolvedVariableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Default implementation of VariableResolver.
 * Data-derived columns take precedence over manual configuration, except for
 * an explicitly configured reference level, which applies to the observed levels.
 */
public class DefaultVariableResolver implements VariableResolver {

    private static final Logger log = LoggerFactory.getLogger(DefaultVariableResolver.class);

    private final DataProvider dataProvider;
    private final Map<String, ManualVariableConfig> manualConfig;

    public DefaultVariableResolver(Map<String, ManualVariableConfig> manualConfig) {
        this(DataProvider.none(), manualConfig);
    }

    public DefaultVariableResolver(DataProvider dataProvider, Map<String, ManualVariableConfig> manualConfig) {
        this.dataProvider = dataProvider == null ? DataProvider.none() : dataProvider;
        this.manualConfig = manualConfig == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(manualConfig));
    }

    @Override
    public Optional<VariableSpec> lookup(String name) {
        return lookupWithSource(name).map(Binding::spec);
    }

    @Override
    public VariableResolution resolve(Collection<String> names) {
        Map<String, VariableSpec> variables = new LinkedHashMap<>();
        Map<String, VariableSource> sources = new LinkedHashMap<>();
        List<UnresolvedVariableException> unresolved = new ArrayList<>();

        for (String name : names) {
            if (variables.containsKey(name)) {
                continue;
            }
            Optional<Binding> binding = lookupWithSource(name);
            if (binding.isPresent()) {
                variables.put(name, binding.get().spec());
                sources.put(name, binding.get().source());
                log.debug("Resolved variable '{}' as {} from {}", name,
                        binding.get().spec().kind(), binding.get().source());
            } else {
                log.warn("Variable '{}' is not configured and not present in uploaded data", name);
                unresolved.add(new UnresolvedVariableException(name));
            }
        }

        return new VariableResolution(variables, sources, unresolved);
    }

    private Optional<Binding> lookupWithSource(String name) {
        if (name == null || name.isEmpty()) {
            return Optional.empty();
        }

        ManualVariableConfig config = manualConfig.get(name);
        Optional<DataColumn> column = dataProvider.column(name);
        if (column.isPresent()) {
            // Data levels win; only a configured reference level carries over
            String reference = config == null ? null : config.referenceLevel();
            return Optional.of(new Binding(column.get().toVariableSpec(reference), VariableSource.DATA));
        }

        if (config != null) {
            return Optional.of(new Binding(config.toSpec(name), VariableSource.MANUAL));
        }
        return Optional.empty();
    }

    private record Binding(VariableSpec spec, VariableSource source) {
    }
}
