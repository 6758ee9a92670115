package com.modelspec.data;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Data provider over already-ingested column values.
 */
public class InMemoryDataProvider implements DataProvider {

    private static final Logger log = LoggerFactory.getLogger(InMemoryDataProvider.class);

    static final InMemoryDataProvider EMPTY = new InMemoryDataProvider(Map.of());

    private final Map<String, DataColumn> columns;

    public InMemoryDataProvider(Map<String, DataColumn> columns) {
        this.columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
    }

    /**
     * Build a provider from raw column values, detecting each column's kind.
     *
     * @param values Column name to observed values (nulls allowed)
     * @return Provider with one detected column per named column
     */
    public static InMemoryDataProvider fromValues(Map<String, ? extends List<?>> values) {
        Map<String, DataColumn> detected = new LinkedHashMap<>();
        for (Map.Entry<String, ? extends List<?>> entry : values.entrySet()) {
            String name = entry.getKey();
            if (ColumnTypeDetector.isIgnoredColumn(name)) {
                log.debug("Ignoring unnamed column '{}'", name);
                continue;
            }
            List<?> columnValues = entry.getValue() == null ? List.of() : entry.getValue();
            DataColumn column = ColumnTypeDetector.detect(name, columnValues);
            detected.put(name, column);
            log.debug("Detected column '{}' as {} with {} levels", name, column.kind(), column.levels().size());
        }
        return new InMemoryDataProvider(detected);
    }

    @Override
    public Optional<DataColumn> column(String name) {
        return Optional.ofNullable(columns.get(name));
    }

    @Override
    public List<String> columnNames() {
        return new ArrayList<>(columns.keySet());
    }
}
