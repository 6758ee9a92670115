package com.modelspec.data;

import java.util.List;
import java.util.Optional;

/**
 * Supplies data-derived variable information from an uploaded dataset.
 * Implementations filter out empty and unnamed index columns.
 */
public interface DataProvider {

    /**
     * Look up a column by name.
     *
     * @param name Column name
     * @return Column description, or empty if the dataset has no such column
     */
    Optional<DataColumn> column(String name);

    /**
     * Column names in dataset order.
     */
    List<String> columnNames();

    /**
     * Provider for the "no data uploaded" state.
     */
    static DataProvider none() {
        return InMemoryDataProvider.EMPTY;
    }
}
