package com.modelspec.data;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;
import java.util.Map;

/**
 * Factory for creating a DataProvider from a JSON object of column arrays,
 * e.g. {@code {"origin": ["USA", "Japan"], "mpg": [21.0, 30.5]}}.
 */
public class DataColumnsFactory {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Create a provider from JSON column data.
     *
     * @param json JSON object mapping column names to value arrays
     * @return Provider with detected columns, or the empty provider for blank input
     */
    public static DataProvider fromJson(String json) {
        if (json == null || json.isBlank()) {
            return DataProvider.none();
        }
        return InMemoryDataProvider.fromValues(parseJson(json));
    }

    private static Map<String, List<Object>> parseJson(String json) {
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, List<Object>>>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid column data JSON: " + e.getMessage(), e);
        }
    }
}
